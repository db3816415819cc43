package com.questrail.diameter.codec;

import java.util.Map;

/**
 * Static table of the base protocol command codes (RFC 6733 §3.1), used to
 * render headers in logs.
 */
public final class CommandNames
{
    private static final Map<Integer, Command> BASE = Map.of(
            257, new Command("Capabilities-Exchange", "CE"),
            258, new Command("Re-Auth", "RA"),
            271, new Command("Accounting", "AC"),
            274, new Command("Abort-Session", "AS"),
            275, new Command("Session-Termination", "ST"),
            280, new Command("Device-Watchdog", "DW"),
            282, new Command("Disconnect-Peer", "DP")
    );

    private CommandNames() {}

    /**
     * Resolves the display name of a command.
     *
     * <p>Known codes get a {@code -Request}/{@code R} or {@code -Answer}/{@code A}
     * suffix depending on {@code request}. Unknown codes yield
     * {@link Command#UNKNOWN} whatever the direction.</p>
     */
    public static Command lookup(int commandCode, boolean request)
    {
        Command base = BASE.get(commandCode);
        if (base == null) {
            return Command.UNKNOWN;
        }
        return request
                ? new Command(base.name() + "-Request", base.abbrev() + "R")
                : new Command(base.name() + "-Answer", base.abbrev() + "A");
    }
}
