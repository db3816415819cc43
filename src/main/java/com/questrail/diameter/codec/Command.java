package com.questrail.diameter.codec;

import java.util.Objects;

/**
 * Display name of a Diameter command, e.g. {@code Device-Watchdog-Request}
 * abbreviated as {@code DWR}.
 *
 * <p>Only used to format headers for people. Dispatch never looks at it; the
 * multiplexer resolves commands through the configured dictionary.</p>
 */
public record Command(String name, String abbrev) {

    /** Returned for command codes missing from {@link CommandNames}. */
    public static final Command UNKNOWN = new Command("Unknown", "?");

    public Command {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(abbrev, "abbrev");
    }
}
