package com.questrail.diameter.transport;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether an accept failure is temporary.
 *
 * <p>Temporary failures, typically resource exhaustion, are retried by the
 * accept loop with a backoff. Anything else ends the loop.</p>
 */
@FunctionalInterface
public interface AcceptErrorClassifier
{
    /**
     * Default classification: accept timeouts, file descriptor exhaustion and
     * connections aborted between SYN and accept are temporary.
     */
    AcceptErrorClassifier DEFAULT = new AcceptErrorClassifier() {
        private final List<String> temporaryMessages = List.of(
                "too many open files",
                "resource temporarily unavailable",
                "software caused connection abort",
                "connection reset");

        @Override
        public boolean isTemporary(IOException error) {
            if (error instanceof SocketTimeoutException) {
                return true;
            }
            String message = error.getMessage();
            if (message == null) {
                return false;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            return temporaryMessages.stream().anyMatch(lower::contains);
        }
    };

    boolean isTemporary(IOException error);
}
