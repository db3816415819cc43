package com.questrail.diameter.server;

import com.questrail.diameter.message.Message;

import java.util.Objects;
import java.util.Optional;

/**
 * Sent out of the server when it fails to read or route a message, for
 * example because of a bad dictionary, a malformed message or a network error.
 *
 * @param conn    peer that caused the error
 * @param message message that caused the error; {@code null} when the
 *                failure happened before a message could be identified
 * @param error   the failure
 */
public record ErrorReport(Conn conn, Message message, Throwable error) {

    public ErrorReport {
        Objects.requireNonNull(conn, "conn");
        Objects.requireNonNull(error, "error");
    }

    public Optional<Message> messageIfPresent() {
        return Optional.ofNullable(message);
    }
}
