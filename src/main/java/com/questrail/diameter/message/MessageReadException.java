package com.questrail.diameter.message;

import com.questrail.diameter.codec.DiameterDecodeException;

import java.util.Optional;

/**
 * A message could not be read completely. When the header was decoded before
 * the failure, the partially identified message (header, empty payload) is
 * attached so error reports can name it.
 */
public final class MessageReadException extends DiameterDecodeException
{
    private final transient Message partialMessage;

    public MessageReadException(String message, Message partialMessage) {
        super(message);
        this.partialMessage = partialMessage;
    }

    public MessageReadException(String message, Message partialMessage, Throwable cause) {
        super(message, cause);
        this.partialMessage = partialMessage;
    }

    public Optional<Message> partialMessage() {
        return Optional.ofNullable(partialMessage);
    }
}
