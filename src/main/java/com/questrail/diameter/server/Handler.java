package com.questrail.diameter.server;

import com.questrail.diameter.message.Message;

/**
 * Serves inbound Diameter messages, for example CER or DWR.
 *
 * <p>{@code serveMessage} should write any answer to the {@link Conn} and then
 * return. Returning signals that the message is done and that the connection
 * may read the next one; messages of one connection are never handled
 * concurrently.</p>
 *
 * <p>Because both peers may originate requests, a handler receives answers
 * as well as requests; {@link Message#header()} tells them apart.</p>
 */
@FunctionalInterface
public interface Handler
{
    void serveMessage(Conn conn, Message message);
}
