/**
 * Diameter connection serving: the accept loop ({@link com.questrail.diameter.server.DiameterServer}),
 * one endpoint per peer, the handler contract and the command-keyed
 * {@link com.questrail.diameter.server.ServeMux}.
 *
 * <h2>Threading</h2>
 * Each connection reads and dispatches on its own thread, one message at a
 * time. Handlers registered with a mux are shared by every connection and
 * must be safe for concurrent use.
 */
package com.questrail.diameter.server;
