package com.questrail.diameter.server;

import com.questrail.diameter.codec.DiameterHeader;
import com.questrail.diameter.config.DiameterConfigurationException;
import com.questrail.diameter.message.Message;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * ServeMux
 * =============================================================================
 * Diameter command multiplexer. It matches the command of an inbound message
 * against a table of registered keys and calls the matching handler.
 *
 * <h2>Dispatch keys</h2>
 * A key is the command's short name from the message's dictionary followed by
 * {@code R} for requests or {@code A} for answers: {@code "CER"}, {@code "DWA"},
 * {@code "CCR"}. Messages the dictionary cannot resolve go to the handler
 * registered under {@link #CATCH_ALL}, if any.
 *
 * <h2>Misses</h2>
 * When no handler matches, an {@link ErrorReport} carrying an
 * {@link UnhandledMessageException} is sent to {@link #errorReports()}. No
 * answer is generated; the handler, never the multiplexer, writes answers.
 *
 * <h2>Concurrency</h2>
 * Every connection dispatches through the same table. Lookups hold the read
 * lock only while reading the table, so handlers run without it.
 * Registration takes the write lock and is meant for configuration time.
 *
 * <p>Each {@code ServeMux} is an explicitly constructed object; there is no
 * process-wide instance.</p>
 */
public final class ServeMux implements Handler, ErrorReporter
{
    /** Reserved key receiving messages the dictionary cannot resolve. */
    public static final String CATCH_ALL = "ALL";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Handler> entries = new HashMap<>();
    private final ErrorMailbox errors;
    private final RegistrationPolicy policy;

    public ServeMux() {
        this(RegistrationPolicy.REPLACE);
    }

    public ServeMux(RegistrationPolicy policy) {
        this(policy, new ErrorMailbox());
    }

    public ServeMux(RegistrationPolicy policy, ErrorMailbox errors) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    /**
     * Register {@code handler} for dispatch key {@code key}.
     *
     * @throws DiameterConfigurationException if {@code handler} is null, or if
     *         the key is taken and the policy is {@link RegistrationPolicy#REJECT}
     */
    public ServeMux handle(String key, Handler handler)
    {
        Objects.requireNonNull(key, "key");
        if (handler == null) {
            throw new DiameterConfigurationException("DIAM: nil handler for " + key);
        }

        lock.writeLock().lock();
        try {
            if (policy == RegistrationPolicy.REJECT && entries.containsKey(key)) {
                throw new DiameterConfigurationException("DIAM: handler already registered for " + key);
            }
            entries.put(key, handler);
        }
        finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    /**
     * Snapshot of the registered keys.
     */
    public Set<String> registeredKeys()
    {
        lock.readLock().lock();
        try {
            return Set.copyOf(entries.keySet());
        }
        finally {
            lock.readLock().unlock();
        }
    }

    public RegistrationPolicy registrationPolicy()
    {
        return policy;
    }

    @Override
    public void serveMessage(Conn conn, Message message)
    {
        Objects.requireNonNull(conn, "conn");
        Objects.requireNonNull(message, "message");

        Handler handler = lookup(dispatchKey(message));
        if (handler == null) {
            error(new ErrorReport(conn, message, new UnhandledMessageException()));
            return;
        }
        handler.serveMessage(conn, message);
    }

    /**
     * Key under which {@code message} is dispatched: {@code short + "R"|"A"},
     * or {@link #CATCH_ALL} when the dictionary has no entry.
     */
    static String dispatchKey(Message message)
    {
        DiameterHeader header = message.header();
        Optional<String> shortName = message.dictionary()
                .findCommand(header.applicationId(), header.commandCode());
        if (shortName.isEmpty()) {
            return CATCH_ALL;
        }
        return shortName.get() + (header.isRequest() ? "R" : "A");
    }

    private Handler lookup(String key)
    {
        lock.readLock().lock();
        try {
            return entries.get(key);
        }
        finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void error(ErrorReport report)
    {
        errors.offer(report);
    }

    @Override
    public ErrorReports errorReports()
    {
        return errors.view();
    }
}
