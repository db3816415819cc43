package com.questrail.diameter.dict;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable in-memory {@link Dictionary} built from explicit entries.
 *
 * <p>{@link #baseProtocol()} is the dictionary a server uses when none is
 * configured. It covers the RFC 6733 base commands: application 0 (common
 * messages) and application 3 (base accounting).</p>
 */
public final class StaticDictionary implements Dictionary
{
    /** Diameter common messages application. */
    public static final long BASE_APPLICATION = 0L;

    /** Diameter base accounting application. */
    public static final long BASE_ACCOUNTING_APPLICATION = 3L;

    private static final StaticDictionary BASE_PROTOCOL = builder()
            .addCommand(BASE_APPLICATION, 257, "CE")
            .addCommand(BASE_APPLICATION, 258, "RA")
            .addCommand(BASE_APPLICATION, 274, "AS")
            .addCommand(BASE_APPLICATION, 275, "ST")
            .addCommand(BASE_APPLICATION, 280, "DW")
            .addCommand(BASE_APPLICATION, 282, "DP")
            .addCommand(BASE_ACCOUNTING_APPLICATION, 271, "AC")
            .build();

    private final Map<Key, String> commands;

    private StaticDictionary(Map<Key, String> commands) {
        this.commands = Collections.unmodifiableMap(new HashMap<>(commands));
    }

    /**
     * The built-in base protocol dictionary.
     */
    public static StaticDictionary baseProtocol() {
        return BASE_PROTOCOL;
    }

    @Override
    public Optional<String> findCommand(long applicationId, int commandCode) {
        return Optional.ofNullable(commands.get(new Key(applicationId, commandCode)));
    }

    /**
     * Number of {@code (application, command)} entries.
     */
    public int size() {
        return commands.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    private record Key(long applicationId, int commandCode) {}

    public static final class Builder {
        private final Map<Key, String> commands = new HashMap<>();

        /**
         * Start from every entry of an existing static dictionary.
         */
        public Builder addAll(StaticDictionary other) {
            commands.putAll(Objects.requireNonNull(other, "other").commands);
            return this;
        }

        public Builder addCommand(long applicationId, int commandCode, String shortName) {
            Objects.requireNonNull(shortName, "shortName");
            if (shortName.isBlank()) {
                throw new IllegalArgumentException("shortName must not be blank");
            }
            if (applicationId < 0 || applicationId > 0xFFFF_FFFFL) {
                throw new IllegalArgumentException("applicationId out of range: " + applicationId);
            }
            if (commandCode < 0 || commandCode > 0xFF_FFFF) {
                throw new IllegalArgumentException("commandCode out of range: " + commandCode);
            }
            commands.put(new Key(applicationId, commandCode), shortName);
            return this;
        }

        public StaticDictionary build() {
            return new StaticDictionary(commands);
        }
    }
}
