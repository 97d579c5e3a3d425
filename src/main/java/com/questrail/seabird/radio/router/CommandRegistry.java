package com.questrail.seabird.radio.router;

import com.questrail.seabird.radio.api.CommandHandler;
import com.questrail.seabird.radio.api.CommandSpec;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandRegistry
 * =============================================================================
 * Immutable mapping from command name to {@link CommandHandler}.
 *
 * <p>Built once at startup through {@link Builder}. After {@link Builder#build()}
 * the set of commands never changes, so lookups need no synchronization and
 * the help advertised in the handshake always matches what the router serves.</p>
 */
public final class CommandRegistry {

    private final Map<String, CommandHandler> handlers;

    private CommandRegistry(Map<String, CommandHandler> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<CommandHandler> lookup(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(handlers.get(name));
    }

    /**
     * Specs of every registered command, ordered by name.
     */
    public List<CommandSpec> specs() {
        return handlers.values().stream()
                .map(CommandHandler::spec)
                .sorted(Comparator.comparing(CommandSpec::name))
                .toList();
    }

    public int size() {
        return handlers.size();
    }

    public static final class Builder {
        private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @throws DuplicateCommandException if a handler with the same name
         *                                   was already registered
         */
        public Builder register(CommandHandler handler) {
            Objects.requireNonNull(handler, "handler");
            String name = Objects.requireNonNull(handler.spec(), "spec").name();
            if (handlers.putIfAbsent(name, handler) != null) {
                throw new DuplicateCommandException(name);
            }
            return this;
        }

        public Builder registerAll(Iterable<? extends CommandHandler> all) {
            for (CommandHandler handler : all) {
                register(handler);
            }
            return this;
        }

        public CommandRegistry build() {
            return new CommandRegistry(handlers);
        }
    }
}
