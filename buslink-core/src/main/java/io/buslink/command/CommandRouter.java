package io.buslink.command;

import io.buslink.UnsupportedCommandException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routes a command to the handler registered for its concrete type.
 *
 * <p>Routes are fixed at build time. A command with no route fails with
 * {@link UnsupportedCommandException}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CommandRouter router = CommandRouter.builder()
 *     .route(SendEventCommand.class, cmd -> transport.sendEvent(cmd.message(), cmd.options()))
 *     .route(CloseTransportCommand.class, cmd -> transport.close())
 *     .build();
 * router.handle(command);
 * }</pre>
 */
public final class CommandRouter implements CommandHandler {
    private final Map<Class<? extends Command>, CommandHandler> routes;

    private CommandRouter(Builder builder) {
        this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.routes));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void handle(Command command) throws Exception {
        Objects.requireNonNull(command, "command");
        CommandHandler handler = routes.get(command.getClass());
        if (handler == null) {
            throw new UnsupportedCommandException(
                    "Did not recognise command " + command.getClass().getSimpleName());
        }
        handler.handle(command);
    }

    public boolean supports(Class<? extends Command> type) {
        return routes.containsKey(type);
    }

    public Set<Class<? extends Command>> supportedTypes() {
        return routes.keySet();
    }

    /**
     * Handler for one command type.
     *
     * @param <C> the command type
     */
    @FunctionalInterface
    public interface Route<C extends Command> {
        void handle(C command) throws Exception;
    }

    /** Builder for {@link CommandRouter}. */
    public static final class Builder {
        private final Map<Class<? extends Command>, CommandHandler> routes = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers the handler for one command type.
         *
         * @param type  the concrete command class
         * @param route the handler
         * @param <C>   the command type
         * @return this builder
         * @throws IllegalArgumentException if a route for {@code type} already exists
         */
        public <C extends Command> Builder route(Class<C> type, Route<? super C> route) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(route, "route");
            if (routes.containsKey(type)) {
                throw new IllegalArgumentException("Duplicate route for " + type.getSimpleName());
            }
            routes.put(type, command -> route.handle(type.cast(command)));
            return this;
        }

        public CommandRouter build() {
            return new CommandRouter(this);
        }
    }
}
