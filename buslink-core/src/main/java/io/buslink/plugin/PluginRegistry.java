package io.buslink.plugin;

import io.buslink.BusConfig;
import io.buslink.message.EventMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The plugins of one client, with their init and teardown lifecycle.
 *
 * <p>Plugins run in registration order and are torn down in reverse order. Registration is
 * only allowed before {@link #init}.
 *
 * <p>This class is thread-safe.
 */
public final class PluginRegistry implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PluginRegistry.class.getName());

    private final List<BusPlugin> plugins = new CopyOnWriteArrayList<>();
    private boolean initialized;

    public synchronized PluginRegistry register(BusPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        if (initialized) {
            throw new IllegalStateException("Cannot register plugin "
                    + plugin.getClass().getName() + " after the registry was initialized");
        }
        plugins.add(plugin);
        return this;
    }

    public List<BusPlugin> plugins() {
        return Collections.unmodifiableList(plugins);
    }

    /**
     * Initializes every plugin. Subsequent calls are no-ops until {@link #teardown()}.
     *
     * @param config the client configuration
     * @throws Exception the first plugin failure; plugins after it are not initialized
     */
    public synchronized void init(BusConfig config) throws Exception {
        if (initialized) {
            return;
        }
        for (BusPlugin plugin : plugins) {
            plugin.init(config);
        }
        initialized = true;
    }

    /**
     * Runs one hook on every plugin.
     *
     * <p>For {@code BEFORE_*} points the first exception propagates. For {@code AFTER_*}
     * points each failure is logged and the remaining plugins still run.
     *
     * @param point   the hook point
     * @param message the current event
     * @throws Exception if a {@code before} hook fails
     */
    public void execute(HookPoint point, EventMessage message) throws Exception {
        for (BusPlugin plugin : plugins) {
            switch (point) {
                case BEFORE_EVENT_SENT -> plugin.beforeEventSent(message);
                case BEFORE_EVENT_EXECUTION -> plugin.beforeEventExecution(message);
                case AFTER_EVENT_SENT -> runAfter(point, plugin, message);
                case AFTER_EVENT_EXECUTION -> runAfter(point, plugin, message);
                default -> throw new IllegalArgumentException("Unknown hook point " + point);
            }
        }
    }

    private static void runAfter(HookPoint point, BusPlugin plugin, EventMessage message) {
        try {
            if (point == HookPoint.AFTER_EVENT_SENT) {
                plugin.afterEventSent(message);
            } else {
                plugin.afterEventExecution(message);
            }
        } catch (Exception e) {
            logger.log(Level.WARNING, "Plugin " + plugin.getClass().getName() + " failed in "
                    + point + " for " + message, e);
        }
    }

    /**
     * Tears down every plugin in reverse registration order. Failures are logged and do not
     * stop the remaining plugins. Only has an effect after {@link #init}.
     */
    public synchronized void teardown() {
        if (!initialized) {
            return;
        }
        List<BusPlugin> reversed = new ArrayList<>(plugins);
        Collections.reverse(reversed);
        for (BusPlugin plugin : reversed) {
            try {
                plugin.teardown();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Plugin " + plugin.getClass().getName() + " failed to tear down", e);
            }
        }
        initialized = false;
    }

    public synchronized boolean isInitialized() {
        return initialized;
    }

    @Override
    public void close() {
        teardown();
    }
}
