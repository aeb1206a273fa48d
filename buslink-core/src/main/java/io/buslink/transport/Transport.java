package io.buslink.transport;

/**
 * Common lifecycle of every transport role.
 *
 * <p>The owning client calls {@link #open()} once before first use and {@link #close()}
 * once at shutdown. Both default to no-ops for transports without connections to manage.
 * Each concrete transport declares its own configuration type explicitly and is built
 * from it by application code or an integration module.
 */
public interface Transport extends AutoCloseable {

    /**
     * Prepares the transport for use, e.g. opens connections.
     *
     * @throws Exception if the transport cannot be opened
     */
    default void open() throws Exception {
    }

    /**
     * Releases the transport's resources, e.g. closes connections.
     *
     * @throws Exception if cleanup fails
     */
    @Override
    default void close() throws Exception {
    }
}
