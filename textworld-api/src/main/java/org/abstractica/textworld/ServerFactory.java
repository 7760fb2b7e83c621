package org.abstractica.textworld;

import java.net.InetAddress;

/**
 * Factory for creating Server instances.
 *
 * <pre>{@code
 * ServerFactory factory = new TcpServerFactory();
 * Server server = factory.builder()
 *     .port(4000)
 *     .protocol(protocol)
 *     .maxOutboundQueueSize(512)
 *     .build();
 * }</pre>
 */
public interface ServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Server.
     */
    interface Builder
    {
        /**
         * Sets the port to listen on.
         *
         * <p>Port 0 picks a free port.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the message protocol.
         *
         * @param protocol the protocol definition
         * @return this builder
         */
        Builder protocol(Protocol protocol);

        /**
         * Sets the address to bind to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the maximum number of concurrent connections.
         *
         * <p>Optional. Defaults to unlimited.</p>
         *
         * @param maxConnections maximum connections, 0 for unlimited
         * @return this builder
         */
        Builder maxConnections(int maxConnections);

        /**
         * Sets the maximum number of queued outbound messages per connection.
         *
         * <p>Optional. Defaults to 256.</p>
         *
         * @param size maximum queue size
         * @return this builder
         */
        Builder maxOutboundQueueSize(int size);

        /**
         * Sets the maximum length of one inbound line in characters.
         *
         * <p>Optional. Defaults to 65536.</p>
         *
         * @param length maximum line length
         * @return this builder
         */
        Builder maxLineLength(int length);

        /**
         * Builds the server.
         *
         * @return the configured server
         * @throws IllegalStateException if required parameters are missing
         */
        Server build();
    }
}
