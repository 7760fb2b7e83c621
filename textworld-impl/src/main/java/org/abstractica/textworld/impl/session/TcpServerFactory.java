package org.abstractica.textworld.impl.session;

import org.abstractica.textworld.Protocol;
import org.abstractica.textworld.Server;
import org.abstractica.textworld.ServerFactory;
import org.abstractica.textworld.impl.protocol.JsonProtocol;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Default implementation of ServerFactory.
 *
 * <p>Creates TcpServer instances using a builder pattern.</p>
 */
public class TcpServerFactory implements ServerFactory
{
    @Override
    public Builder builder()
    {
        return new TcpBuilder();
    }

    public static class TcpBuilder implements Builder
    {
        private int port = -1;
        private JsonProtocol protocol;
        private InetAddress bindAddress;
        private int maxConnections = 0; // 0 = unlimited
        private int maxOutboundQueueSize = 256;
        private int maxLineLength = 65536;

        @Override
        public Builder port(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public Builder protocol(Protocol protocol)
        {
            Objects.requireNonNull(protocol, "protocol");
            if (!(protocol instanceof JsonProtocol))
            {
                throw new IllegalArgumentException("Protocol must be a JsonProtocol instance");
            }
            this.protocol = (JsonProtocol) protocol;
            return this;
        }

        @Override
        public Builder bindAddress(InetAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        @Override
        public Builder maxConnections(int maxConnections)
        {
            if (maxConnections < 0)
            {
                throw new IllegalArgumentException("maxConnections must be >= 0: " + maxConnections);
            }
            this.maxConnections = maxConnections;
            return this;
        }

        @Override
        public Builder maxOutboundQueueSize(int size)
        {
            if (size <= 0)
            {
                throw new IllegalArgumentException("maxOutboundQueueSize must be positive: " + size);
            }
            this.maxOutboundQueueSize = size;
            return this;
        }

        @Override
        public Builder maxLineLength(int length)
        {
            if (length <= 0)
            {
                throw new IllegalArgumentException("maxLineLength must be positive: " + length);
            }
            this.maxLineLength = length;
            return this;
        }

        @Override
        public Server build()
        {
            if (port < 0)
            {
                throw new IllegalStateException("Port must be specified");
            }
            if (protocol == null)
            {
                throw new IllegalStateException("Protocol must be specified");
            }

            InetSocketAddress socketAddress;
            if (bindAddress != null)
            {
                socketAddress = new InetSocketAddress(bindAddress, port);
            }
            else
            {
                socketAddress = new InetSocketAddress(port);
            }

            return new TcpServer(
                    socketAddress,
                    protocol,
                    maxConnections,
                    maxOutboundQueueSize,
                    maxLineLength
            );
        }
    }
}
