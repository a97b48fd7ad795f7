package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.Driver;
import org.abstractica.peerdriver.DriverFactory;
import org.abstractica.peerdriver.MessageSerializer;
import org.abstractica.peerdriver.Timeout;
import org.abstractica.peerdriver.impl.serialization.EnvelopeSerializer;
import org.abstractica.peerdriver.impl.transport.TcpTransport;
import org.abstractica.peerdriver.impl.transport.Transport;
import org.abstractica.peerdriver.impl.transport.Transports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.NOPLogger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;

/**
 * Default implementation of DriverFactory.
 */
public class DefaultDriverFactory implements DriverFactory
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultDriverFactory.class);

    public static final int DEFAULT_MAX_MESSAGE_SIZE = 16 * 1024 * 1024;

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private Transport transport = new TcpTransport();
        private Timeout sendTimeout = Timeout.INFINITE;
        private Timeout receiveTimeout = Timeout.INFINITE;
        private Logger logger = NOPLogger.NOP_LOGGER;
        private String advertisedHost; // Resolved at build time when not set
        private MessageSerializer serializer = new EnvelopeSerializer();
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;

        @Override
        public Builder protocol(String protocol)
        {
            this.transport = Transports.forProtocol(protocol);
            return this;
        }

        /**
         * Sets the transport directly.
         *
         * <p>Use this to supply a transport with non-default settings, such
         * as an {@link org.abstractica.peerdriver.impl.transport.IpcTransport}
         * with its own socket directory.</p>
         *
         * @param transport the transport to use
         * @return this builder
         */
        public DefaultBuilder transport(Transport transport)
        {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        @Override
        public Builder sendTimeout(Timeout timeout)
        {
            this.sendTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        @Override
        public Builder receiveTimeout(Timeout timeout)
        {
            this.receiveTimeout = Objects.requireNonNull(timeout, "timeout");
            return this;
        }

        @Override
        public Builder logger(Logger logger)
        {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        @Override
        public Builder advertisedHost(String host)
        {
            Objects.requireNonNull(host, "host");
            if (host.isBlank())
            {
                throw new IllegalArgumentException("Advertised host must not be blank");
            }
            this.advertisedHost = host;
            return this;
        }

        @Override
        public Builder serializer(MessageSerializer serializer)
        {
            this.serializer = Objects.requireNonNull(serializer, "serializer");
            return this;
        }

        @Override
        public Builder maxMessageSize(int size)
        {
            if (size <= 0)
            {
                throw new IllegalArgumentException("Max message size must be positive: " + size);
            }
            this.maxMessageSize = size;
            return this;
        }

        @Override
        public Driver build()
        {
            String host = (advertisedHost != null) ? advertisedHost : resolveLocalHost();
            DriverConfig config = new DriverConfig(
                    transport,
                    sendTimeout,
                    receiveTimeout,
                    logger,
                    host,
                    serializer,
                    maxMessageSize
            );
            return new DefaultDriver(config);
        }

        private static String resolveLocalHost()
        {
            try
            {
                return InetAddress.getLocalHost().getHostAddress();
            }
            catch (UnknownHostException e)
            {
                String loopback = InetAddress.getLoopbackAddress().getHostAddress();
                LOG.warn("Cannot resolve local host ({}), advertising {}", e.getMessage(), loopback);
                return loopback;
            }
        }
    }
}
