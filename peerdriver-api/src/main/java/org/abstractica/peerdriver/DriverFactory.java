package org.abstractica.peerdriver;

import org.slf4j.Logger;

/**
 * Factory for creating Driver instances.
 *
 * <p>Use the builder to configure the driver before creation:</p>
 * <pre>{@code
 * DriverFactory factory = new DefaultDriverFactory();
 * Driver driver = factory.builder()
 *     .protocol("tcp")
 *     .sendTimeout(Timeout.ofMillis(1000))
 *     .receiveTimeout(Timeout.INFINITE)
 *     .logger(LoggerFactory.getLogger("worker-1"))
 *     .build();
 * }</pre>
 */
public interface DriverFactory
{
    /**
     * Creates a new driver builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Driver.
     */
    interface Builder
    {
        /**
         * Sets the transport protocol.
         *
         * <p>Optional. Defaults to {@code "tcp"}.</p>
         *
         * @param protocol the protocol identifier
         * @return this builder
         */
        Builder protocol(String protocol);

        /**
         * Sets the timeout for connecting and writing to peers.
         *
         * <p>Optional. Defaults to {@link Timeout#INFINITE}.</p>
         *
         * @param timeout the send timeout
         * @return this builder
         */
        Builder sendTimeout(Timeout timeout);

        /**
         * Sets how long a single multiplexed wait may block.
         *
         * <p>Optional. Defaults to {@link Timeout#INFINITE}. A wait that
         * times out is retried; it is not reported to the caller.</p>
         *
         * @param timeout the receive timeout
         * @return this builder
         */
        Builder receiveTimeout(Timeout timeout);

        /**
         * Sets the logger used for the driver's message trace.
         *
         * <p>Optional. Defaults to a no-op logger.</p>
         *
         * @param logger the logger
         * @return this builder
         */
        Builder logger(Logger logger);

        /**
         * Sets the host written into this driver's own addresses.
         *
         * <p>Optional. Defaults to the local host's resolved IP address.</p>
         *
         * @param host the host name or IP address peers should connect to
         * @return this builder
         */
        Builder advertisedHost(String host);

        /**
         * Sets the message serializer.
         *
         * <p>Optional. Both sides of a connection must use the same serializer.</p>
         *
         * @param serializer the serializer
         * @return this builder
         */
        Builder serializer(MessageSerializer serializer);

        /**
         * Sets the maximum encoded message size in bytes.
         *
         * <p>Optional. Has a sensible default.</p>
         *
         * @param size maximum message size
         * @return this builder
         */
        Builder maxMessageSize(int size);

        /**
         * Builds the driver, binding its inbound endpoints.
         *
         * @return the configured driver
         * @throws IllegalArgumentException if the protocol is not supported
         * @throws DriverSetupException     if the endpoints cannot be created
         */
        Driver build();
    }
}
