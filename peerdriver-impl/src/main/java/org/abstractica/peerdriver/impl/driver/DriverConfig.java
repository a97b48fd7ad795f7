package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.MessageSerializer;
import org.abstractica.peerdriver.Timeout;
import org.abstractica.peerdriver.impl.transport.Transport;
import org.slf4j.Logger;

import java.util.Objects;

/**
 * Validated configuration for a {@link DefaultDriver}.
 *
 * @param transport      transport for every endpoint
 * @param sendTimeout    bound for connects and writes
 * @param receiveTimeout bound for one multiplexed wait
 * @param logger         logger for the driver's message trace
 * @param advertisedHost host written into own addresses
 * @param serializer     message codec
 * @param maxMessageSize largest encoded message accepted or sent
 */
public record DriverConfig(
        Transport transport,
        Timeout sendTimeout,
        Timeout receiveTimeout,
        Logger logger,
        String advertisedHost,
        MessageSerializer serializer,
        int maxMessageSize
)
{
    public DriverConfig
    {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(sendTimeout, "sendTimeout");
        Objects.requireNonNull(receiveTimeout, "receiveTimeout");
        Objects.requireNonNull(logger, "logger");
        Objects.requireNonNull(advertisedHost, "advertisedHost");
        Objects.requireNonNull(serializer, "serializer");
        if (maxMessageSize <= 0)
        {
            throw new IllegalArgumentException("maxMessageSize must be positive: " + maxMessageSize);
        }
    }
}
