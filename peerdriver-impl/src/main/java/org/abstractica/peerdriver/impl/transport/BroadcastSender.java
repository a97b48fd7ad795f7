package org.abstractica.peerdriver.impl.transport;

import org.abstractica.peerdriver.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans frames out to every subscribed peer.
 *
 * <p>Each subscriber gets its own {@link OutboundConnection}. Publishing
 * writes the frame to every subscriber in subscription order, all within
 * one send timeout; a failure on one subscriber does not stop the others.
 * Once the deadline has passed, each remaining subscriber still gets one
 * non-blocking write attempt. Subscribers whose connection has been closed
 * are dropped from the set.</p>
 */
public class BroadcastSender implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(BroadcastSender.class);

    private final Transport transport;
    private final Timeout sendTimeout;
    private final List<OutboundConnection> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Creates a broadcast sender with no subscribers.
     *
     * @param transport   the transport subscriber addresses belong to
     * @param sendTimeout bound for connecting and for each subscriber write
     */
    public BroadcastSender(Transport transport, Timeout sendTimeout)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
    }

    /**
     * Connects a new subscriber.
     *
     * @param address the subscriber's broadcast inbound address
     * @throws IOException              if the connection fails
     * @throws IllegalArgumentException if the address is malformed
     */
    public void subscribe(String address) throws IOException
    {
        subscribers.add(OutboundConnection.open(transport, address, sendTimeout));
    }

    /**
     * Writes a frame to every subscriber.
     *
     * @param frame the frame to publish (position to limit, left untouched)
     * @return failures keyed by subscriber address, empty if all writes succeeded
     */
    public Map<String, IOException> publish(ByteBuffer frame)
    {
        Objects.requireNonNull(frame, "frame");

        Map<String, IOException> failures = new LinkedHashMap<>();
        List<OutboundConnection> dropped = new ArrayList<>();
        long deadline = OutboundConnection.deadline(sendTimeout);
        for (OutboundConnection subscriber : subscribers)
        {
            try
            {
                subscriber.write(frame.duplicate(), deadline);
            }
            catch (IOException e)
            {
                failures.put(subscriber.getAddress(), e);
                if (!subscriber.isOpen())
                {
                    dropped.add(subscriber);
                }
            }
        }

        for (OutboundConnection subscriber : dropped)
        {
            LOG.warn("Dropping broadcast subscriber {}", subscriber.getAddress());
            subscribers.remove(subscriber);
        }
        return failures;
    }

    /**
     * Returns the number of subscribers.
     *
     * @return subscriber count
     */
    public int getSubscriberCount()
    {
        return subscribers.size();
    }

    @Override
    public void close()
    {
        for (OutboundConnection subscriber : subscribers)
        {
            subscriber.close();
        }
        subscribers.clear();
    }
}
