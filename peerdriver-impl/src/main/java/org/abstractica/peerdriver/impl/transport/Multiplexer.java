package org.abstractica.peerdriver.impl.transport;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Waits on several inbound endpoints at once.
 *
 * <p>A single selector watches the listening channels and every accepted
 * connection. {@link #poll(Timeout)} blocks until at least one endpoint has
 * a complete frame queued or the timeout elapses, and reports which
 * endpoints are ready. {@link #nextReady(Set)} applies the tie-break:
 * unicast before broadcast.</p>
 *
 * <p>Not thread-safe except for {@link #close()}, which may be called from
 * any thread to wake a blocked poll.</p>
 */
public class Multiplexer implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(Multiplexer.class);

    /**
     * Order in which ready endpoints are served.
     */
    private static final ChannelKind[] PRECEDENCE = {
            ChannelKind.UNICAST_INBOUND,
            ChannelKind.BROADCAST_INBOUND
    };

    private final Selector selector;
    private final Map<ChannelKind, InboundEndpoint> endpoints = new EnumMap<>(ChannelKind.class);

    /**
     * Creates a multiplexer with its own selector.
     *
     * @throws IOException if the selector cannot be opened
     */
    public Multiplexer() throws IOException
    {
        this.selector = Selector.open();
    }

    /**
     * Registers an inbound endpoint.
     *
     * @param endpoint the endpoint to watch
     * @throws IOException           if registration fails
     * @throws IllegalStateException if an endpoint of the same kind is registered
     */
    public void register(InboundEndpoint endpoint) throws IOException
    {
        Objects.requireNonNull(endpoint, "endpoint");
        if (endpoints.containsKey(endpoint.getKind()))
        {
            throw new IllegalStateException(endpoint.getKind() + " endpoint already registered");
        }
        endpoint.register(selector);
        endpoints.put(endpoint.getKind(), endpoint);
    }

    /**
     * Waits until an endpoint has a complete frame or the timeout elapses.
     *
     * <p>If frames are already queued the call does not block; it only
     * collects whatever else is immediately readable.</p>
     *
     * @param timeout how long to block when nothing is queued
     * @return the kinds of endpoints with queued frames, empty on timeout
     * @throws IOException if the selector fails
     */
    public Set<ChannelKind> poll(Timeout timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");

        int selected;
        if (!readyKinds().isEmpty() || timeout.millis() == 0)
        {
            selected = selector.selectNow();
        }
        else if (timeout.isInfinite())
        {
            selected = selector.select();
        }
        else
        {
            selected = selector.select(timeout.millis());
        }

        if (selected > 0)
        {
            processSelectedKeys();
        }
        return readyKinds();
    }

    /**
     * Picks the endpoint to serve next from a set of ready kinds.
     *
     * @param ready kinds with queued frames
     * @return the kind to serve, or empty if none is ready
     */
    public static Optional<ChannelKind> nextReady(Set<ChannelKind> ready)
    {
        for (ChannelKind kind : PRECEDENCE)
        {
            if (ready.contains(kind))
            {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Removes the oldest queued frame from an endpoint.
     *
     * @param kind the endpoint kind
     * @return the frame, or empty if none is queued
     */
    public Optional<byte[]> take(ChannelKind kind)
    {
        InboundEndpoint endpoint = endpoints.get(kind);
        if (endpoint == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(endpoint.poll());
    }

    /**
     * Returns whether the multiplexer is still usable.
     *
     * @return false after {@link #close()}
     */
    public boolean isOpen()
    {
        return selector.isOpen();
    }

    /**
     * Closes the selector, waking a blocked poll.
     *
     * <p>Registered endpoints are not closed.</p>
     */
    @Override
    public void close()
    {
        try
        {
            selector.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing selector", e);
        }
    }

    private Set<ChannelKind> readyKinds()
    {
        Set<ChannelKind> ready = EnumSet.noneOf(ChannelKind.class);
        for (InboundEndpoint endpoint : endpoints.values())
        {
            if (endpoint.hasPending())
            {
                ready.add(endpoint.getKind());
            }
        }
        return Collections.unmodifiableSet(ready);
    }

    private void processSelectedKeys()
    {
        Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
        while (keys.hasNext())
        {
            SelectionKey key = keys.next();
            keys.remove();

            try
            {
                if (key.attachment() instanceof InboundEndpoint endpoint)
                {
                    if (key.isAcceptable())
                    {
                        acceptConnections(endpoint);
                    }
                }
                else if (key.attachment() instanceof InboundConnection connection)
                {
                    if (key.isReadable())
                    {
                        readConnection(key, connection);
                    }
                }
            }
            catch (CancelledKeyException e)
            {
                LOG.debug("Skipping cancelled key");
            }
        }
    }

    private void acceptConnections(InboundEndpoint endpoint)
    {
        try
        {
            endpoint.acceptPending(selector);
        }
        catch (IOException e)
        {
            LOG.warn("{} endpoint failed to accept connection: {}", endpoint.getKind(), e.getMessage());
        }
    }

    private void readConnection(SelectionKey key, InboundConnection connection)
    {
        try
        {
            if (!connection.read())
            {
                LOG.debug("Connection from {} closed by peer", connection.getRemoteAddress());
                key.cancel();
                connection.close();
            }
        }
        catch (IOException e)
        {
            LOG.warn("Dropping connection from {}: {}", connection.getRemoteAddress(), e.getMessage());
            key.cancel();
            connection.close();
        }
    }
}
