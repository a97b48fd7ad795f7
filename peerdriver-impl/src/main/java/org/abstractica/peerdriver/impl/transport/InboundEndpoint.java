package org.abstractica.peerdriver.impl.transport;

import org.abstractica.peerdriver.ChannelKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * A bound endpoint that receives frames from any number of senders.
 *
 * <p>The endpoint listens on a transport-assigned address. Accepted
 * connections are registered with the same selector as the listening
 * channel; each completed frame is appended to the endpoint's queue,
 * so frames from one sender stay in order.</p>
 *
 * <p>The queue is bounded. Once it holds {@code highWaterBytes} bytes or
 * {@link #MAX_PENDING_FRAMES} frames, connections stop reading until
 * {@link #poll()} drains it below the mark. Unread data then stays in the
 * socket buffers and senders block.</p>
 *
 * <p>Driven by {@link Multiplexer} from the receiving thread only.</p>
 */
public class InboundEndpoint implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(InboundEndpoint.class);

    /**
     * Default queued-bytes mark at which reading pauses.
     */
    public static final int DEFAULT_HIGH_WATER_BYTES = 8 * 1024 * 1024;

    /**
     * Queued-frames mark at which reading pauses.
     */
    public static final int MAX_PENDING_FRAMES = 16384;

    private final ChannelKind kind;
    private final Transport transport;
    private final ServerSocketChannel serverChannel;
    private final String address;
    private final int maxFrameSize;
    private final long highWaterBytes;

    private final Deque<byte[]> pending = new ArrayDeque<>();
    private long pendingBytes;
    private final List<InboundConnection> connections = new ArrayList<>();
    private final List<InboundConnection> paused = new ArrayList<>();

    private InboundEndpoint(
            ChannelKind kind,
            Transport transport,
            ServerSocketChannel serverChannel,
            String address,
            int maxFrameSize,
            long highWaterBytes
    )
    {
        this.kind = kind;
        this.transport = transport;
        this.serverChannel = serverChannel;
        this.address = address;
        this.maxFrameSize = maxFrameSize;
        this.highWaterBytes = highWaterBytes;
    }

    /**
     * Binds a new inbound endpoint with the default queue bound.
     *
     * @param kind           which inbound channel this endpoint serves
     * @param transport      the transport to bind with
     * @param advertisedHost the host written into the endpoint's address
     * @param maxFrameSize   the largest accepted frame in bytes
     * @return the bound endpoint
     * @throws IOException if binding fails
     */
    public static InboundEndpoint bind(
            ChannelKind kind,
            Transport transport,
            String advertisedHost,
            int maxFrameSize
    ) throws IOException
    {
        return bind(kind, transport, advertisedHost, maxFrameSize, DEFAULT_HIGH_WATER_BYTES);
    }

    /**
     * Binds a new inbound endpoint to a transport-assigned address.
     *
     * @param kind           which inbound channel this endpoint serves
     * @param transport      the transport to bind with
     * @param advertisedHost the host written into the endpoint's address
     * @param maxFrameSize   the largest accepted frame in bytes
     * @param highWaterBytes queued bytes at which reading pauses
     * @return the bound endpoint
     * @throws IOException if binding fails
     */
    public static InboundEndpoint bind(
            ChannelKind kind,
            Transport transport,
            String advertisedHost,
            int maxFrameSize,
            long highWaterBytes
    ) throws IOException
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(transport, "transport");
        if (highWaterBytes <= 0)
        {
            throw new IllegalArgumentException("highWaterBytes must be positive: " + highWaterBytes);
        }

        ServerSocketChannel server = transport.bindEphemeral();
        try
        {
            server.configureBlocking(false);
            String address = transport.formatAddress(server, advertisedHost);
            LOG.info("{} endpoint listening at {}", kind, address);
            return new InboundEndpoint(kind, transport, server, address, maxFrameSize, highWaterBytes);
        }
        catch (IOException | RuntimeException e)
        {
            server.close();
            throw e;
        }
    }

    /**
     * Returns which inbound channel this endpoint serves.
     *
     * @return the channel kind
     */
    public ChannelKind getKind()
    {
        return kind;
    }

    /**
     * Returns the address peers connect to.
     *
     * @return the address string
     */
    public String getAddress()
    {
        return address;
    }

    /**
     * Registers the listening channel with a selector.
     *
     * @param selector the selector to register with
     * @throws IOException if registration fails
     */
    void register(Selector selector) throws IOException
    {
        serverChannel.register(selector, SelectionKey.OP_ACCEPT, this);
    }

    /**
     * Accepts every pending connection and registers it for reading.
     *
     * @param selector the selector the listening channel is registered with
     * @throws IOException if accepting fails
     */
    void acceptPending(Selector selector) throws IOException
    {
        SocketChannel channel;
        while ((channel = serverChannel.accept()) != null)
        {
            try
            {
                channel.configureBlocking(false);
                SelectionKey key = channel.register(selector, SelectionKey.OP_READ);
                InboundConnection connection = new InboundConnection(this, channel, key, maxFrameSize);
                key.attach(connection);
                connections.add(connection);
                LOG.debug("{} endpoint accepted connection from {}", kind, connection.getRemoteAddress());
            }
            catch (IOException e)
            {
                LOG.warn("{} endpoint failed to register accepted connection", kind, e);
                channel.close();
            }
        }
    }

    void enqueue(byte[] frame)
    {
        pending.addLast(frame);
        pendingBytes += frame.length;
    }

    boolean isSaturated()
    {
        return pendingBytes >= highWaterBytes || pending.size() >= MAX_PENDING_FRAMES;
    }

    /**
     * Stops a connection from reading until the queue drains.
     */
    void pause(InboundConnection connection)
    {
        if (!paused.contains(connection))
        {
            connection.suspendReading();
            paused.add(connection);
            LOG.debug("{} endpoint queue full ({} frames, {} bytes); pausing {}",
                    kind, pending.size(), pendingBytes, connection.getRemoteAddress());
        }
    }

    void removed(InboundConnection connection)
    {
        connections.remove(connection);
        paused.remove(connection);
    }

    /**
     * Returns whether received frames are waiting.
     *
     * @return true if {@link #poll()} would return a frame
     */
    public boolean hasPending()
    {
        return !pending.isEmpty();
    }

    /**
     * Removes and returns the oldest received frame.
     *
     * <p>Paused connections resume reading once the queue is below its
     * bound again.</p>
     *
     * @return the frame, or null if none is waiting
     */
    public byte[] poll()
    {
        byte[] frame = pending.pollFirst();
        if (frame != null)
        {
            pendingBytes -= frame.length;
            if (!paused.isEmpty() && !isSaturated())
            {
                for (InboundConnection connection : paused)
                {
                    connection.resumeReading();
                }
                paused.clear();
            }
        }
        return frame;
    }

    @Override
    public void close()
    {
        for (InboundConnection connection : new ArrayList<>(connections))
        {
            connection.close();
        }
        connections.clear();
        paused.clear();

        try
        {
            serverChannel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing {} endpoint", kind, e);
        }
        transport.release(address);
        LOG.info("{} endpoint at {} closed", kind, address);
    }
}
