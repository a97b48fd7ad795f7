package org.abstractica.peerdriver.impl.transport;

import org.abstractica.peerdriver.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A connected channel that writes frames to one remote endpoint.
 *
 * <p>The channel runs in non-blocking mode with a private selector so that
 * connecting and writing can be bounded by the send timeout. Writes are
 * serialized by a lock; frames from concurrent callers never interleave.</p>
 *
 * <p>If a timeout strikes after part of a frame has been written, the
 * stream can no longer be parsed by the receiver, so the connection is
 * closed.</p>
 */
public class OutboundConnection implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(OutboundConnection.class);

    private final String address;
    private final SocketChannel channel;
    private final Selector writeSelector;
    private final SelectionKey writeKey;
    private final Timeout sendTimeout;
    private final ReentrantLock writeLock = new ReentrantLock();

    private OutboundConnection(
            String address,
            SocketChannel channel,
            Selector writeSelector,
            SelectionKey writeKey,
            Timeout sendTimeout
    )
    {
        this.address = address;
        this.channel = channel;
        this.writeSelector = writeSelector;
        this.writeKey = writeKey;
        this.sendTimeout = sendTimeout;
    }

    /**
     * Connects to a remote endpoint.
     *
     * @param transport   the transport the address belongs to
     * @param address     the remote address string
     * @param sendTimeout bound for the connect and for each later write
     * @return the connected channel
     * @throws IOException              if the connection cannot be established in time
     * @throws IllegalArgumentException if the address is malformed
     */
    public static OutboundConnection open(Transport transport, String address, Timeout sendTimeout) throws IOException
    {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(sendTimeout, "sendTimeout");

        SocketAddress remote = transport.parseAddress(address);
        SocketChannel channel = transport.openChannel();
        Selector selector = null;
        try
        {
            channel.configureBlocking(false);
            selector = Selector.open();
            SelectionKey key = channel.register(selector, 0);

            if (!channel.connect(remote))
            {
                key.interestOps(SelectionKey.OP_CONNECT);
                long deadline = deadline(sendTimeout);
                while (!channel.finishConnect())
                {
                    if (!await(selector, deadline))
                    {
                        throw new SocketTimeoutException("Connect to " + address + " timed out after " + sendTimeout);
                    }
                }
                key.interestOps(0);
            }

            LOG.debug("Connected to {}", address);
            return new OutboundConnection(address, channel, selector, key, sendTimeout);
        }
        catch (IOException | RuntimeException e)
        {
            closeQuietly(channel, selector);
            throw e;
        }
    }

    /**
     * Returns the remote address string.
     *
     * @return the address this connection was opened with
     */
    public String getAddress()
    {
        return address;
    }

    /**
     * Returns whether the connection can still be written to.
     *
     * @return false after close or after a failed partial write
     */
    public boolean isOpen()
    {
        return channel.isOpen();
    }

    /**
     * Writes a complete frame, waiting at most the send timeout.
     *
     * <p>This method is thread-safe.</p>
     *
     * @param frame the frame to write (position to limit)
     * @throws SocketTimeoutException if the frame could not be written in time
     * @throws IOException            if the write fails or the connection is closed
     */
    public void write(ByteBuffer frame) throws IOException
    {
        write(frame, deadline(sendTimeout));
    }

    /**
     * Writes a complete frame, waiting at most until a shared deadline.
     *
     * <p>Used when one logical send spans several connections.</p>
     *
     * @param frame    the frame to write (position to limit)
     * @param deadline {@link System#nanoTime()} value after which waiting stops,
     *                 or {@link Long#MAX_VALUE} to wait indefinitely
     * @throws SocketTimeoutException if the frame could not be written in time
     * @throws IOException            if the write fails or the connection is closed
     */
    void write(ByteBuffer frame, long deadline) throws IOException
    {
        Objects.requireNonNull(frame, "frame");

        writeLock.lock();
        try
        {
            if (!channel.isOpen())
            {
                throw new ClosedChannelException();
            }

            int total = frame.remaining();
            try
            {
                channel.write(frame);
                while (frame.hasRemaining())
                {
                    writeKey.interestOps(SelectionKey.OP_WRITE);
                    if (!await(writeSelector, deadline))
                    {
                        throw new SocketTimeoutException("Write to " + address + " timed out after " + sendTimeout);
                    }
                    channel.write(frame);
                }
            }
            catch (IOException e)
            {
                if (frame.remaining() != total)
                {
                    LOG.warn("Closing connection to {} after partial write: {}", address, e.getMessage());
                    close();
                }
                throw e;
            }
            finally
            {
                if (writeKey.isValid())
                {
                    writeKey.interestOps(0);
                }
            }
        }
        finally
        {
            writeLock.unlock();
        }
    }

    @Override
    public void close()
    {
        closeQuietly(channel, writeSelector);
    }

    /**
     * Waits for the selector's registered operation until the deadline.
     *
     * @return false if the deadline passed first
     */
    private static boolean await(Selector selector, long deadline) throws IOException
    {
        if (deadline == Long.MAX_VALUE)
        {
            selector.select();
        }
        else
        {
            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0)
            {
                return false;
            }
            selector.select(selectMillis(remainingNanos));
        }
        selector.selectedKeys().clear();
        return true;
    }

    /**
     * Converts a positive remaining wait to a select timeout.
     *
     * <p>Rounds up: {@code select(0)} blocks indefinitely.</p>
     */
    static long selectMillis(long remainingNanos)
    {
        return (remainingNanos + 999_999) / 1_000_000;
    }

    /**
     * Converts a timeout into a {@link System#nanoTime()} deadline.
     *
     * @return the deadline, or {@link Long#MAX_VALUE} for an infinite timeout
     */
    static long deadline(Timeout timeout)
    {
        if (timeout.isInfinite())
        {
            return Long.MAX_VALUE;
        }
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeout.millis());
    }

    private static void closeQuietly(SocketChannel channel, Selector selector)
    {
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing channel", e);
        }

        if (selector != null)
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
    }
}
