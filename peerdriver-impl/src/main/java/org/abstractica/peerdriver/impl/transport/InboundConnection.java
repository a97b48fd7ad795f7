package org.abstractica.peerdriver.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;

/**
 * One accepted connection feeding an {@link InboundEndpoint}.
 */
class InboundConnection
{
    private static final Logger LOG = LoggerFactory.getLogger(InboundConnection.class);
    private static final int READ_BUFFER_SIZE = 65536;

    private final InboundEndpoint endpoint;
    private final SocketChannel channel;
    private final SelectionKey key;
    private final FrameAccumulator accumulator;
    private final ByteBuffer readBuffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
    private final SocketAddress remoteAddress;

    InboundConnection(InboundEndpoint endpoint, SocketChannel channel, SelectionKey key, int maxFrameSize)
            throws IOException
    {
        this.endpoint = endpoint;
        this.channel = channel;
        this.key = key;
        this.accumulator = new FrameAccumulator(maxFrameSize);
        this.remoteAddress = channel.getRemoteAddress();
    }

    SocketAddress getRemoteAddress()
    {
        return remoteAddress;
    }

    /**
     * Reads what is available and queues completed frames on the endpoint.
     *
     * <p>Stops early, and pauses this connection, when the endpoint's queue
     * is full.</p>
     *
     * @return false once the sender has closed the connection
     * @throws IOException on read failure or a malformed frame
     */
    boolean read() throws IOException
    {
        while (true)
        {
            if (endpoint.isSaturated())
            {
                endpoint.pause(this);
                return true;
            }

            readBuffer.clear();
            int n = channel.read(readBuffer);
            if (n < 0)
            {
                if (accumulator.hasPartialFrame())
                {
                    LOG.warn("Connection from {} closed mid-frame; partial frame dropped", remoteAddress);
                }
                return false;
            }
            if (n == 0)
            {
                return true;
            }
            readBuffer.flip();
            accumulator.feed(readBuffer, endpoint::enqueue);
        }
    }

    void suspendReading()
    {
        if (key.isValid())
        {
            key.interestOps(0);
        }
    }

    void resumeReading()
    {
        if (key.isValid())
        {
            key.interestOps(SelectionKey.OP_READ);
        }
    }

    void close()
    {
        endpoint.removed(this);
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing connection from {}", remoteAddress, e);
        }
    }
}
