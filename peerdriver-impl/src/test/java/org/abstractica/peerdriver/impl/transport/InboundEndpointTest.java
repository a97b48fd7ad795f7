package org.abstractica.peerdriver.impl.transport;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.Timeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the bounded receive queue of {@link InboundEndpoint}.
 */
class InboundEndpointTest
{
    private static final String HOST = "127.0.0.1";
    private static final int FRAME_SIZE = 4096;
    private static final int HIGH_WATER = 64 * 1024;
    private static final int READ_CHUNK = 64 * 1024;

    private final TcpTransport transport = new TcpTransport();
    private final List<AutoCloseable> resources = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception
    {
        for (int i = resources.size() - 1; i >= 0; i--)
        {
            resources.get(i).close();
        }
    }

    @Test
    void fullQueue_blocksSenderUntilDrained() throws IOException
    {
        InboundEndpoint endpoint = track(InboundEndpoint.bind(
                ChannelKind.UNICAST_INBOUND, transport, HOST, 1024 * 1024, HIGH_WATER));
        Multiplexer multiplexer = track(new Multiplexer());
        multiplexer.register(endpoint);
        OutboundConnection sender = track(OutboundConnection.open(
                transport, endpoint.getAddress(), Timeout.ofMillis(200)));

        // Receiver keeps polling but never takes a frame
        byte[] body = new byte[FRAME_SIZE];
        int written = 0;
        boolean timedOut = false;
        while (written < 50_000)
        {
            try
            {
                sender.write(FrameAccumulator.frame(body));
                written++;
            }
            catch (SocketTimeoutException e)
            {
                timedOut = true;
                break;
            }
            if (written % 100 == 0)
            {
                multiplexer.poll(Timeout.ofMillis(0));
            }
        }

        assertTrue(timedOut, "Sender should block once the receiver stops taking, wrote " + written + " frames");

        int queued = 0;
        while (endpoint.poll() != null)
        {
            queued++;
        }
        int queueBound = (HIGH_WATER + READ_CHUNK) / FRAME_SIZE + 1;
        assertTrue(queued > 0, "Some frames should have been read before the queue filled");
        assertTrue(queued <= queueBound, "Queued " + queued + " frames, bound is " + queueBound);

        // Draining resumes reading; everything written is eventually delivered
        int received = queued;
        long deadline = System.currentTimeMillis() + 10_000;
        while (received < written && System.currentTimeMillis() < deadline)
        {
            multiplexer.poll(Timeout.ofMillis(50));
            while (endpoint.poll() != null)
            {
                received++;
            }
        }
        assertEquals(written, received);
    }

    @Test
    void bind_rejectsNonPositiveHighWater()
    {
        assertThrows(IllegalArgumentException.class,
                () -> InboundEndpoint.bind(ChannelKind.UNICAST_INBOUND, transport, HOST, 1024, 0));
    }

    @Test
    void poll_emptyQueue_returnsNull() throws IOException
    {
        InboundEndpoint endpoint = track(InboundEndpoint.bind(ChannelKind.BROADCAST_INBOUND, transport, HOST, 1024));

        assertFalse(endpoint.hasPending());
        assertNull(endpoint.poll());
        assertEquals(ChannelKind.BROADCAST_INBOUND, endpoint.getKind());
    }

    private <T extends AutoCloseable> T track(T resource)
    {
        resources.add(resource);
        return resource;
    }
}
