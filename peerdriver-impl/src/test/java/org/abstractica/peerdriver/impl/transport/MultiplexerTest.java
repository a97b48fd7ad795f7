package org.abstractica.peerdriver.impl.transport;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.Timeout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Multiplexer} with real loopback TCP endpoints.
 */
class MultiplexerTest
{
    private static final String HOST = "127.0.0.1";
    private static final int MAX_FRAME = 1024;
    private static final Timeout SEND_TIMEOUT = Timeout.ofMillis(2000);

    private final TcpTransport transport = new TcpTransport();
    private final List<AutoCloseable> resources = new ArrayList<>();

    private InboundEndpoint unicast;
    private InboundEndpoint broadcast;
    private Multiplexer multiplexer;

    @BeforeEach
    void setUp() throws IOException
    {
        unicast = track(InboundEndpoint.bind(ChannelKind.UNICAST_INBOUND, transport, HOST, MAX_FRAME));
        broadcast = track(InboundEndpoint.bind(ChannelKind.BROADCAST_INBOUND, transport, HOST, MAX_FRAME));
        multiplexer = track(new Multiplexer());
        multiplexer.register(unicast);
        multiplexer.register(broadcast);
    }

    @AfterEach
    void tearDown() throws Exception
    {
        for (int i = resources.size() - 1; i >= 0; i--)
        {
            resources.get(i).close();
        }
    }

    @Test
    void poll_noTraffic_timesOutEmpty() throws IOException
    {
        assertTrue(multiplexer.poll(Timeout.ofMillis(50)).isEmpty());
    }

    @Test
    void poll_zeroTimeout_doesNotBlock() throws IOException
    {
        assertTrue(multiplexer.poll(Timeout.ofMillis(0)).isEmpty());
    }

    @Test
    void poll_reportsFrameOnCorrectEndpoint() throws IOException
    {
        OutboundConnection sender = track(OutboundConnection.open(transport, broadcast.getAddress(), SEND_TIMEOUT));
        sender.write(FrameAccumulator.frame(new byte[]{1, 2, 3}));

        Set<ChannelKind> ready = pollUntil(EnumSet.of(ChannelKind.BROADCAST_INBOUND));

        assertEquals(EnumSet.of(ChannelKind.BROADCAST_INBOUND), ready);
        assertArrayEquals(new byte[]{1, 2, 3}, multiplexer.take(ChannelKind.BROADCAST_INBOUND).orElseThrow());
        assertTrue(multiplexer.take(ChannelKind.BROADCAST_INBOUND).isEmpty());
    }

    @Test
    void bothReady_unicastServedFirst() throws IOException
    {
        OutboundConnection toBroadcast = track(OutboundConnection.open(transport, broadcast.getAddress(), SEND_TIMEOUT));
        OutboundConnection toUnicast = track(OutboundConnection.open(transport, unicast.getAddress(), SEND_TIMEOUT));
        toBroadcast.write(FrameAccumulator.frame(new byte[]{2}));
        toUnicast.write(FrameAccumulator.frame(new byte[]{1}));

        Set<ChannelKind> ready = pollUntil(EnumSet.allOf(ChannelKind.class));

        assertEquals(Optional.of(ChannelKind.UNICAST_INBOUND), Multiplexer.nextReady(ready));
        assertArrayEquals(new byte[]{1}, multiplexer.take(ChannelKind.UNICAST_INBOUND).orElseThrow());
        assertEquals(Optional.of(ChannelKind.BROADCAST_INBOUND), Multiplexer.nextReady(multiplexer.poll(Timeout.ofMillis(0))));
    }

    @Test
    void framesFromOneSender_keepOrder() throws IOException
    {
        OutboundConnection sender = track(OutboundConnection.open(transport, unicast.getAddress(), SEND_TIMEOUT));
        for (int i = 0; i < 20; i++)
        {
            sender.write(FrameAccumulator.frame(new byte[]{(byte) i}));
        }

        List<Byte> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 5000;
        while (received.size() < 20 && System.currentTimeMillis() < deadline)
        {
            multiplexer.poll(Timeout.ofMillis(100));
            Optional<byte[]> frame;
            while ((frame = multiplexer.take(ChannelKind.UNICAST_INBOUND)).isPresent())
            {
                received.add(frame.get()[0]);
            }
        }

        assertEquals(20, received.size());
        for (int i = 0; i < 20; i++)
        {
            assertEquals((byte) i, received.get(i).byteValue());
        }
    }

    @Test
    void oversizedFrame_dropsOnlyThatConnection() throws IOException
    {
        OutboundConnection bad = track(OutboundConnection.open(transport, unicast.getAddress(), SEND_TIMEOUT));
        OutboundConnection good = track(OutboundConnection.open(transport, unicast.getAddress(), SEND_TIMEOUT));
        bad.write(FrameAccumulator.frame(new byte[MAX_FRAME + 1]));
        good.write(FrameAccumulator.frame(new byte[]{7}));

        pollUntil(EnumSet.of(ChannelKind.UNICAST_INBOUND));

        assertArrayEquals(new byte[]{7}, multiplexer.take(ChannelKind.UNICAST_INBOUND).orElseThrow());
        assertTrue(multiplexer.take(ChannelKind.UNICAST_INBOUND).isEmpty());
    }

    @Test
    void register_duplicateKind_throws() throws IOException
    {
        InboundEndpoint another = track(InboundEndpoint.bind(ChannelKind.UNICAST_INBOUND, transport, HOST, MAX_FRAME));

        assertThrows(IllegalStateException.class, () -> multiplexer.register(another));
    }

    @Test
    void nextReady_emptySet()
    {
        assertTrue(Multiplexer.nextReady(Set.of()).isEmpty());
    }

    @Test
    void close_marksClosed()
    {
        assertTrue(multiplexer.isOpen());
        multiplexer.close();
        assertFalse(multiplexer.isOpen());
    }

    // ========== Helpers ==========

    private Set<ChannelKind> pollUntil(Set<ChannelKind> expected) throws IOException
    {
        long deadline = System.currentTimeMillis() + 5000;
        Set<ChannelKind> ready = Set.of();
        while (!ready.containsAll(expected) && System.currentTimeMillis() < deadline)
        {
            ready = multiplexer.poll(Timeout.ofMillis(100));
        }
        assertTrue(ready.containsAll(expected), "Timed out waiting for " + expected + ", ready: " + ready);
        return ready;
    }

    private <T extends AutoCloseable> T track(T resource)
    {
        resources.add(resource);
        return resource;
    }
}
