package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.Timeout;
import org.abstractica.peerdriver.impl.transport.BroadcastSender;
import org.abstractica.peerdriver.impl.transport.InboundEndpoint;
import org.abstractica.peerdriver.impl.transport.OutboundConnection;
import org.abstractica.peerdriver.impl.transport.Transport;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every endpoint of one driver.
 *
 * <ul>
 *   <li>inbound unicast endpoint - bound at creation</li>
 *   <li>inbound broadcast endpoint - bound at creation, accepts every message</li>
 *   <li>outbound broadcast sender - created empty, gains subscribers on connect</li>
 *   <li>peer connection table - one outbound unicast connection per peer name</li>
 * </ul>
 */
class ChannelSet implements AutoCloseable
{
    private final Transport transport;
    private final Timeout sendTimeout;
    private final InboundEndpoint unicastInbound;
    private final InboundEndpoint broadcastInbound;
    private final BroadcastSender broadcastSender;
    private final Map<String, OutboundConnection> unicastSenders = new ConcurrentHashMap<>();

    private ChannelSet(
            Transport transport,
            Timeout sendTimeout,
            InboundEndpoint unicastInbound,
            InboundEndpoint broadcastInbound
    )
    {
        this.transport = transport;
        this.sendTimeout = sendTimeout;
        this.unicastInbound = unicastInbound;
        this.broadcastInbound = broadcastInbound;
        this.broadcastSender = new BroadcastSender(transport, sendTimeout);
    }

    /**
     * Binds both inbound endpoints.
     *
     * @throws IOException if either endpoint cannot be bound; nothing is left open
     */
    static ChannelSet open(Transport transport, Timeout sendTimeout, String advertisedHost, int maxFrameSize)
            throws IOException
    {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(sendTimeout, "sendTimeout");

        InboundEndpoint unicast = InboundEndpoint.bind(
                ChannelKind.UNICAST_INBOUND, transport, advertisedHost, maxFrameSize);
        try
        {
            InboundEndpoint broadcast = InboundEndpoint.bind(
                    ChannelKind.BROADCAST_INBOUND, transport, advertisedHost, maxFrameSize);
            return new ChannelSet(transport, sendTimeout, unicast, broadcast);
        }
        catch (IOException | RuntimeException e)
        {
            unicast.close();
            throw e;
        }
    }

    InboundEndpoint getInbound(ChannelKind kind)
    {
        return switch (kind)
        {
            case UNICAST_INBOUND -> unicastInbound;
            case BROADCAST_INBOUND -> broadcastInbound;
        };
    }

    /**
     * Opens the outbound unicast connection for a peer.
     *
     * <p>An existing connection for the same peer is replaced and closed.</p>
     */
    void connectUnicast(String peerName, String address) throws IOException
    {
        OutboundConnection connection = OutboundConnection.open(transport, address, sendTimeout);
        OutboundConnection previous = unicastSenders.put(peerName, connection);
        if (previous != null)
        {
            previous.close();
        }
    }

    void connectBroadcast(String address) throws IOException
    {
        broadcastSender.subscribe(address);
    }

    Optional<OutboundConnection> getUnicastSender(String peerName)
    {
        return Optional.ofNullable(unicastSenders.get(peerName));
    }

    BroadcastSender getBroadcastSender()
    {
        return broadcastSender;
    }

    Set<String> getPeers()
    {
        return Set.copyOf(unicastSenders.keySet());
    }

    @Override
    public void close()
    {
        for (OutboundConnection connection : unicastSenders.values())
        {
            connection.close();
        }
        unicastSenders.clear();
        broadcastSender.close();
        unicastInbound.close();
        broadcastInbound.close();
    }
}
