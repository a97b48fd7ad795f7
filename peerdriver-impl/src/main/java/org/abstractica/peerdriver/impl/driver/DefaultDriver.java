package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.Driver;
import org.abstractica.peerdriver.DriverSendException;
import org.abstractica.peerdriver.DriverSetupException;
import org.abstractica.peerdriver.DriverStats;
import org.abstractica.peerdriver.Message;
import org.abstractica.peerdriver.MessageCodecException;
import org.abstractica.peerdriver.PeersConnectionException;
import org.abstractica.peerdriver.SendResult;
import org.abstractica.peerdriver.impl.transport.FrameAccumulator;
import org.abstractica.peerdriver.impl.transport.Multiplexer;
import org.abstractica.peerdriver.impl.transport.OutboundConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default implementation of the Driver interface.
 *
 * <p>Owns a {@link ChannelSet} with every endpoint, an
 * {@link AddressRegistry} and a {@link Multiplexer} over the two inbound
 * endpoints. Library diagnostics go to the class logger; the per-message
 * trace goes to the logger from the configuration.</p>
 */
public class DefaultDriver implements Driver
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultDriver.class);

    private final DriverConfig config;
    private final Logger trace;
    private final ChannelSet channels;
    private final Multiplexer multiplexer;
    private final AddressRegistry registry = new AddressRegistry();
    private final DefaultDriverStats stats;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a driver and binds its inbound endpoints.
     *
     * @param config the driver configuration
     * @throws DriverSetupException if an endpoint cannot be created
     */
    DefaultDriver(DriverConfig config)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.trace = config.logger();

        int maxFrameSize = config.maxMessageSize();
        ChannelSet channelSet = null;
        Multiplexer mux = null;
        try
        {
            channelSet = ChannelSet.open(
                    config.transport(), config.sendTimeout(), config.advertisedHost(), maxFrameSize);
            mux = new Multiplexer();
            for (ChannelKind kind : ChannelKind.values())
            {
                mux.register(channelSet.getInbound(kind));
                registry.registerOwn(kind, channelSet.getInbound(kind).getAddress());
            }
        }
        catch (IOException | RuntimeException e)
        {
            if (mux != null)
            {
                mux.close();
            }
            if (channelSet != null)
            {
                channelSet.close();
            }
            throw new DriverSetupException("Cannot create driver endpoints over " + config.transport().getProtocol(), e);
        }

        this.channels = channelSet;
        this.multiplexer = mux;
        ChannelSet owned = channelSet;
        this.stats = new DefaultDriverStats(
                () -> owned.getPeers().size(),
                () -> owned.getBroadcastSender().getSubscriberCount());

        LOG.info("Driver created: {}", registry.getOwnAddresses());
    }

    @Override
    public Map<ChannelKind, String> getAddress()
    {
        return registry.getOwnAddresses();
    }

    @Override
    public void connect(Map<String, Map<String, String>> peersAddress)
    {
        Objects.requireNonNull(peersAddress, "peersAddress");
        ensureOpen();

        for (Map.Entry<String, Map<String, String>> peer : peersAddress.entrySet())
        {
            String peerName = Objects.requireNonNull(peer.getKey(), "peer name");
            Map<ChannelKind, String> addresses = parseDiscriminators(peerName, peer.getValue());

            for (Map.Entry<ChannelKind, String> entry : addresses.entrySet())
            {
                connectEndpoint(peerName, entry.getKey(), entry.getValue());
            }
            for (Map.Entry<ChannelKind, String> entry : addresses.entrySet())
            {
                registry.recordPeer(peerName, entry.getKey(), entry.getValue());
            }
        }
    }

    @Override
    public SendResult send(Message message)
    {
        Objects.requireNonNull(message, "message");

        if (closed.get())
        {
            return fail(message, new DriverSendException("Driver is closed"));
        }
        if (message.destination().isEmpty())
        {
            return fail(message, new DriverSendException("Message " + message.id() + " has no destination"));
        }

        String destination = message.destination().get();
        Optional<OutboundConnection> connection = channels.getUnicastSender(destination);
        if (connection.isEmpty())
        {
            return fail(message, new DriverSendException("No connection to peer " + destination));
        }

        try
        {
            connection.get().write(encode(message));
        }
        catch (DriverSendException e)
        {
            return fail(message, e);
        }
        catch (IOException | IllegalStateException e)
        {
            return fail(message, new DriverSendException("Failed to send to " + destination, e));
        }

        stats.recordSent();
        trace.debug("Sent {} [{}] to {}", message.tag(), message.id(), destination);
        return new SendResult.Sent(message);
    }

    @Override
    public SendResult broadcast(Message message)
    {
        Objects.requireNonNull(message, "message");

        if (closed.get())
        {
            return fail(message, new DriverSendException("Driver is closed"));
        }

        Map<String, IOException> failures;
        try
        {
            failures = channels.getBroadcastSender().publish(encode(message));
        }
        catch (DriverSendException e)
        {
            return fail(message, e);
        }
        catch (IllegalStateException e)
        {
            return fail(message, new DriverSendException("Failed to broadcast", e));
        }

        if (!failures.isEmpty())
        {
            DriverSendException error = new DriverSendException(
                    "Broadcast failed for subscribers " + failures.keySet());
            for (IOException cause : failures.values())
            {
                error.addSuppressed(cause);
            }
            return fail(message, error);
        }

        stats.recordBroadcast();
        trace.debug("Broadcast {} [{}]", message.tag(), message.id());
        return new SendResult.Sent(message);
    }

    @Override
    public Iterator<Message> receive(boolean continuous)
    {
        ensureOpen();
        return new ReceiveIterator(
                multiplexer,
                config.serializer(),
                config.receiveTimeout(),
                continuous,
                closed::get,
                message ->
                {
                    stats.recordReceived();
                    trace.debug("Received {} [{}] from {}", message.tag(), message.id(), message.source());
                });
    }

    @Override
    public Set<String> getPeers()
    {
        return channels.getPeers();
    }

    @Override
    public Map<ChannelKind, String> getPeerAddress(String peerName)
    {
        return registry.getPeerAddresses(peerName);
    }

    @Override
    public DriverStats getStats()
    {
        return stats;
    }

    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        // Selector first so a blocked receive wakes before its channels go away
        multiplexer.close();
        channels.close();
        LOG.info("Driver closed: {}", registry.getOwnAddresses());
    }

    // ========== Internal ==========

    private Map<ChannelKind, String> parseDiscriminators(String peerName, Map<String, String> wireAddresses)
    {
        Objects.requireNonNull(wireAddresses, () -> "addresses of peer " + peerName);

        Map<ChannelKind, String> addresses = new EnumMap<>(ChannelKind.class);
        for (Map.Entry<String, String> entry : wireAddresses.entrySet())
        {
            ChannelKind kind = ChannelKind.fromWireName(entry.getKey());
            addresses.put(kind, Objects.requireNonNull(entry.getValue(), () -> kind + " address of peer " + peerName));
        }
        return addresses;
    }

    private void connectEndpoint(String peerName, ChannelKind kind, String address)
    {
        try
        {
            switch (kind)
            {
                case UNICAST_INBOUND -> channels.connectUnicast(peerName, address);
                case BROADCAST_INBOUND -> channels.connectBroadcast(address);
            }
        }
        catch (IOException | IllegalArgumentException e)
        {
            trace.warn("Cannot connect to {} {} at {}: {}", peerName, kind.wireName(), address, e.getMessage());
            throw new PeersConnectionException(peerName, e);
        }
        trace.debug("Connected to {} {} at {}", peerName, kind.wireName(), address);
    }

    private ByteBuffer encode(Message message)
    {
        byte[] body;
        try
        {
            body = config.serializer().encode(message);
        }
        catch (MessageCodecException e)
        {
            throw new DriverSendException("Cannot encode message " + message.id(), e);
        }

        if (body.length > config.maxMessageSize())
        {
            throw new DriverSendException("Encoded message " + message.id() + " is " + body.length
                    + " bytes, limit is " + config.maxMessageSize());
        }
        return FrameAccumulator.frame(body);
    }

    private SendResult fail(Message message, DriverSendException error)
    {
        stats.recordSendFailure();
        trace.warn("Send of {} [{}] failed: {}", message.tag(), message.id(), error.getMessage());
        return new SendResult.Failed(message, error);
    }

    private void ensureOpen()
    {
        if (closed.get())
        {
            throw new IllegalStateException("Driver is closed");
        }
    }
}
