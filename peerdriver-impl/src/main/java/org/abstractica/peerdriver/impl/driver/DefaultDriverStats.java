package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.DriverStats;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;

/**
 * Default implementation of DriverStats.
 */
public class DefaultDriverStats implements DriverStats
{
    private final AtomicLong messagesSent = new AtomicLong(0);
    private final AtomicLong messagesBroadcast = new AtomicLong(0);
    private final AtomicLong messagesReceived = new AtomicLong(0);
    private final AtomicLong sendFailures = new AtomicLong(0);

    private final IntSupplier connectedPeers;
    private final IntSupplier broadcastSubscribers;

    /**
     * Creates stats backed by live counts from the owning driver.
     *
     * @param connectedPeers       supplies the current peer table size
     * @param broadcastSubscribers supplies the current subscriber count
     */
    public DefaultDriverStats(IntSupplier connectedPeers, IntSupplier broadcastSubscribers)
    {
        this.connectedPeers = Objects.requireNonNull(connectedPeers, "connectedPeers");
        this.broadcastSubscribers = Objects.requireNonNull(broadcastSubscribers, "broadcastSubscribers");
    }

    @Override
    public long getMessagesSent()
    {
        return messagesSent.get();
    }

    @Override
    public long getMessagesBroadcast()
    {
        return messagesBroadcast.get();
    }

    @Override
    public long getMessagesReceived()
    {
        return messagesReceived.get();
    }

    @Override
    public long getSendFailures()
    {
        return sendFailures.get();
    }

    @Override
    public int getConnectedPeers()
    {
        return connectedPeers.getAsInt();
    }

    @Override
    public int getBroadcastSubscribers()
    {
        return broadcastSubscribers.getAsInt();
    }

    // ========== Update Methods ==========

    public void recordSent()
    {
        messagesSent.incrementAndGet();
    }

    public void recordBroadcast()
    {
        messagesBroadcast.incrementAndGet();
    }

    public void recordReceived()
    {
        messagesReceived.incrementAndGet();
    }

    public void recordSendFailure()
    {
        sendFailures.incrementAndGet();
    }
}
