package org.abstractica.peerdriver;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * A messaging driver that exchanges messages with a set of named peers.
 *
 * <p>Each driver owns two inbound endpoints (one for unicast, one for
 * broadcast), one outbound broadcast endpoint that fans out to every
 * subscribed peer, and one outbound unicast endpoint per connected peer.
 * Peer discovery is not part of the driver: the caller distributes
 * {@link #getAddress()} to other processes and passes their addresses to
 * {@link #connect(Map)}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Driver driver = new DefaultDriverFactory().builder()
 *     .protocol("tcp")
 *     .sendTimeout(Timeout.ofMillis(500))
 *     .build();
 *
 * // Publish own addresses through the discovery collaborator
 * discovery.publish("worker-1", PeerAddresses.toWire(driver.getAddress()));
 *
 * // Connect to discovered peers
 * driver.connect(discovery.peers());
 *
 * SendResult result = driver.send(Message.unicast("task", "worker-1", "master", payload));
 * if (result instanceof SendResult.Failed failed)
 * {
 *     LOG.warn("Send failed", failed.cause());
 * }
 *
 * for (Iterator<Message> it = driver.receive(true); it.hasNext(); )
 * {
 *     handle(it.next());
 * }
 * }</pre>
 *
 * <p>The driver spawns no threads. {@link #receive(boolean)} blocks the
 * calling thread; sends to different peers may run concurrently from other
 * threads.</p>
 */
public interface Driver extends AutoCloseable
{
    /**
     * Returns the addresses of this driver's inbound endpoints.
     *
     * <p>The map holds one entry per {@link ChannelKind}. Use
     * {@link PeerAddresses#toWire(Map)} to convert it into the format
     * accepted by {@link #connect(Map)} on other drivers.</p>
     *
     * @return unmodifiable map from channel kind to address
     */
    Map<ChannelKind, String> getAddress();

    /**
     * Connects to peers.
     *
     * <p>The map keys are peer names. Each value maps a channel kind wire
     * name (see {@link ChannelKind#wireName()}) to the address the peer
     * advertised for that endpoint. A unicast entry creates a dedicated
     * outbound endpoint for the peer; a broadcast entry subscribes the peer
     * to this driver's broadcasts.</p>
     *
     * <p>Peers are processed in iteration order and the call is not
     * transactional: when a peer fails, peers processed before it stay
     * connected and peers after it are not processed.</p>
     *
     * @param peersAddress peer name to (channel kind wire name to address)
     * @throws SocketTypeException      if a channel kind is not recognized
     * @throws PeersConnectionException if connecting to a peer fails
     * @throws IllegalStateException    if the driver is closed
     */
    void connect(Map<String, Map<String, String>> peersAddress);

    /**
     * Sends a message to the peer named by its destination.
     *
     * <p>Never throws for delivery problems. A missing destination, an
     * unknown peer, an encoding failure or a failed or timed-out write is
     * reported as {@link SendResult.Failed}.</p>
     *
     * @param message the message to send
     * @return the outcome of the send
     */
    SendResult send(Message message);

    /**
     * Sends a message to every subscribed peer.
     *
     * <p>The whole fan-out shares one send timeout, so a broadcast blocks
     * for at most the send timeout however many subscribers stall.
     * Failures are reported as {@link SendResult.Failed}; a failure on
     * one subscriber does not stop delivery to the others. With no
     * subscribers the message is dropped and the result is
     * {@link SendResult.Sent}.</p>
     *
     * @param message the message to broadcast
     * @return the outcome of the broadcast
     */
    SendResult broadcast(Message message);

    /**
     * Receives messages from both inbound endpoints.
     *
     * <p>The returned iterator is lazy: {@link Iterator#hasNext()} blocks
     * until a message arrives. Receive timeouts are retried silently. When
     * unicast and broadcast messages are ready at the same time, the unicast
     * message is returned first.</p>
     *
     * <p>If the multiplexed wait itself fails, {@code hasNext()} throws
     * {@link DriverReceiveException} and the iterator is finished. Closing
     * the driver ends the iterator.</p>
     *
     * @param continuous true to keep receiving, false to yield at most one message
     * @return a lazy iterator of received messages
     * @throws IllegalStateException if the driver is closed
     */
    Iterator<Message> receive(boolean continuous);

    /**
     * Receives messages continuously.
     *
     * <p>Equivalent to {@code receive(true)}.</p>
     *
     * @return a lazy, unbounded iterator of received messages
     */
    default Iterator<Message> receive()
    {
        return receive(true);
    }

    /**
     * Returns the names of peers with an outbound unicast endpoint.
     *
     * @return unmodifiable snapshot of connected peer names
     */
    Set<String> getPeers();

    /**
     * Returns the addresses this driver connected to for a peer.
     *
     * <p>Holds one entry per channel kind passed to {@link #connect(Map)}
     * for the peer; a later connect for the same kind replaces the entry.</p>
     *
     * @param peerName the peer name
     * @return unmodifiable map from channel kind to address, empty if unknown
     */
    Map<ChannelKind, String> getPeerAddress(String peerName);

    /**
     * Returns driver statistics.
     *
     * @return current statistics snapshot
     */
    DriverStats getStats();

    /**
     * Closes every endpoint owned by this driver.
     *
     * <p>Safe to call more than once.</p>
     */
    @Override
    void close();
}
