package org.abstractica.peerdriver;

/**
 * Driver statistics for monitoring and observability.
 *
 * <p>Statistics are pollable snapshots. The application can query these
 * values and push to a monitoring system of choice.</p>
 */
public interface DriverStats
{
    /**
     * Returns the number of unicast messages handed to the transport.
     *
     * @return unicast messages sent
     */
    long getMessagesSent();

    /**
     * Returns the number of broadcasts handed to the transport.
     *
     * @return broadcasts sent
     */
    long getMessagesBroadcast();

    /**
     * Returns the number of messages yielded by receive.
     *
     * @return messages received
     */
    long getMessagesReceived();

    /**
     * Returns the number of sends and broadcasts that failed.
     *
     * @return failed sends
     */
    long getSendFailures();

    /**
     * Returns the number of peers with an outbound unicast endpoint.
     *
     * @return connected peer count
     */
    int getConnectedPeers();

    /**
     * Returns the number of broadcast subscriber connections.
     *
     * @return subscriber count
     */
    int getBroadcastSubscribers();
}
