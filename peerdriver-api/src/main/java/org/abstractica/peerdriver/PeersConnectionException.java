package org.abstractica.peerdriver;

import java.util.Objects;

/**
 * Connecting an outbound endpoint to a peer's advertised address failed.
 */
public class PeersConnectionException extends DriverException
{
    private final String peerName;

    /**
     * Creates a connection error for a peer.
     *
     * @param peerName the peer that could not be reached
     * @param cause    the underlying transport error
     */
    public PeersConnectionException(String peerName, Throwable cause)
    {
        super("Driver cannot connect to " + peerName + "! Due to " + cause.getMessage(), cause);
        this.peerName = Objects.requireNonNull(peerName, "peerName");
    }

    /**
     * Returns the name of the peer that could not be reached.
     *
     * @return peer name
     */
    public String getPeerName()
    {
        return peerName;
    }
}
