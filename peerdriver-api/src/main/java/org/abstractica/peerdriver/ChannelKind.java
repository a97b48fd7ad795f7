package org.abstractica.peerdriver;

/**
 * Kinds of inbound endpoint a peer advertises.
 *
 * <p>The wire name is the key used in the address maps exchanged with the
 * discovery collaborator.</p>
 */
public enum ChannelKind
{
    /**
     * Receives messages sent directly to this peer.
     */
    UNICAST_INBOUND("unicast"),

    /**
     * Receives messages broadcast by other peers.
     */
    BROADCAST_INBOUND("broadcast");

    private final String wireName;

    ChannelKind(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * Returns the name used for this kind in exchanged address maps.
     *
     * @return the wire name
     */
    public String wireName()
    {
        return wireName;
    }

    /**
     * Looks up a channel kind by its wire name.
     *
     * @param wireName the wire name
     * @return the channel kind
     * @throws SocketTypeException if the name is unknown
     */
    public static ChannelKind fromWireName(String wireName)
    {
        for (ChannelKind kind : values())
        {
            if (kind.wireName.equals(wireName))
            {
                return kind;
            }
        }
        throw new SocketTypeException("Unrecognized channel kind: " + wireName);
    }
}
