package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.ChannelKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks this driver's own inbound addresses and the addresses it used to
 * reach each peer.
 */
public class AddressRegistry
{
    private final Map<ChannelKind, String> ownAddresses = Collections.synchronizedMap(new EnumMap<>(ChannelKind.class));
    private final Map<String, Map<ChannelKind, String>> peerAddresses = new ConcurrentHashMap<>();

    /**
     * Records the address of one of this driver's inbound endpoints.
     *
     * @param kind    the endpoint kind
     * @param address the bound address
     * @throws IllegalStateException if an address is already recorded for the kind
     */
    public void registerOwn(ChannelKind kind, String address)
    {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(address, "address");
        if (ownAddresses.putIfAbsent(kind, address) != null)
        {
            throw new IllegalStateException("Address for " + kind + " already registered");
        }
    }

    /**
     * Returns this driver's inbound addresses.
     *
     * @return unmodifiable snapshot, one entry per registered kind
     */
    public Map<ChannelKind, String> getOwnAddresses()
    {
        synchronized (ownAddresses)
        {
            return snapshot(ownAddresses);
        }
    }

    /**
     * Records the address used to reach a peer's endpoint.
     *
     * @param peerName the peer
     * @param kind     the peer endpoint kind
     * @param address  the peer's advertised address
     */
    public void recordPeer(String peerName, ChannelKind kind, String address)
    {
        Objects.requireNonNull(peerName, "peerName");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(address, "address");
        peerAddresses
                .computeIfAbsent(peerName, name -> Collections.synchronizedMap(new EnumMap<>(ChannelKind.class)))
                .put(kind, address);
    }

    /**
     * Returns the addresses recorded for a peer.
     *
     * @param peerName the peer
     * @return unmodifiable snapshot, empty if the peer was never connected
     */
    public Map<ChannelKind, String> getPeerAddresses(String peerName)
    {
        Objects.requireNonNull(peerName, "peerName");
        Map<ChannelKind, String> addresses = peerAddresses.get(peerName);
        if (addresses == null)
        {
            return Map.of();
        }
        synchronized (addresses)
        {
            return snapshot(addresses);
        }
    }

    private static Map<ChannelKind, String> snapshot(Map<ChannelKind, String> addresses)
    {
        Map<ChannelKind, String> copy = new EnumMap<>(ChannelKind.class);
        copy.putAll(addresses);
        return Collections.unmodifiableMap(copy);
    }
}
