package org.abstractica.peerdriver;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between typed address maps and the wire format exchanged with
 * the discovery collaborator.
 *
 * <p>The wire format maps {@link ChannelKind#wireName()} to an address
 * string, for example {@code {"unicast": "tcp://10.0.0.5:41234"}}.</p>
 */
public final class PeerAddresses
{
    private PeerAddresses() {}

    /**
     * Converts a typed address map to the wire format.
     *
     * @param addresses channel kind to address
     * @return unmodifiable wire name to address map
     */
    public static Map<String, String> toWire(Map<ChannelKind, String> addresses)
    {
        Objects.requireNonNull(addresses, "addresses");

        Map<String, String> wire = new LinkedHashMap<>();
        for (Map.Entry<ChannelKind, String> entry : addresses.entrySet())
        {
            wire.put(entry.getKey().wireName(), Objects.requireNonNull(entry.getValue(), "address"));
        }
        return Collections.unmodifiableMap(wire);
    }

    /**
     * Parses a wire format address map.
     *
     * <p>Entries are ordered unicast before broadcast.</p>
     *
     * @param wire wire name to address
     * @return unmodifiable channel kind to address map
     * @throws SocketTypeException if a wire name is not recognized
     */
    public static Map<ChannelKind, String> fromWire(Map<String, String> wire)
    {
        Objects.requireNonNull(wire, "wire");

        Map<ChannelKind, String> addresses = new EnumMap<>(ChannelKind.class);
        for (Map.Entry<String, String> entry : wire.entrySet())
        {
            addresses.put(ChannelKind.fromWireName(entry.getKey()),
                    Objects.requireNonNull(entry.getValue(), "address"));
        }
        return Collections.unmodifiableMap(addresses);
    }
}
