package org.abstractica.peerdriver.impl.transport;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Looks up transports by protocol identifier.
 */
public final class Transports
{
    private Transports() {}

    /**
     * Returns the protocols this library supports.
     *
     * @return supported protocol identifiers
     */
    public static Set<String> supportedProtocols()
    {
        return Set.of(TcpTransport.PROTOCOL, IpcTransport.PROTOCOL);
    }

    /**
     * Creates the transport for a protocol.
     *
     * @param protocol the protocol identifier, case-insensitive
     * @return a new transport
     * @throws IllegalArgumentException if the protocol is not supported
     */
    public static Transport forProtocol(String protocol)
    {
        Objects.requireNonNull(protocol, "protocol");
        return switch (protocol.toLowerCase(Locale.ROOT))
        {
            case TcpTransport.PROTOCOL -> new TcpTransport();
            case IpcTransport.PROTOCOL -> new IpcTransport();
            default -> throw new IllegalArgumentException(
                    "Unsupported protocol: " + protocol + " (supported: " + supportedProtocols() + ")");
        };
    }
}
