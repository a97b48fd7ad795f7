package org.abstractica.peerdriver.impl.transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;

/**
 * A stream transport protocol that endpoints are built on.
 *
 * <p>Transport knows how to open stream channels for one protocol and how
 * to convert between socket addresses and address strings such as
 * {@code tcp://10.0.0.5:41234}. It has no knowledge of framing, messages
 * or peers.</p>
 *
 * <p>Implementations:</p>
 * <ul>
 *   <li>{@link TcpTransport} - TCP sockets</li>
 *   <li>{@link IpcTransport} - Unix domain sockets for peers on the same host</li>
 * </ul>
 *
 * @see Transports#forProtocol(String)
 */
public interface Transport
{
    /**
     * Returns the protocol identifier, also used as the address scheme.
     *
     * @return the protocol, e.g. {@code "tcp"}
     */
    String getProtocol();

    /**
     * Opens a server channel bound to a transport-assigned local address.
     *
     * @return a bound server channel in blocking mode
     * @throws IOException if the channel cannot be opened or bound
     */
    ServerSocketChannel bindEphemeral() throws IOException;

    /**
     * Opens an unconnected channel suitable for {@link #parseAddress(String)} results.
     *
     * @return a new channel
     * @throws IOException if the channel cannot be opened
     */
    SocketChannel openChannel() throws IOException;

    /**
     * Formats the address other processes use to reach a bound server channel.
     *
     * @param server         a channel returned by {@link #bindEphemeral()}
     * @param advertisedHost the host peers should connect to
     * @return the address string
     * @throws IOException if the local address cannot be read
     */
    String formatAddress(ServerSocketChannel server, String advertisedHost) throws IOException;

    /**
     * Parses an address string of this protocol.
     *
     * @param address the address string
     * @return the socket address to connect to
     * @throws IllegalArgumentException if the address is malformed or of another protocol
     */
    SocketAddress parseAddress(String address);

    /**
     * Releases resources tied to a server channel's address after it is closed.
     *
     * @param address the address returned by {@link #formatAddress}
     */
    default void release(String address)
    {
    }
}
