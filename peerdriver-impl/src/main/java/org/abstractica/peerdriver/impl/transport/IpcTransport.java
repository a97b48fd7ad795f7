package org.abstractica.peerdriver.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Inter-process transport over Unix domain sockets.
 *
 * <p>Each server channel binds to a fresh socket file in the socket
 * directory. Addresses have the form {@code ipc:///path/to/file.sock}.
 * The advertised host is ignored since peers must share the file system.</p>
 */
public class IpcTransport implements Transport
{
    private static final Logger LOG = LoggerFactory.getLogger(IpcTransport.class);

    public static final String PROTOCOL = "ipc";
    private static final String SCHEME = PROTOCOL + "://";

    private final Path socketDirectory;

    /**
     * Creates an IPC transport using the system temporary directory.
     */
    public IpcTransport()
    {
        this(Path.of(System.getProperty("java.io.tmpdir")));
    }

    /**
     * Creates an IPC transport with a custom socket directory.
     *
     * @param socketDirectory where socket files are created
     */
    public IpcTransport(Path socketDirectory)
    {
        this.socketDirectory = Objects.requireNonNull(socketDirectory, "socketDirectory");
    }

    @Override
    public String getProtocol()
    {
        return PROTOCOL;
    }

    @Override
    public ServerSocketChannel bindEphemeral() throws IOException
    {
        Path path = socketDirectory.resolve("peerdriver-" + UUID.randomUUID() + ".sock");
        ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try
        {
            server.bind(UnixDomainSocketAddress.of(path));
            return server;
        }
        catch (IOException e)
        {
            server.close();
            throw e;
        }
    }

    @Override
    public SocketChannel openChannel() throws IOException
    {
        return SocketChannel.open(StandardProtocolFamily.UNIX);
    }

    @Override
    public String formatAddress(ServerSocketChannel server, String advertisedHost) throws IOException
    {
        UnixDomainSocketAddress local = (UnixDomainSocketAddress) server.getLocalAddress();
        return SCHEME + local.getPath().toAbsolutePath();
    }

    @Override
    public SocketAddress parseAddress(String address)
    {
        Objects.requireNonNull(address, "address");
        if (!address.startsWith(SCHEME) || address.length() == SCHEME.length())
        {
            throw new IllegalArgumentException("Not an " + PROTOCOL + " address: " + address);
        }
        return UnixDomainSocketAddress.of(address.substring(SCHEME.length()));
    }

    @Override
    public void release(String address)
    {
        UnixDomainSocketAddress socketAddress = (UnixDomainSocketAddress) parseAddress(address);
        try
        {
            Files.deleteIfExists(socketAddress.getPath());
        }
        catch (IOException e)
        {
            LOG.warn("Failed to delete socket file {}", socketAddress.getPath(), e);
        }
    }
}
