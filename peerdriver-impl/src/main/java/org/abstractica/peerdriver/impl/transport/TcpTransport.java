package org.abstractica.peerdriver.impl.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.Objects;

/**
 * TCP transport.
 *
 * <p>Server channels bind to an ephemeral port on all interfaces. Addresses
 * have the form {@code tcp://host:port}; IPv6 literals are written in
 * brackets.</p>
 */
public class TcpTransport implements Transport
{
    public static final String PROTOCOL = "tcp";
    private static final String SCHEME = PROTOCOL + "://";

    @Override
    public String getProtocol()
    {
        return PROTOCOL;
    }

    @Override
    public ServerSocketChannel bindEphemeral() throws IOException
    {
        ServerSocketChannel server = ServerSocketChannel.open();
        try
        {
            server.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            server.bind(new InetSocketAddress(0));
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
        SocketChannel channel = SocketChannel.open();
        channel.setOption(StandardSocketOptions.TCP_NODELAY, true);
        return channel;
    }

    @Override
    public String formatAddress(ServerSocketChannel server, String advertisedHost) throws IOException
    {
        Objects.requireNonNull(advertisedHost, "advertisedHost");
        InetSocketAddress local = (InetSocketAddress) server.getLocalAddress();
        String host = advertisedHost.contains(":") ? "[" + advertisedHost + "]" : advertisedHost;
        return SCHEME + host + ":" + local.getPort();
    }

    @Override
    public SocketAddress parseAddress(String address)
    {
        Objects.requireNonNull(address, "address");
        if (!address.startsWith(SCHEME))
        {
            throw new IllegalArgumentException("Not a " + PROTOCOL + " address: " + address);
        }

        String hostPort = address.substring(SCHEME.length());
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1)
        {
            throw new IllegalArgumentException("Address must be " + SCHEME + "host:port: " + address);
        }

        String host = hostPort.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]"))
        {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty() || host.equals("*"))
        {
            throw new IllegalArgumentException("Address has no connectable host: " + address);
        }

        int port;
        try
        {
            port = Integer.parseInt(hostPort.substring(colon + 1));
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException("Invalid port in address: " + address, e);
        }
        if (port < 1 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 1-65535: " + address);
        }

        InetSocketAddress resolved = new InetSocketAddress(host, port);
        if (resolved.isUnresolved())
        {
            throw new IllegalArgumentException("Cannot resolve host: " + host);
        }
        return resolved;
    }
}
