package org.abstractica.peerdriver;

/**
 * An address map named a channel kind the driver does not recognize.
 *
 * @see ChannelKind#fromWireName(String)
 */
public class SocketTypeException extends DriverException
{
    public SocketTypeException(String message)
    {
        super(message);
    }
}
