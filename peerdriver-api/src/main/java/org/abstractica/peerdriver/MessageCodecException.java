package org.abstractica.peerdriver;

/**
 * A message could not be encoded or decoded.
 */
public class MessageCodecException extends DriverException
{
    public MessageCodecException(String message)
    {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
