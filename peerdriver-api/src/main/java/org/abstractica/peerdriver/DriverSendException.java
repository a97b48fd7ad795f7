package org.abstractica.peerdriver;

/**
 * A unicast or broadcast message could not be sent.
 *
 * <p>Drivers return this inside {@link SendResult.Failed} instead of
 * throwing it.</p>
 */
public class DriverSendException extends DriverException
{
    public DriverSendException(String message)
    {
        super(message);
    }

    public DriverSendException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
