package org.abstractica.peerdriver;

/**
 * The multiplexed wait on the inbound endpoints failed.
 *
 * <p>A receive timeout is not an error and never produces this exception.</p>
 */
public class DriverReceiveException extends DriverException
{
    public DriverReceiveException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
