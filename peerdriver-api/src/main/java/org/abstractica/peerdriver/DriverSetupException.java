package org.abstractica.peerdriver;

/**
 * A driver could not create or bind its endpoints.
 */
public class DriverSetupException extends DriverException
{
    public DriverSetupException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
