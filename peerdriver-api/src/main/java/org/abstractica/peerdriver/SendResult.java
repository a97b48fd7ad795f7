package org.abstractica.peerdriver;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a send or broadcast.
 *
 * <p>Sealed interface enabling exhaustive pattern matching on the result.
 * Send failures are returned rather than thrown so callers can decide
 * whether to retry, log or drop the message.</p>
 */
public sealed interface SendResult
{
    /**
     * The message was handed to the transport.
     *
     * @param message the message that was sent
     */
    record Sent(Message message) implements SendResult
    {
        public Sent
        {
            Objects.requireNonNull(message, "message");
        }
    }

    /**
     * The message could not be sent.
     *
     * @param message the message that failed
     * @param cause   what went wrong
     */
    record Failed(Message message, DriverSendException cause) implements SendResult
    {
        public Failed
        {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(cause, "cause");
        }
    }

    /**
     * Returns whether the message was sent.
     *
     * @return true for {@link Sent}
     */
    default boolean isSuccess()
    {
        return this instanceof Sent;
    }

    /**
     * Returns the failure cause, if any.
     *
     * @return the send error, or empty on success
     */
    default Optional<DriverSendException> getError()
    {
        if (this instanceof Failed failed)
        {
            return Optional.of(failed.cause());
        }
        return Optional.empty();
    }
}
