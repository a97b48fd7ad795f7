package org.abstractica.peerdriver;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A bounded or unbounded wait.
 *
 * <p>Follows the millisecond convention of socket options: {@code -1}
 * means no timeout, {@code 0} means do not wait at all.</p>
 *
 * @param millis the timeout in milliseconds, or -1 for no timeout
 */
public record Timeout(long millis)
{
    /**
     * Waits indefinitely.
     */
    public static final Timeout INFINITE = new Timeout(-1);

    public Timeout
    {
        if (millis < -1)
        {
            throw new IllegalArgumentException("Timeout must be >= 0 or -1 for infinite: " + millis);
        }
    }

    /**
     * Creates a timeout from milliseconds.
     *
     * @param millis the timeout in milliseconds, or -1 for no timeout
     * @return the timeout
     */
    public static Timeout ofMillis(long millis)
    {
        return millis == -1 ? INFINITE : new Timeout(millis);
    }

    /**
     * Creates a bounded timeout.
     *
     * @param duration a non-negative duration
     * @return the timeout
     */
    public static Timeout of(Duration duration)
    {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative())
        {
            throw new IllegalArgumentException("Timeout duration must not be negative: " + duration);
        }
        return new Timeout(duration.toMillis());
    }

    /**
     * Returns whether this timeout never expires.
     *
     * @return true for {@link #INFINITE}
     */
    public boolean isInfinite()
    {
        return millis == -1;
    }

    /**
     * Returns the duration of a bounded timeout.
     *
     * @return the duration, or empty if infinite
     */
    public Optional<Duration> toDuration()
    {
        return isInfinite() ? Optional.empty() : Optional.of(Duration.ofMillis(millis));
    }

    @Override
    public String toString()
    {
        return isInfinite() ? "infinite" : millis + "ms";
    }
}
