package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.DriverReceiveException;
import org.abstractica.peerdriver.Message;
import org.abstractica.peerdriver.MessageCodecException;
import org.abstractica.peerdriver.MessageSerializer;
import org.abstractica.peerdriver.Timeout;
import org.abstractica.peerdriver.impl.transport.Multiplexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedSelectorException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Lazy iterator over messages arriving at a driver's inbound endpoints.
 *
 * <p>{@link #hasNext()} blocks on the multiplexer until a message can be
 * decoded. Timed-out waits are retried. Once finished, the iterator stays
 * finished.</p>
 */
class ReceiveIterator implements Iterator<Message>
{
    private static final Logger LOG = LoggerFactory.getLogger(ReceiveIterator.class);

    private final Multiplexer multiplexer;
    private final MessageSerializer serializer;
    private final Timeout receiveTimeout;
    private final boolean continuous;
    private final BooleanSupplier driverClosed;
    private final Consumer<Message> onReceived;

    private Message next;
    private boolean finished;

    ReceiveIterator(
            Multiplexer multiplexer,
            MessageSerializer serializer,
            Timeout receiveTimeout,
            boolean continuous,
            BooleanSupplier driverClosed,
            Consumer<Message> onReceived
    )
    {
        this.multiplexer = multiplexer;
        this.serializer = serializer;
        this.receiveTimeout = receiveTimeout;
        this.continuous = continuous;
        this.driverClosed = driverClosed;
        this.onReceived = onReceived;
    }

    @Override
    public boolean hasNext()
    {
        if (next != null)
        {
            return true;
        }

        while (!finished)
        {
            if (driverClosed.getAsBoolean())
            {
                finished = true;
                break;
            }

            Set<ChannelKind> ready = poll();
            if (finished)
            {
                break;
            }

            Optional<ChannelKind> kind = Multiplexer.nextReady(ready);
            if (kind.isEmpty())
            {
                continue;
            }

            Optional<byte[]> frame = multiplexer.take(kind.get());
            if (frame.isEmpty())
            {
                continue;
            }

            try
            {
                next = serializer.decode(frame.get());
                return true;
            }
            catch (MessageCodecException e)
            {
                LOG.warn("Discarding undecodable {} message ({} bytes): {}",
                        kind.get(), frame.get().length, e.getMessage());
            }
        }
        return false;
    }

    @Override
    public Message next()
    {
        if (!hasNext())
        {
            throw new NoSuchElementException();
        }

        Message message = next;
        next = null;
        if (!continuous)
        {
            finished = true;
        }
        onReceived.accept(message);
        return message;
    }

    private Set<ChannelKind> poll()
    {
        try
        {
            return multiplexer.poll(receiveTimeout);
        }
        catch (IOException | ClosedSelectorException e)
        {
            finished = true;
            if (driverClosed.getAsBoolean() || !multiplexer.isOpen())
            {
                LOG.debug("Receive ended by driver close");
                return Set.of();
            }
            throw new DriverReceiveException("Multiplexed receive failed", e);
        }
    }
}
