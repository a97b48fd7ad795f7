package org.abstractica.peerdriver;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An immutable message exchanged between peers.
 *
 * <p>The driver does not interpret the payload. The tag is a kind
 * discriminator the caller uses for routing and logging. Unicast messages
 * carry a destination peer name; broadcast messages carry none.</p>
 *
 * @param id          unique message identifier
 * @param tag         message kind
 * @param source      name of the sending peer
 * @param destination name of the receiving peer, empty for broadcast
 * @param payload     opaque payload bytes
 */
public record Message(String id, String tag, String source, Optional<String> destination, byte[] payload)
{
    public Message
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(payload, "payload");
        payload = payload.clone();
    }

    /**
     * Creates a message addressed to a single peer.
     *
     * @param tag         message kind
     * @param source      sending peer name
     * @param destination receiving peer name
     * @param payload     payload bytes
     * @return a new message with a random id
     */
    public static Message unicast(String tag, String source, String destination, byte[] payload)
    {
        Objects.requireNonNull(destination, "destination");
        return new Message(UUID.randomUUID().toString(), tag, source, Optional.of(destination), payload);
    }

    /**
     * Creates a message for every subscribed peer.
     *
     * @param tag     message kind
     * @param source  sending peer name
     * @param payload payload bytes
     * @return a new message with a random id and no destination
     */
    public static Message broadcast(String tag, String source, byte[] payload)
    {
        return new Message(UUID.randomUUID().toString(), tag, source, Optional.empty(), payload);
    }

    /**
     * Returns a copy of the payload.
     *
     * @return payload bytes
     */
    @Override
    public byte[] payload()
    {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (!(o instanceof Message other))
        {
            return false;
        }
        return id.equals(other.id)
                && tag.equals(other.tag)
                && source.equals(other.source)
                && destination.equals(other.destination)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode()
    {
        int result = Objects.hash(id, tag, source, destination);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString()
    {
        return "Message[id=" + id
                + ", tag=" + tag
                + ", source=" + source
                + ", destination=" + destination.orElse("*")
                + ", payload=" + payload.length + " bytes]";
    }
}
