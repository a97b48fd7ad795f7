package org.abstractica.peerdriver.impl.serialization;

import org.abstractica.peerdriver.Message;
import org.abstractica.peerdriver.MessageCodecException;
import org.abstractica.peerdriver.MessageSerializer;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Binary serializer for {@link Message} envelopes.
 *
 * <p>Layout (big-endian):</p>
 * <ul>
 *   <li>version: 1 byte</li>
 *   <li>id, tag, source: 2-byte length + UTF-8 bytes each</li>
 *   <li>destination: 1-byte presence + string if present</li>
 *   <li>payload: 4-byte length + raw bytes</li>
 * </ul>
 */
public final class EnvelopeSerializer implements MessageSerializer
{
    /**
     * Current envelope format version.
     */
    public static final int VERSION = 1;

    /**
     * Maximum string length in bytes (2-byte length field).
     */
    public static final int MAX_STRING_LENGTH = 65535;

    // ========== Encoding ==========

    @Override
    public byte[] encode(Message message)
    {
        Objects.requireNonNull(message, "message");

        byte[] id = stringBytes("id", message.id());
        byte[] tag = stringBytes("tag", message.tag());
        byte[] source = stringBytes("source", message.source());
        Optional<byte[]> destination = message.destination().map(d -> stringBytes("destination", d));
        byte[] payload = message.payload();

        int size = 1
                + 2 + id.length
                + 2 + tag.length
                + 2 + source.length
                + 1 + destination.map(d -> 2 + d.length).orElse(0)
                + 4 + payload.length;

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.put((byte) VERSION);
        putString(buffer, id);
        putString(buffer, tag);
        putString(buffer, source);
        if (destination.isPresent())
        {
            buffer.put((byte) 1);
            putString(buffer, destination.get());
        }
        else
        {
            buffer.put((byte) 0);
        }
        buffer.putInt(payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    private static byte[] stringBytes(String field, String value)
    {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_STRING_LENGTH)
        {
            throw new MessageCodecException(
                    "Field " + field + " too long: " + bytes.length + " bytes (max " + MAX_STRING_LENGTH + ")");
        }
        return bytes;
    }

    private static void putString(ByteBuffer buffer, byte[] bytes)
    {
        buffer.putShort((short) bytes.length);
        buffer.put(bytes);
    }

    // ========== Decoding ==========

    @Override
    public Message decode(byte[] data)
    {
        Objects.requireNonNull(data, "data");

        ByteBuffer buffer = ByteBuffer.wrap(data);
        try
        {
            int version = buffer.get() & 0xFF;
            if (version != VERSION)
            {
                throw new MessageCodecException("Unsupported envelope version: " + version);
            }

            String id = getString(buffer);
            String tag = getString(buffer);
            String source = getString(buffer);
            Optional<String> destination = buffer.get() != 0 ? Optional.of(getString(buffer)) : Optional.empty();

            int payloadLength = buffer.getInt();
            if (payloadLength < 0 || payloadLength > buffer.remaining())
            {
                throw new MessageCodecException("Invalid payload length: " + payloadLength);
            }
            byte[] payload = new byte[payloadLength];
            buffer.get(payload);

            if (buffer.hasRemaining())
            {
                throw new MessageCodecException(buffer.remaining() + " trailing bytes after envelope");
            }
            return new Message(id, tag, source, destination, payload);
        }
        catch (BufferUnderflowException e)
        {
            throw new MessageCodecException("Truncated envelope (" + data.length + " bytes)", e);
        }
    }

    private static String getString(ByteBuffer buffer)
    {
        int length = buffer.getShort() & 0xFFFF;
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
