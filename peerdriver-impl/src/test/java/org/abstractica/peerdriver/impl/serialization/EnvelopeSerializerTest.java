package org.abstractica.peerdriver.impl.serialization;

import org.abstractica.peerdriver.Message;
import org.abstractica.peerdriver.MessageCodecException;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EnvelopeSerializer}.
 */
class EnvelopeSerializerTest
{
    private final EnvelopeSerializer serializer = new EnvelopeSerializer();

    // ========== Round Trips ==========

    @Test
    void unicastMessage_survivesEncodeDecode()
    {
        Message original = new Message("id-1", "task", "worker-1", Optional.of("master"), new byte[]{1, 2, 3});

        assertEquals(original, serializer.decode(serializer.encode(original)));
    }

    @Test
    void broadcastMessage_keepsEmptyDestination()
    {
        Message original = new Message("id-2", "heartbeat", "master", Optional.empty(), new byte[0]);

        Message decoded = serializer.decode(serializer.encode(original));

        assertTrue(decoded.destination().isEmpty());
        assertEquals(original, decoded);
    }

    @Test
    void nonAsciiStrings_areUtf8()
    {
        Message original = new Message("id-3", "tæst", "københavn", Optional.of("århus"), new byte[]{9});

        assertEquals(original, serializer.decode(serializer.encode(original)));
    }

    // ========== Layout ==========

    @Test
    void encode_followsDocumentedLayout()
    {
        Message message = new Message("i", "t", "s", Optional.of("d"), new byte[]{42});

        ByteBuffer buffer = ByteBuffer.wrap(serializer.encode(message));

        assertEquals(EnvelopeSerializer.VERSION, buffer.get());
        assertEquals(1, buffer.getShort());
        assertEquals('i', buffer.get());
        assertEquals(1, buffer.getShort());
        assertEquals('t', buffer.get());
        assertEquals(1, buffer.getShort());
        assertEquals('s', buffer.get());
        assertEquals(1, buffer.get());
        assertEquals(1, buffer.getShort());
        assertEquals('d', buffer.get());
        assertEquals(1, buffer.getInt());
        assertEquals(42, buffer.get());
        assertFalse(buffer.hasRemaining());
    }

    // ========== Errors ==========

    @Test
    void encode_rejectsOversizedString()
    {
        char[] chars = new char[EnvelopeSerializer.MAX_STRING_LENGTH + 1];
        Arrays.fill(chars, 'x');
        Message message = Message.broadcast(new String(chars), "src", new byte[0]);

        assertThrows(MessageCodecException.class, () -> serializer.encode(message));
    }

    @Test
    void decode_rejectsUnknownVersion()
    {
        byte[] data = serializer.encode(Message.broadcast("tag", "src", new byte[0]));
        data[0] = 7;

        MessageCodecException e = assertThrows(MessageCodecException.class, () -> serializer.decode(data));
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void decode_rejectsTruncatedData()
    {
        byte[] data = serializer.encode(Message.broadcast("tag", "src", new byte[]{1, 2, 3}));

        assertThrows(MessageCodecException.class,
                () -> serializer.decode(Arrays.copyOf(data, data.length - 5)));
        assertThrows(MessageCodecException.class, () -> serializer.decode(new byte[0]));
    }

    @Test
    void decode_rejectsTrailingBytes()
    {
        byte[] data = serializer.encode(Message.broadcast("tag", "src", new byte[]{1}));

        assertThrows(MessageCodecException.class,
                () -> serializer.decode(Arrays.copyOf(data, data.length + 1)));
    }

    @Test
    void decode_rejectsGarbage()
    {
        byte[] garbage = "definitely not an envelope".getBytes(StandardCharsets.US_ASCII);

        assertThrows(MessageCodecException.class, () -> serializer.decode(garbage));
    }
}
