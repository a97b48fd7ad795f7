package org.abstractica.peerdriver.impl.transport;

import java.net.ProtocolException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Splits a byte stream into length-prefixed frames.
 *
 * <p>Each frame on the wire is a 4-byte big-endian length followed by that
 * many bytes. Bytes may arrive in arbitrary chunks; the accumulator keeps
 * partial headers and bodies between calls to {@link #feed}.</p>
 *
 * <p>Not thread-safe. Each connection owns one accumulator.</p>
 */
public class FrameAccumulator
{
    /**
     * Size of the length prefix in bytes.
     */
    public static final int HEADER_SIZE = 4;

    private final int maxFrameSize;
    private final ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
    private ByteBuffer body;

    /**
     * Creates an accumulator.
     *
     * @param maxFrameSize the largest accepted frame body in bytes
     */
    public FrameAccumulator(int maxFrameSize)
    {
        if (maxFrameSize <= 0)
        {
            throw new IllegalArgumentException("maxFrameSize must be positive: " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Encodes a frame body with its length prefix.
     *
     * @param body the frame body
     * @return a buffer ready for writing (position 0, limit at end)
     */
    public static ByteBuffer frame(byte[] body)
    {
        Objects.requireNonNull(body, "body");
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + body.length);
        buffer.putInt(body.length);
        buffer.put(body);
        return buffer.flip();
    }

    /**
     * Consumes bytes, emitting every frame they complete.
     *
     * @param data     the received bytes (position to limit); fully consumed
     * @param consumer called with each complete frame body, in order
     * @throws ProtocolException if a frame header announces an invalid length
     */
    public void feed(ByteBuffer data, Consumer<byte[]> consumer) throws ProtocolException
    {
        while (data.hasRemaining())
        {
            if (body == null)
            {
                transfer(data, header);
                if (header.hasRemaining())
                {
                    return;
                }

                int length = header.flip().getInt();
                header.clear();
                if (length < 0 || length > maxFrameSize)
                {
                    throw new ProtocolException("Invalid frame length: " + length + " (max " + maxFrameSize + ")");
                }
                body = ByteBuffer.allocate(length);
            }

            transfer(data, body);
            if (!body.hasRemaining())
            {
                byte[] complete = body.array();
                body = null;
                consumer.accept(complete);
            }
        }
    }

    /**
     * Returns whether a frame has been started but not completed.
     *
     * @return true if partial data is buffered
     */
    public boolean hasPartialFrame()
    {
        return body != null || header.position() > 0;
    }

    private static void transfer(ByteBuffer source, ByteBuffer target)
    {
        int count = Math.min(source.remaining(), target.remaining());
        ByteBuffer slice = source.slice();
        slice.limit(count);
        target.put(slice);
        source.position(source.position() + count);
    }
}
