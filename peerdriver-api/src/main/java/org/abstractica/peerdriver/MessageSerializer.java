package org.abstractica.peerdriver;

/**
 * Converts messages to and from bytes.
 *
 * <p>Implementations must be symmetric: decoding the output of
 * {@link #encode(Message)} yields a message equal to the input.</p>
 */
public interface MessageSerializer
{
    /**
     * Encodes a message.
     *
     * @param message the message to encode
     * @return encoded bytes
     * @throws MessageCodecException if the message cannot be encoded
     */
    byte[] encode(Message message);

    /**
     * Decodes a message.
     *
     * @param data the encoded bytes
     * @return the decoded message
     * @throws MessageCodecException if the bytes are not a valid message
     */
    Message decode(byte[] data);
}
