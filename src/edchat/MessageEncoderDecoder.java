package edchat;

/**
 * ================= MESSAGE ENCODER/DECODER INTERFACE ==================
 *
 * Turns the raw byte stream of one connection into messages and
 * messages back into bytes.
 *
 *   [network bytes] --> decodeNextByte() --> [complete message of type T]
 *   [message of type T] --> encode() --> [network bytes]
 *
 * An instance keeps the partial message of ONE connection between
 * reads, so every connection gets its own instance.
 * =====================================================================
 */
public interface MessageEncoderDecoder<T> {

    /**
     * Feeds the next byte read from the network.
     *
     * @param nextByte the next byte read from the network
     * @return the completed message, or null while more bytes are needed
     */
    T decodeNextByte(byte nextByte);

    /**
     * @param message the message to send
     * @return its wire representation, including any terminator
     */
    byte[] encode(T message);
}
