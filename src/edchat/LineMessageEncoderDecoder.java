package edchat;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * ============== LINE-BASED MESSAGE ENCODER/DECODER ===================
 *
 * Each text line is one message, terminated by CR-LF as telnet sends
 * it (nc needs -C). Only the pair ends a line: a bare '\n' or '\r' is
 * kept as part of the line.
 *
 * Example: the client types "hi" and presses enter, we receive:
 *   'h'  -> null
 *   'i'  -> null
 *   '\r' -> null (kept until we know what follows)
 *   '\n' -> "hi"
 *
 * Bytes of an unfinished line stay buffered across reads, so a line
 * split over several TCP segments still comes out as one message.
 *
 * Encoding appends a single '\n' to the outgoing text.
 * =====================================================================
 */
public class LineMessageEncoderDecoder implements MessageEncoderDecoder<String> {

    private byte[] bytes = new byte[1 << 10]; //start with 1k

    private int len = 0;

    @Override
    public String decodeNextByte(byte nextByte) {
        if (nextByte == '\n' && len > 0 && bytes[len - 1] == '\r') {
            return popString();
        }
        pushByte(nextByte);
        return null; //not a line yet
    }

    @Override
    public byte[] encode(String message) {
        return (message + "\n").getBytes(StandardCharsets.UTF_8);
    }

    // Grows the buffer by doubling when it is full.
    private void pushByte(byte nextByte) {
        if (len >= bytes.length) {
            bytes = Arrays.copyOf(bytes, len * 2);
        }
        bytes[len++] = nextByte;
    }

    // Drops the '\r' of the terminator.
    private String popString() {
        String result = new String(bytes, 0, len - 1, StandardCharsets.UTF_8);
        len = 0;
        return result;
    }
}
