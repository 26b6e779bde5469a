package rs.lukaj.webfetch.connections;

import java.util.Arrays;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Collects response bytes as they arrive and figures out when the response is complete. Framing is decided
 * by {@link #isFramed(byte[], int)}, which only looks at the buffered bytes:
 * <ul>
 *     <li>nothing is complete before the header/body delimiter (CRLFCRLF) arrives;</li>
 *     <li>with Content-Length, response is complete once that many body bytes are buffered;</li>
 *     <li>with Transfer-Encoding: chunked, once the zero-length last chunk is buffered;</li>
 *     <li>with neither, only the end of stream completes the response.</li>
 * </ul>
 * Headers are parsed once, when the delimiter arrives, and the chunk terminator search resumes where the previous
 * one stopped, so each byte is scanned a bounded number of times. Not thread-safe; one assembler per exchange.
 */
public class ResponseAssembler {

    /**
     * Lifecycle of a single response.
     */
    public enum State {
        CONNECTING,
        AWAITING_HEADERS,
        AWAITING_BODY,
        COMPLETE,
        FAILED;

        public boolean isTerminal() {
            return this == COMPLETE || this == FAILED;
        }
    }

    private static final byte[] DELIMITER = Http.HEADER_DELIMITER.getBytes(ISO_8859_1);
    private static final byte[] LAST_CHUNK = "\r\n0\r\n\r\n".getBytes(ISO_8859_1);

    private byte[] buffer = new byte[8192];
    private int length = 0;
    private State state = State.CONNECTING;

    //known once headers are in
    private int headerEnd = -1;
    private long expectedLength = -1;
    private boolean chunked;
    private int scannedTo;

    /**
     * Signals that connection has been obtained and request sent.
     * @return new state
     */
    public State connected() {
        ensureState(State.CONNECTING);
        state = State.AWAITING_HEADERS;
        return state;
    }

    /**
     * Append bytes received from server and advance the state.
     * @param data buffer holding received bytes
     * @param offset index of the first received byte
     * @param len number of received bytes
     * @return state after these bytes
     * @throws IllegalStateException if called before {@link #connected()} or after response is complete
     */
    public State feed(byte[] data, int offset, int len) {
        if(state != State.AWAITING_HEADERS && state != State.AWAITING_BODY)
            throw new IllegalStateException("Cannot accept data in state " + state);
        int previousLength = length;
        append(data, offset, len);
        if(state == State.AWAITING_HEADERS) {
            headerEnd = indexOf(buffer, length, DELIMITER, previousLength - (DELIMITER.length - 1));
            if(headerEnd != -1) {
                readFraming();
                state = State.AWAITING_BODY;
            }
        }
        if(state == State.AWAITING_BODY && isBodyComplete()) {
            state = State.COMPLETE;
        }
        return state;
    }

    private void readFraming() {
        ResponseHeaders headers = new ResponseHeaders(new String(buffer, 0, headerEnd, ISO_8859_1));
        expectedLength = parseContentLength(headers);
        chunked = expectedLength == -1 && headers.isChunked();
        //starting at the delimiter's second CRLF, so an empty chunked body is found too
        scannedTo = headerEnd + 2;
    }

    private boolean isBodyComplete() {
        if(expectedLength != -1) return length - (headerEnd + DELIMITER.length) >= expectedLength;
        if(!chunked) return false;
        boolean found = indexOf(buffer, length, LAST_CHUNK, scannedTo) != -1;
        //terminator may straddle this feed and the next one
        scannedTo = Math.max(scannedTo, length - (LAST_CHUNK.length - 1));
        return found;
    }

    /**
     * @return Content-Length, or -1 if there's none
     * @throws InvalidResponseException if Content-Length isn't a number
     */
    private static long parseContentLength(ResponseHeaders headers) {
        String contentLength = headers.getContentLength();
        if(contentLength == null) return -1;
        try {
            long value = Long.parseLong(contentLength.trim());
            if(value < 0) throw new InvalidResponseException("Negative Content-Length: " + contentLength);
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidResponseException("Invalid Content-Length: " + contentLength, e);
        }
    }

    /**
     * Signals server has closed the stream. If headers have been received, whatever arrived is taken as the
     * whole response; otherwise the response has failed.
     * @return new state
     */
    public State endOfStream() {
        if(state == State.COMPLETE) return state;
        state = state == State.AWAITING_BODY ? State.COMPLETE : State.FAILED;
        return state;
    }

    /**
     * Marks this response as failed, e.g. when reading from socket throws.
     * @return new state
     */
    public State fail() {
        state = State.FAILED;
        return state;
    }

    public State getState() {
        return state;
    }

    public boolean isComplete() {
        return state == State.COMPLETE;
    }

    /**
     * @return copy of all bytes received so far
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(buffer, length);
    }

    private void ensureState(State expected) {
        if(state != expected) throw new IllegalStateException("Expected state " + expected + ", but was " + state);
    }

    private void append(byte[] data, int offset, int len) {
        if(length + len > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + len));
        }
        System.arraycopy(data, offset, buffer, length, len);
        length += len;
    }

    /**
     * Checks whether buffered bytes hold a complete response, judging by Content-Length or chunk terminator.
     * A response framed only by closing the connection is never complete here.
     * @param buf buffered bytes
     * @param len number of valid bytes in buf
     * @return true if nothing more needs to be read
     */
    public static boolean isFramed(byte[] buf, int len) {
        int headerEnd = indexOf(buf, len, DELIMITER, 0);
        if(headerEnd == -1) return false;

        ResponseHeaders headers = new ResponseHeaders(new String(buf, 0, headerEnd, ISO_8859_1));
        long expected = parseContentLength(headers);
        if(expected != -1) return len - (headerEnd + DELIMITER.length) >= expected;
        if(headers.isChunked()) return indexOf(buf, len, LAST_CHUNK, headerEnd + 2) != -1;
        return false;
    }

    /**
     * Finds the first occurrence of pattern in buf[from, len).
     * @return index of the first byte of pattern, or -1 if there's none
     */
    static int indexOf(byte[] buf, int len, byte[] pattern, int from) {
        outer:
        for(int i = Math.max(from, 0); i <= len - pattern.length; i++) {
            for(int j = 0; j < pattern.length; j++) {
                if(buf[i + j] != pattern[j]) continue outer;
            }
            return i;
        }
        return -1;
    }
}
