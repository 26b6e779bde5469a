package rs.lukaj.webfetch.connections;

import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.junit.jupiter.api.Assertions.*;
import static rs.lukaj.webfetch.connections.ResponseAssembler.State.*;

public class ResponseAssemblerTest {

    private static ResponseAssembler.State feed(ResponseAssembler assembler, String data) {
        byte[] bytes = data.getBytes(ISO_8859_1);
        return assembler.feed(bytes, 0, bytes.length);
    }

    private static boolean framed(String data) {
        byte[] bytes = data.getBytes(ISO_8859_1);
        return ResponseAssembler.isFramed(bytes, bytes.length);
    }

    /**
     * Content-Length response arriving in pieces.
     */
    @Test
    public void contentLengthLifecycle() {
        ResponseAssembler assembler = new ResponseAssembler();
        assertEquals(CONNECTING, assembler.getState());
        assertEquals(AWAITING_HEADERS, assembler.connected());
        assertEquals(AWAITING_HEADERS, feed(assembler, "HTTP/1.1 200 OK\r\nContent-Le"));
        assertEquals(AWAITING_BODY, feed(assembler, "ngth: 5\r\n\r\nhel"));
        assertEquals(COMPLETE, feed(assembler, "lo"));
        assertTrue(assembler.isComplete());
        assertEquals("HTTP/1.1 200 OK\r\nContent-Length: 5\r\n\r\nhello", new String(assembler.toByteArray(), ISO_8859_1));
    }

    @Test
    public void chunkedFraming() {
        assertFalse(framed("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n4\r\nWiki\r\n"));
        assertTrue(framed("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n4\r\nWiki\r\n5\r\npedia\r\n0\r\n\r\n"));
        assertTrue(framed("HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n0\r\n\r\n"));
    }

    @Test
    public void framingNeedsHeaders() {
        assertFalse(framed("HTTP/1.1 200 OK\r\nContent-Length: 0\r\n"));
        assertTrue(framed("HTTP/1.1 200 OK\r\nContent-Length: 0\r\n\r\n"));
        assertFalse(framed("HTTP/1.1 200 OK\r\nContent-Length: 10\r\n\r\nshort"));
    }

    @Test
    public void invalidContentLength() {
        assertThrows(InvalidResponseException.class, () -> framed("HTTP/1.1 200 OK\r\nContent-Length: lots\r\n\r\n"));
        assertThrows(InvalidResponseException.class, () -> framed("HTTP/1.1 200 OK\r\nContent-Length: -3\r\n\r\n"));
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        assertThrows(InvalidResponseException.class, () -> feed(assembler, "HTTP/1.1 200 OK\r\nContent-Length: x\r\n\r\n"));
    }

    /**
     * Delimiter and terminator split across feeds, down to one byte per feed, are still found, and only
     * at the very last byte.
     */
    @Test
    public void byteByByte() {
        String response = "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n4\r\nWiki\r\n5\r\npedia\r\n0\r\n\r\n";
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        for(int i = 0; i < response.length() - 1; i++) {
            assertFalse(feed(assembler, response.substring(i, i + 1)).isTerminal(), "complete too early at " + i);
        }
        assertEquals(COMPLETE, feed(assembler, response.substring(response.length() - 1)));
        assertEquals(response, new String(assembler.toByteArray(), ISO_8859_1));
    }

    @Test
    public void terminatorAcrossFeeds() {
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        assertEquals(AWAITING_BODY, feed(assembler, "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\n\r\n3\r\nabc\r\n0\r"));
        assertEquals(AWAITING_BODY, feed(assembler, "\n\r"));
        assertEquals(COMPLETE, feed(assembler, "\n"));
    }

    /**
     * Content-Length wins over chunking, as in {@link ResponseAssembler#isFramed(byte[], int)}.
     */
    @Test
    public void contentLengthBeforeChunked() {
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        assertEquals(COMPLETE, feed(assembler, "HTTP/1.1 200 OK\r\nTransfer-Encoding: chunked\r\nContent-Length: 2\r\n\r\nhi"));
    }

    /**
     * Without Content-Length or chunking only the server closing the stream ends the response.
     */
    @Test
    public void unframedCompletesOnEndOfStream() {
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        assertEquals(AWAITING_BODY, feed(assembler, "HTTP/1.1 200 OK\r\n\r\nanything at all"));
        assertEquals(COMPLETE, assembler.endOfStream());
    }

    @Test
    public void endOfStreamBeforeHeadersFails() {
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        feed(assembler, "HTTP/1.1 200 OK\r\n");
        assertEquals(FAILED, assembler.endOfStream());
        assertTrue(assembler.getState().isTerminal());
    }

    @Test
    public void feedInWrongState() {
        ResponseAssembler assembler = new ResponseAssembler();
        assertThrows(IllegalStateException.class, () -> feed(assembler, "HTTP/1.1"));
        assembler.connected();
        assertThrows(IllegalStateException.class, assembler::connected);
        feed(assembler, "HTTP/1.1 204 No Content\r\nContent-Length: 0\r\n\r\n");
        assertThrows(IllegalStateException.class, () -> feed(assembler, "more"));
    }

    @Test
    public void growsBuffer() {
        StringBuilder body = new StringBuilder();
        for(int i = 0; i < 20000; i++) body.append((char)('a' + i % 26));
        ResponseAssembler assembler = new ResponseAssembler();
        assembler.connected();
        feed(assembler, "HTTP/1.1 200 OK\r\nContent-Length: " + body.length() + "\r\n\r\n");
        assertEquals(COMPLETE, feed(assembler, body.toString()));
    }
}
