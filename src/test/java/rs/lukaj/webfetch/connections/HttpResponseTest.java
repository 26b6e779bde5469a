package rs.lukaj.webfetch.connections;

import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.ISO_8859_1;
import static org.junit.jupiter.api.Assertions.*;

public class HttpResponseTest {

    private static HttpResponse parse(String raw) {
        return HttpResponse.parse(raw.getBytes(ISO_8859_1));
    }

    @Test
    public void parseResponse() throws ContentDecodingException {
        HttpResponse response = parse("HTTP/1.1 301 Moved Permanently\r\nLOCATION: /new\r\nCache-Control: max-age=5\r\n\r\nbody");
        assertEquals("HTTP/1.1", response.getStatus().httpVersion);
        assertEquals(301, response.getStatus().responseCode);
        assertEquals("Moved Permanently", response.getStatus().responsePhrase);
        assertTrue(response.getStatus().isRedirect());
        assertEquals("/new", response.getRedirectLocation());
        assertEquals("max-age=5", response.getHeaders().getCacheControl());
        assertThrows(IllegalStateException.class, response::getBody);
        assertArrayEquals("body".getBytes(ISO_8859_1), response.getRawBody());
        assertEquals("body", response.decodeBody());
        assertNull(response.getRawBody()); //only the decoded body is kept
        assertEquals("body", response.decodeBody());
        assertEquals("body", response.getBody());
    }

    @Test
    public void noRedirectWithoutLocation() {
        assertNull(parse("HTTP/1.1 304 Not Modified\r\n\r\n").getRedirectLocation());
        assertNull(parse("HTTP/1.1 200 OK\r\nLocation: /x\r\n\r\n").getRedirectLocation());
    }

    /**
     * Missing line endings and missing header/body delimiter are both hard errors.
     */
    @Test
    public void malformedResponses() {
        assertThrows(InvalidResponseException.class, () -> parse("garbage without line endings"));
        assertThrows(InvalidResponseException.class, () -> parse("HTTP/1.1 200 OK\r\nContent-Length: 5\r\n"));
        assertThrows(InvalidResponseException.class, () -> parse("HTTP/1.1 two-hundred OK\r\n\r\n"));
        assertThrows(InvalidResponseException.class, () -> parse("HTTP/1.1\r\n\r\n"));
    }

    @Test
    public void statusWithoutPhrase() {
        HttpResponse.Status status = new HttpResponse.Status("HTTP/1.0 200");
        assertTrue(status.isOk());
        assertEquals("", status.responsePhrase);
    }
}
