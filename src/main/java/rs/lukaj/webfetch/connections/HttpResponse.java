package rs.lukaj.webfetch.connections;

import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * Represents a HTTP response: status line, headers and body. Built from a fully assembled buffer using
 * {@link #parse(byte[])}; the body stays raw until {@link #decodeBody()} is called.
 */
public class HttpResponse {
    private static final Logger LOGGER = Logger.getLogger(HttpResponse.class.getName());

    private final Status status;
    private final ResponseHeaders headers;
    private byte[] rawBody; //dropped once decoded
    private String body;

    private HttpResponse(Status status, ResponseHeaders headers, byte[] rawBody) {
        this.status = status;
        this.headers = headers;
        this.rawBody = rawBody;
    }

    /**
     * Split an assembled response into status line, headers and raw body.
     * @param raw all bytes received for this response
     * @return parsed response, with body not yet decoded
     * @throws InvalidResponseException if there's no line ending, no header/body delimiter or the status line
     *                                  is malformed
     */
    public static HttpResponse parse(byte[] raw) {
        int lineEnd = ResponseAssembler.indexOf(raw, raw.length, Http.CRLF.getBytes(ISO_8859_1), 0);
        if(lineEnd == -1) throw new InvalidResponseException("Invalid response format - no line endings found");
        byte[] delimiter = Http.HEADER_DELIMITER.getBytes(ISO_8859_1);
        int headerEnd = ResponseAssembler.indexOf(raw, raw.length, delimiter, 0);
        if(headerEnd == -1) throw new InvalidResponseException("No header/body delimiter found in response");

        String head = new String(raw, 0, headerEnd, ISO_8859_1);
        int statusEnd = head.indexOf(Http.CRLF);
        String statusLine = statusEnd == -1 ? head : head.substring(0, statusEnd);
        Status status = new Status(statusLine);
        if(Http.Version.fromText(status.httpVersion) != Http.Version.HTTP11) {
            LOGGER.warning("Unexpected HTTP version returned by server: " + status.httpVersion);
        }
        ResponseHeaders headers = statusEnd == -1 ? new ResponseHeaders() : new ResponseHeaders(head.substring(statusEnd + 2));

        int bodyStart = headerEnd + delimiter.length;
        byte[] rawBody = new byte[raw.length - bodyStart];
        System.arraycopy(raw, bodyStart, rawBody, 0, rawBody.length);
        return new HttpResponse(status, headers, rawBody);
    }

    /**
     * Decodes the body using {@link ContentDecoder}. Idempotent: once decoded, the same text is returned.
     * @return decoded body
     * @throws ContentDecodingException if body can't be decoded
     */
    public String decodeBody() throws ContentDecodingException {
        if(body == null) {
            body = ContentDecoder.decode(headers, rawBody);
            rawBody = null;
        }
        return body;
    }

    /**
     * @return undecoded body, or null once {@link #decodeBody()} has succeeded
     */
    byte[] getRawBody() {
        return rawBody;
    }

    /**
     * Get data from Status-Line received in this response.
     * @return status line data
     */
    public Status getStatus() {
        return status;
    }

    /**
     * Get response headers received.
     * @return received headers
     */
    public ResponseHeaders getHeaders() {
        return headers;
    }

    /**
     * @return decoded body
     * @throws IllegalStateException if body hasn't been decoded yet
     */
    public String getBody() {
        if(body == null) throw new IllegalStateException("Body hasn't been decoded yet");
        return body;
    }

    /**
     * @return redirect target if this is a 3xx response with a Location header, otherwise null
     */
    public String getRedirectLocation() {
        if(!status.isRedirect()) return null;
        return headers.getLocation();
    }

    /**
     * Represents data contained in a Status-Line of the response. Contains HTTP version, response code and
     * a response phrase ("explanation").
     */
    public static class Status {
        public final String httpVersion;
        public final int responseCode;
        public final String responsePhrase;

        public Status(String httpVersion, int responseCode, String responsePhrase) {
            this.httpVersion = httpVersion;
            this.responseCode = responseCode;
            this.responsePhrase = responsePhrase;
        }

        /**
         * Parse a status line, e.g. "HTTP/1.1 404 Not Found". Everything after the code is the phrase.
         * @param statusLine status line, without CRLF
         * @throws InvalidResponseException if there's no numeric status code
         */
        public Status(String statusLine) {
            String[] tokens = statusLine.split(" ", 3);
            if(tokens.length < 2) throw new InvalidResponseException("Malformed status line: " + statusLine);
            httpVersion = tokens[0];
            try {
                responseCode = Integer.parseInt(tokens[1]);
            } catch (NumberFormatException e) {
                throw new InvalidResponseException("Malformed status code in: " + statusLine, e);
            }
            responsePhrase = tokens.length == 3 ? tokens[2] : "";
        }

        public boolean isOk() {
            return responseCode == 200;
        }

        public boolean isRedirect() {
            return responseCode >= 300 && responseCode < 400;
        }

        @Override
        public String toString() {
            return httpVersion + " " + responseCode + " " + responsePhrase;
        }
    }
}
