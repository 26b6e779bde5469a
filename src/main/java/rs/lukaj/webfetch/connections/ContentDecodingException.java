package rs.lukaj.webfetch.connections;

import java.io.IOException;

/**
 * Thrown when body cannot be decoded, e.g. gzip stream is corrupt or data URI has bad percent-escapes.
 */
public class ContentDecodingException extends IOException {
    public ContentDecodingException(String message) {
        super(message);
    }
    public ContentDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
