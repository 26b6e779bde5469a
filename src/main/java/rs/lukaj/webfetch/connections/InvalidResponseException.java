package rs.lukaj.webfetch.connections;

/**
 * Thrown when response is unexpected (e.g. it has no status line or no header/body delimiter)
 */
public class InvalidResponseException extends RuntimeException {
    public InvalidResponseException(String message) {
        super(message);
    }
    public InvalidResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
