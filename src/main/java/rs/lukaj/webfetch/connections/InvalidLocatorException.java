package rs.lukaj.webfetch.connections;

/**
 * Thrown while parsing a locator string which has unknown scheme or is otherwise malformed.
 * {@link ResourceLocator#parse(String)} never lets this one out; it falls back to the default resource instead.
 */
public class InvalidLocatorException extends RuntimeException {
    public InvalidLocatorException(String message) {
        super(message);
    }
    public InvalidLocatorException(String message, Throwable cause) {
        super(message, cause);
    }
}
