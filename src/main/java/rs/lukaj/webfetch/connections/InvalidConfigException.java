package rs.lukaj.webfetch.connections;

/**
 * Thrown if configuration parameters are invalid (e.g. a negative timeout or redirect limit)
 */
public class InvalidConfigException extends RuntimeException {
    public InvalidConfigException(String message) {
        super(message);
    }
}
