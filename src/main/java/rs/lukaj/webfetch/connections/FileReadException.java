package rs.lukaj.webfetch.connections;

import java.io.IOException;

/**
 * Thrown when a file:// resource cannot be read.
 */
public class FileReadException extends IOException {
    public FileReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
