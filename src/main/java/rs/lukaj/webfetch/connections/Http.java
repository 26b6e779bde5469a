package rs.lukaj.webfetch.connections;

/**
 * Wrapper class for HTTP properties.
 */
public class Http {

    /**
     * Bytes separating header block from the body.
     */
    public static final String HEADER_DELIMITER = "\r\n\r\n";
    public static final String CRLF = "\r\n";

    /**
     * HTTP version used for requests. Fetcher always speaks HTTP/1.1; other versions are recognized only
     * so they can be reported when a server answers with one.
     */
    public enum Version {
        HTTP10("HTTP/1.0"),
        HTTP11("HTTP/1.1");

        private final String text;

        Version(String text) {
            this.text = text;
        }

        /**
         * @param text version as it appears on the status line, e.g. "HTTP/1.1"
         * @return matching version, or null if unknown
         */
        public static Version fromText(String text) {
            for(Version v : values()) {
                if(v.text.equals(text)) return v;
            }
            return null;
        }

        @Override
        public String toString() {
            return text;
        }
    }
}
