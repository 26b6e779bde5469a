package rs.lukaj.webfetch.connections;

import java.util.LinkedHashMap;
import java.util.Map;


/**
 * Represents headers which are received from server or sent as a part of the request.
 * Header names are case-insensitive and stored lowercase; putting the same header twice keeps the last value.
 */
public class Headers extends LinkedHashMap<String, String> { //blatant violation of Item 16, still

    @Override
    public String put(String key, String value) {
        return setHeader(key, value);
    }

    /**
     * Get value of the header identified by the name passed
     * @param header name of the header
     * @return value of the header, or null if it doesn't exist
     */
    public String getHeader(String header) {
        return get(header.toLowerCase());
    }

    /**
     * Put a new header, replacing the existing one if it exists. Header names are stored lowercase.
     * @param header name of the header
     * @param value value of the header
     * @return previous value of the header, or null if it didn't exist
     */
    public String setHeader(String header, String value) {
        return super.put(header.toLowerCase(), value);
    }

    /**
     * Put a new header from a raw header line, replacing one if it exists. Line is split on the first colon,
     * name and value are trimmed. Lines without a name are ignored.
     * @param line header line, where header name and value are separated by a colon
     * @return previous value of the header, or null if it didn't exist
     */
    public String setHeaderLine(String line) {
        String[] tokens = line.split(":", 2);
        String name = tokens[0].trim();
        if(name.isEmpty()) return null;
        String value = tokens.length == 2 ? tokens[1].trim() : "";
        return setHeader(name, value);
    }

    /**
     * Remove a header if it exists.
     * @param header header name
     * @return previous value of the header, or null if it didn't exist
     */
    public String removeHeader(String header) {
        return remove(header.toLowerCase());
    }

    /**
     * Check whether header exists and has the given value, ignoring case of the value.
     * @param header header name
     * @param value expected value
     * @return true if header is present and equal to value
     */
    public boolean headerEquals(String header, String value) {
        String actual = getHeader(header);
        return actual != null && actual.equalsIgnoreCase(value);
    }

    /**
     * Turns a stored (lowercase) name into the usual wire form, e.g. "user-agent" into "User-Agent".
     */
    static String canonicalName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = true;
        for(char c : name.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = c == '-';
        }
        return sb.toString();
    }

    /**
     * Returns headers in format appropriate for sending, in insertion order, with trailing CRLF after each.
     * @return String representation of headers
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(size() * 32);
        for(Map.Entry<String, String> header : entrySet()) {
            builder.append(canonicalName(header.getKey())).append(": ").append(header.getValue()).append("\r\n");
        }
        return builder.toString();
    }
}
