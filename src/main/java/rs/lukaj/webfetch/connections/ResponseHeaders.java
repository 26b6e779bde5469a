package rs.lukaj.webfetch.connections;

/**
 * Headers which are received from server. Provides helper functions for getting them.
 */
public class ResponseHeaders extends Headers {
    public ResponseHeaders() {
    }

    /**
     * Parse a header block, one header per line. Lines may end with CRLF or just LF.
     * @param headers header block, without status line
     */
    public ResponseHeaders(String headers) {
        for (String header : headers.split("\r?\n")) {
            setHeaderLine(header);
        }
    }

    public String getCacheControl() {
        return getHeader("Cache-Control");
    }
    public String getContentLength() {
        return getHeader("Content-Length");
    }
    //used for redirection
    public String getLocation() {
        return getHeader("Location");
    }

    /**
     * @return true if server sent {@code Transfer-Encoding: chunked}
     */
    public boolean isChunked() {
        return headerEquals("Transfer-Encoding", "chunked");
    }

    /**
     * @return true if server sent {@code Content-Encoding: gzip}
     */
    public boolean isGzipped() {
        return headerEquals("Content-Encoding", "gzip");
    }

    /**
     * Only an explicit {@code Connection: keep-alive} lets the connection go back to the pool.
     * @return whether server asked to keep the connection alive
     */
    public boolean isKeepAlive() {
        return headerEquals("Connection", "keep-alive");
    }
}
