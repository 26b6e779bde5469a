package rs.lukaj.webfetch.connections;

/**
 * Headers which are sent with the request. Provides helper functions for setting them.
 * If empty or null is passed to helper functions, header is removed.
 */
public class RequestHeaders extends Headers {
    public static final String DEFAULT_USER_AGENT = "Mozilla/5.0";

    private RequestHeaders() {
    }

    /**
     * Default header set for a fetch, in the order it's sent: Host, Connection, User-Agent, Accept,
     * Accept-Encoding.
     * @param host value for the Host header
     * @return new headers
     */
    public static RequestHeaders createDefault(String host) {
        RequestHeaders headers = new RequestHeaders();
        headers.setHost(host);
        headers.setConnection("keep-alive");
        headers.setUserAgent(DEFAULT_USER_AGENT);
        headers.setAccept("*/*");
        headers.setAcceptEncoding("gzip");
        return headers;
    }

    public void setConnection(String connection) {
        if(connection == null || connection.isEmpty()) removeHeader("Connection");
        else put("Connection", connection);
    }
    public void setAcceptEncoding(String encoding) {
        if(encoding == null || encoding.isEmpty()) removeHeader("Accept-Encoding");
        else put("Accept-Encoding", encoding);
    }
    public void setHost(String host) {
        if(host == null || host.isEmpty()) removeHeader("Host");
        else put("Host", host);
    }
    public void setUserAgent(String userAgent) {
        if(userAgent == null || userAgent.isEmpty()) removeHeader("User-Agent");
        else put("User-Agent", userAgent);
    }
    public void setAccept(String types) {
        if(types == null || types.isEmpty()) removeHeader("Accept");
        else put("Accept", types);
    }
}
