package rs.lukaj.webfetch.connections;

/**
 * Thrown when server keeps redirecting past the limit set on {@link ResourceFetcher}. No partial
 * response is kept.
 */
public class TooManyRedirectsException extends InvalidResponseException {
    private final int hops;

    public TooManyRedirectsException(int hops) {
        super("Too many redirects (" + hops + ")");
        this.hops = hops;
    }

    /**
     * @return number of redirects received before giving up
     */
    public int getHops() {
        return hops;
    }
}
