package rs.lukaj.webfetch.connections;

import java.util.logging.Logger;

/**
 * Follows 3xx responses for a single fetch, counting hops. Use one resolver per fetch.
 * <br/>
 * Relative targets are appended to the directory of the current path (the path itself if it ends with '/',
 * otherwise everything up to and including its last '/'), on the same scheme, host and port. Absolute http and
 * https targets are used as they are; a redirect can never lead to a file, data or view-source locator.
 */
public class RedirectResolver {
    private static final Logger LOGGER = Logger.getLogger(RedirectResolver.class.getName());

    public static final int DEFAULT_MAX_REDIRECTS = 10;

    private final int maxRedirects;
    private int hops = 0;

    public RedirectResolver() {
        this(DEFAULT_MAX_REDIRECTS);
    }

    /**
     * @param maxRedirects how many redirects can be followed; one more fails the fetch
     */
    public RedirectResolver(int maxRedirects) {
        if(maxRedirects < 0) throw new InvalidConfigException("maxRedirects can't be negative!");
        this.maxRedirects = maxRedirects;
    }

    /**
     * Figure out where to go after the response. Counts a hop for every redirect.
     * @param current locator the response came from
     * @param response received response
     * @return locator to fetch next, or null if response isn't a redirect (3xx with Location header)
     * @throws TooManyRedirectsException if this redirect goes over the limit
     * @throws InvalidResponseException if redirect points to something other than http or https
     */
    public ResourceLocator next(ResourceLocator current, HttpResponse response) {
        String location = response.getRedirectLocation();
        if(location == null) return null;
        hops++;
        if(hops > maxRedirects) throw new TooManyRedirectsException(hops);
        ResourceLocator target = ResourceLocator.parse(resolve(current, location));
        LOGGER.fine("Redirect " + hops + ": " + current + " -> " + target);
        return target;
    }

    /**
     * @return number of redirects followed so far
     */
    public int getHops() {
        return hops;
    }

    public int getMaxRedirects() {
        return maxRedirects;
    }

    /**
     * Resolves redirect target against the current locator.
     * @param current locator the redirect came from
     * @param location value of the Location header
     * @return locator string of the target
     * @throws InvalidResponseException if location names a scheme other than http or https
     */
    public static String resolve(ResourceLocator current, String location) {
        int schemeEnd = location.indexOf("://");
        if(schemeEnd == -1) return current.withPath(directoryOf(current.getPath()) + location);
        String scheme = location.substring(0, schemeEnd);
        if(!scheme.equals("http") && !scheme.equals("https"))
            throw new InvalidResponseException("Refusing to redirect to " + location);
        return location;
    }

    /**
     * @param path request path
     * @return path up to and including its last '/', or the path itself if it ends with '/'
     */
    static String directoryOf(String path) {
        if(path.endsWith("/")) return path;
        return path.substring(0, path.lastIndexOf('/') + 1);
    }
}
