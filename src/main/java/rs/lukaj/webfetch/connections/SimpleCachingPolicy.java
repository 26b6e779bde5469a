package rs.lukaj.webfetch.connections;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The simplest non-trivial caching policy: cache every 200 response unless Cache-Control says no-store, and keep
 * it fresh for max-age seconds if Cache-Control has it.
 */
public class SimpleCachingPolicy implements CachingPolicy {
    private static final Pattern MAX_AGE = Pattern.compile("max-age=(\\d+)");

    @Override
    public boolean shouldStoreInCache(HttpResponse response) {
        if(!response.getStatus().isOk()) return false;
        String cacheControl = response.getHeaders().getCacheControl();
        if(cacheControl == null) return true;
        return !cacheControl.toLowerCase().contains("no-store");
    }

    @Override
    public Duration getMaxAge(HttpResponse response) {
        String cacheControl = response.getHeaders().getCacheControl();
        if(cacheControl == null) return null;
        Matcher m = MAX_AGE.matcher(cacheControl.toLowerCase());
        if(!m.find()) return null;
        try {
            return Duration.ofSeconds(Long.parseLong(m.group(1)));
        } catch (NumberFormatException e) { //more digits than a long holds; as good as forever
            return null;
        }
    }
}
