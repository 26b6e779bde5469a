package rs.lukaj.webfetch.client;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Message boundary in front of the fetcher. Takes "load-url" messages carrying a single URL and answers each with a
 * {@link LoadResult} delivered to the {@link Listener} ("url-loaded"). Loading is done on an executor, so the
 * sender is never blocked; several loads may be in flight at once.
 * <br/>
 * A message is either the bare URL or JSON of the form {@code {"url": "..."}}. Failures never escape as
 * exceptions: they become failed results with a readable message.
 */
public class LoadUrlChannel implements Closeable {
    private static final Logger LOGGER = Logger.getLogger(LoadUrlChannel.class.getName());
    private static final Pattern HAS_SCHEME = Pattern.compile("^[a-zA-Z]+://");

    /**
     * Receives results of loads started with {@link #send(String)}. Called on the executor's thread.
     */
    public interface Listener {
        /**
         * @param url URL that was loaded
         * @param result outcome of loading
         */
        void onUrlLoaded(String url, LoadResult result);
    }

    private final FetchClient client;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Listener listener;

    /**
     * Create a channel running loads on its own cached thread pool, shut down by {@link #close()}.
     * @param client client used for fetching
     * @param listener receiver of results, may be null if only the returned futures are used
     */
    public LoadUrlChannel(FetchClient client, Listener listener) {
        this(client, Executors.newCachedThreadPool(), true, listener);
    }

    /**
     * Create a channel running loads on the given executor. The executor is left running on {@link #close()}.
     * @param client client used for fetching
     * @param executor executor on which loads (and listener calls) are executed
     * @param listener receiver of results, may be null
     */
    public LoadUrlChannel(FetchClient client, ExecutorService executor, Listener listener) {
        this(client, executor, false, listener);
    }

    private LoadUrlChannel(FetchClient client, ExecutorService executor, boolean ownsExecutor, Listener listener) {
        this.client = client;
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
        this.listener = listener;
    }

    /**
     * Accept a load-url message and start loading in the background.
     * @param message bare URL or {@code {"url": "..."}}
     * @return future completed with the same result the listener receives
     */
    public Future<LoadResult> send(String message) {
        CompletableFuture<LoadResult> future = new CompletableFuture<>();
        executor.execute(() -> {
            String url = null;
            LoadResult result;
            try {
                url = extractUrl(message);
                result = load(url);
            } catch (JsonParseException e) {
                result = LoadResult.failure("Error loading URL: invalid message: " + e.getMessage());
            }
            future.complete(result);
            if(listener != null) listener.onUrlLoaded(url, result);
        });
        return future;
    }

    /**
     * Load the URL on this thread, turning any failure into a failed result.
     * @param url URL to load, used as-is (see {@link #normalize(String)})
     * @return result of loading
     */
    public LoadResult load(String url) {
        try {
            return LoadResult.success(client.load(url));
        } catch (Exception e) {
            LOGGER.log(Level.FINE, "Error loading URL " + url, e);
            return LoadResult.failure("Error loading URL: " + describe(e));
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }

    /**
     * Gets the URL out of a load-url message.
     * @param message bare URL or JSON object with a "url" string
     * @return URL
     * @throws JsonParseException if message looks like JSON, but has no "url" string
     */
    static String extractUrl(String message) {
        if(message == null) throw new JsonParseException("Message is null");
        String trimmed = message.trim();
        if(!trimmed.startsWith("{")) return message;
        JsonElement element = JsonParser.parseString(trimmed);
        if(!element.isJsonObject()) throw new JsonParseException("Message is not an object");
        JsonObject object = element.getAsJsonObject();
        JsonElement url = object.get("url");
        if(url == null || !url.isJsonPrimitive() || !url.getAsJsonPrimitive().isString())
            throw new JsonParseException("Message has no \"url\" string");
        return url.getAsString();
    }

    /**
     * What the address bar does with typed input: anything without "scheme://" in front gets "https://".
     * {@code data:} and {@code view-source:} inputs are left alone, since they have no "//".
     * @param input typed address
     * @return URL to load
     */
    public static String normalize(String input) {
        String url = input.trim();
        if(url.startsWith("data:") || url.startsWith("view-source:")) return url;
        if(!HAS_SCHEME.matcher(url).find()) url = "https://" + url;
        return url;
    }

    /**
     * Shuts down the executor if this channel created it. Loads already started will finish.
     */
    @Override
    public void close() {
        if(ownsExecutor) executor.shutdown();
    }
}
