package rs.lukaj.webfetch.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State behind a browser toolbar: the current page, its content or error, and back/forward history. Every action
 * loads synchronously through a {@link LoadUrlChannel}, so call it off the UI thread.
 * <br/>
 * Only successful loads of new addresses go into history; loading something new after going back drops the
 * forward entries. Back, forward and refresh move within history without changing it.
 */
public class BrowsingSession {
    public static final String HOME = "https://browser.engineering/";
    private static final String VIEW_SOURCE_PREFIX = "view-source:";

    private final LoadUrlChannel channel;
    private final List<String> history = new ArrayList<>();
    private int historyIndex = -1;

    private String currentUrl;
    private String content = "";
    private String error;

    public BrowsingSession(LoadUrlChannel channel) {
        this.channel = channel;
    }

    /**
     * Load whatever was typed into the address bar, adding "https://" if it has no scheme.
     * @param input typed address
     * @return result of loading
     */
    public LoadResult submit(String input) {
        return load(LoadUrlChannel.normalize(input));
    }

    /**
     * Load a new address. On success it becomes the newest history entry.
     * @param url URL to load
     * @return result of loading
     */
    public LoadResult load(String url) {
        LoadResult result = show(url);
        if(result.isSuccess()) {
            while(history.size() > historyIndex + 1) history.remove(history.size() - 1);
            history.add(url);
            historyIndex = history.size() - 1;
        }
        return result;
    }

    /**
     * Load the raw source of the current page.
     * @return result of loading, or null if nothing has been loaded yet
     */
    public LoadResult viewSource() {
        if(currentUrl == null) return null;
        if(currentUrl.startsWith(VIEW_SOURCE_PREFIX)) return refresh();
        return load(VIEW_SOURCE_PREFIX + currentUrl);
    }

    /**
     * Load the current page again.
     * @return result of loading, or null if nothing has been loaded yet
     */
    public LoadResult refresh() {
        if(currentUrl == null) return null;
        return show(currentUrl);
    }

    /**
     * Go one entry back in history.
     * @return result of loading, or null if there's nowhere to go
     */
    public LoadResult back() {
        if(!canGoBack()) return null;
        historyIndex--;
        return show(history.get(historyIndex));
    }

    /**
     * Go one entry forward in history.
     * @return result of loading, or null if there's nowhere to go
     */
    public LoadResult forward() {
        if(!canGoForward()) return null;
        historyIndex++;
        return show(history.get(historyIndex));
    }

    private LoadResult show(String url) {
        currentUrl = url;
        LoadResult result = channel.load(url);
        if(result.isSuccess()) {
            content = result.getContent();
            error = null;
        } else {
            error = result.getError();
        }
        return result;
    }

    public boolean canGoBack() {
        return historyIndex > 0;
    }

    public boolean canGoForward() {
        return historyIndex < history.size() - 1;
    }

    /**
     * @return URL of the last load, successful or not
     */
    public String getCurrentUrl() {
        return currentUrl;
    }

    /**
     * @return content of the last successful load; a failed load leaves the previous content in place
     */
    public String getContent() {
        return content;
    }

    /**
     * @return error message of the last load, or null if it succeeded
     */
    public String getError() {
        return error;
    }

    /**
     * @return whether the current page is shown as raw source
     */
    public boolean isViewSource() {
        return currentUrl != null && currentUrl.startsWith(VIEW_SOURCE_PREFIX);
    }

    public List<String> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public int getHistoryIndex() {
        return historyIndex;
    }
}
