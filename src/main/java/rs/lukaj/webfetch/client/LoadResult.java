package rs.lukaj.webfetch.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.util.Objects;

/**
 * Result of loading a URL, as delivered on the "url-loaded" side of {@link LoadUrlChannel}. Either
 * {@code success} with {@code content}, or a failure with an {@code error} message; never both.
 */
public class LoadResult {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final boolean success;
    private final String content;
    private final String error;

    private LoadResult(boolean success, String content, String error) {
        this.success = success;
        this.content = content;
        this.error = error;
    }

    public static LoadResult success(String content) {
        return new LoadResult(true, Objects.requireNonNull(content, "content"), null);
    }

    public static LoadResult failure(String error) {
        return new LoadResult(false, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return loaded body, or null if loading failed
     */
    public String getContent() {
        return content;
    }

    /**
     * @return human-readable error message, or null if loading succeeded
     */
    public String getError() {
        return error;
    }

    /**
     * @return message form, e.g. {@code {"success":true,"content":"..."}}; absent field is left out
     */
    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Parse the message form of a result.
     * @param json message produced by {@link #toJson()}
     * @return parsed result
     * @throws JsonParseException if message isn't a valid result
     */
    public static LoadResult fromJson(String json) {
        LoadResult parsed = GSON.fromJson(json, LoadResult.class);
        if(parsed == null) throw new JsonParseException("Empty message");
        if(parsed.success && parsed.content == null) throw new JsonParseException("Successful result without content");
        if(!parsed.success && parsed.error == null) throw new JsonParseException("Failed result without error");
        return parsed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LoadResult other = (LoadResult) o;
        return success == other.success && Objects.equals(content, other.content) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(success, content, error);
    }

    @Override
    public String toString() {
        return success ? "LoadResult[success, " + content.length() + " chars]" : "LoadResult[error: " + error + "]";
    }
}
