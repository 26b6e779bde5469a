/**
 * Classes meant to be used by the programmer (or the UI) to load URLs.
 * <br/>
 * <h3>Overview</h3>
 * {@link rs.lukaj.webfetch.client.FetchClient} provides common connection pool and cache for
 * multiple ResourceFetchers.
 * <br/>
 * {@link rs.lukaj.webfetch.client.LoadUrlChannel} takes load-url messages, loads them on an executor and answers
 * with {@link rs.lukaj.webfetch.client.LoadResult}s. It never throws at the caller; errors become messages.
 * <br/>
 * {@link rs.lukaj.webfetch.client.BrowsingSession} is the address bar: current page, history, back and forward.
 */
package rs.lukaj.webfetch.client;
