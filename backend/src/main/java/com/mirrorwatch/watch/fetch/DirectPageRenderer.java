package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.watch.http.HttpFetchResult;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;

/**
 * Fetches the mirror page with a plain GET. Enough for mirrors that serve server-side HTML.
 */
public class DirectPageRenderer implements PageRenderer {
    private static final String ACCEPT_HTML = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final OutboundHttpClient httpClient;

    public DirectPageRenderer(OutboundHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String render(String url) {
        HttpFetchResult result = httpClient.get(url, ACCEPT_HTML);
        if (!result.isSuccessful()) {
            throw new RenderException(ReasonCodeClassifier.classify(result), result.describeFailure());
        }
        if (result.body() == null || result.body().isBlank()) {
            throw new RenderException(ReasonCodeClassifier.EMPTY_TIMELINE, "Empty response body from " + url);
        }
        return result.body();
    }
}
