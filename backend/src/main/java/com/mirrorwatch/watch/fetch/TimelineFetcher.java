package com.mirrorwatch.watch.fetch;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.mirror.EndpointPool;
import com.mirrorwatch.watch.mirror.MirrorEndpoint;
import com.mirrorwatch.watch.model.Item;
import com.mirrorwatch.watch.model.TrackedAccount;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

@Service
public class TimelineFetcher {
    private static final Logger log = LoggerFactory.getLogger(TimelineFetcher.class);

    private final EndpointPool endpointPool;
    private final PageRenderer pageRenderer;
    private final TimelineParser timelineParser;
    private final WatchProperties properties;

    public TimelineFetcher(
        EndpointPool endpointPool,
        PageRenderer pageRenderer,
        TimelineParser timelineParser,
        WatchProperties properties
    ) {
        this.endpointPool = endpointPool;
        this.pageRenderer = pageRenderer;
        this.timelineParser = timelineParser;
        this.properties = properties;
    }

    public List<Item> fetchLatest(TrackedAccount account) {
        return fetch(account, Set.of()).items();
    }

    /**
     * Fetches the newest items of {@code account} through one endpoint of the pool, skipping
     * {@code excludedEndpoints}. The outcome is reported to the pool before returning or throwing.
     *
     * @throws com.mirrorwatch.watch.mirror.NoHealthyEndpointException when nothing is selectable
     * @throws FetchException when the selected endpoint failed
     */
    public TimelineFetch fetch(TrackedAccount account, Set<String> excludedEndpoints) {
        MirrorEndpoint endpoint = endpointPool.select(excludedEndpoints);
        String pageUrl = endpoint.getAddress() + "/" + account.handle();

        ParsedTimeline timeline;
        try {
            String content = pageRenderer.render(pageUrl);
            timeline = timelineParser.parse(content, pageUrl, account);
        } catch (RenderException e) {
            throw failure(endpoint, account, e.getReasonCode(), e.getMessage());
        } catch (RuntimeException e) {
            throw failure(endpoint, account, ReasonCodeClassifier.PARSING_FAILED, e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (timeline.entryCount() == 0) {
            throw failure(endpoint, account, ReasonCodeClassifier.EMPTY_TIMELINE, "No timeline entries on " + pageUrl);
        }
        if (timeline.items().isEmpty()) {
            throw failure(
                endpoint,
                account,
                ReasonCodeClassifier.PARSING_FAILED,
                timeline.entryCount() + " timeline entries on " + pageUrl + " but none readable"
            );
        }

        endpointPool.reportSuccess(endpoint);
        List<Item> items = timeline.items();
        int limit = properties.getScheduler().getMaxItemsPerCheck();
        if (items.size() > limit) {
            items = items.subList(0, limit);
        }
        log.debug("Fetched {} items for {} from {}", items.size(), account.handle(), endpoint.getAddress());
        return new TimelineFetch(endpoint.getAddress(), List.copyOf(items));
    }

    private FetchException failure(MirrorEndpoint endpoint, TrackedAccount account, String reasonCode, String detail) {
        endpointPool.reportFailure(endpoint);
        log.warn(
            "Fetch failed account={} endpoint={} reason={} detail={}",
            account.handle(),
            endpoint.getAddress(),
            reasonCode,
            detail
        );
        return new FetchException(reasonCode, endpoint.getAddress(), detail);
    }
}
