package com.mirrorwatch.watch.mirror;

import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.http.HttpFetchResult;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the public mirror directory (a markdown table) and returns the addresses of the
 * instances marked online and healthy.
 */
@Service
public class MirrorDirectoryClient {
    private static final Logger log = LoggerFactory.getLogger(MirrorDirectoryClient.class);
    private static final Pattern HEALTHY_ROW = Pattern.compile(
        "\\[(.*?)\\]\\((https?://[^)]+)\\)[^\\n]*\\|\\s*:white_check_mark:\\s*\\|\\s*✅"
    );

    private final OutboundHttpClient httpClient;
    private final WatchProperties properties;

    public MirrorDirectoryClient(OutboundHttpClient httpClient, WatchProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    public boolean isConfigured() {
        return !properties.getMirror().getDirectoryUrl().isBlank();
    }

    public List<String> fetchHealthyMirrors() {
        if (!isConfigured()) {
            return List.of();
        }
        String url = properties.getMirror().getDirectoryUrl();
        HttpFetchResult result = httpClient.get(url, "text/plain,text/markdown,text/html;q=0.8,*/*;q=0.5");
        if (!result.isSuccessful() || result.body() == null) {
            log.warn(
                "Mirror directory refresh failed url={} reason={} detail={}",
                url,
                ReasonCodeClassifier.classify(result),
                result.describeFailure()
            );
            return List.of();
        }
        List<String> mirrors = parseHealthyMirrors(result.body());
        log.info("Mirror directory listed {} healthy mirrors", mirrors.size());
        return mirrors;
    }

    static List<String> parseHealthyMirrors(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return List.of();
        }
        Set<String> out = new LinkedHashSet<>();
        Matcher matcher = HEALTHY_ROW.matcher(markdown);
        while (matcher.find()) {
            String address = matcher.group(2).trim();
            while (address.endsWith("/")) {
                address = address.substring(0, address.length() - 1);
            }
            if (!address.isEmpty()) {
                out.add(address);
            }
        }
        return new ArrayList<>(out);
    }
}
