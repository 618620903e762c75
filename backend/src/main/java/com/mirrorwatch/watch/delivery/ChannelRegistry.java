package com.mirrorwatch.watch.delivery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorwatch.config.WatchProperties;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class ChannelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final List<NotificationChannel> enabledChannels;

    public ChannelRegistry(WatchProperties properties, OutboundHttpClient httpClient, ObjectMapper objectMapper) {
        this.enabledChannels = List.copyOf(build(properties.getChannels(), httpClient, objectMapper));
        if (enabledChannels.isEmpty()) {
            log.warn("No notification channels enabled; new items will be archived only");
        } else {
            log.info("Notification channels: {}", enabledChannels.stream().map(NotificationChannel::name).toList());
        }
    }

    public List<NotificationChannel> enabledChannels() {
        return enabledChannels;
    }

    static List<NotificationChannel> build(
        List<WatchProperties.ChannelEntry> entries,
        OutboundHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        List<NotificationChannel> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        int index = 0;
        for (WatchProperties.ChannelEntry entry : entries) {
            index++;
            if (entry == null || !entry.isEnabled()) {
                continue;
            }
            if (entry.getType() == null) {
                throw new IllegalStateException("watch.channels[" + (index - 1) + "] has no type");
            }
            String name = entry.getName() == null || entry.getName().isBlank()
                ? entry.getType().name().toLowerCase(Locale.ROOT) + "-" + index
                : entry.getName().trim();
            if (!names.add(name)) {
                throw new IllegalStateException("Duplicate notification channel name: " + name);
            }
            out.add(create(name, entry, httpClient, objectMapper));
        }
        return out;
    }

    private static NotificationChannel create(
        String name,
        WatchProperties.ChannelEntry entry,
        OutboundHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        switch (entry.getType()) {
            case SERVERCHAN:
                return new ServerChanChannel(name, requireKey(name, entry), entry.getUrl(), entry.getTags(), httpClient, objectMapper);
            case PUSHDEER:
                return new PushDeerChannel(name, requireKey(name, entry), entry.getUrl(), httpClient, objectMapper);
            case WEBHOOK:
                if (entry.getUrl() == null || entry.getUrl().isBlank()) {
                    throw new IllegalStateException("Webhook channel " + name + " requires a url");
                }
                return new WebhookChannel(name, entry.getUrl(), httpClient, objectMapper);
            default:
                throw new IllegalStateException("Unsupported channel type " + entry.getType() + " for " + name);
        }
    }

    private static String requireKey(String name, WatchProperties.ChannelEntry entry) {
        if (entry.getKey() == null || entry.getKey().isBlank()) {
            throw new IllegalStateException(entry.getType() + " channel " + name + " requires a key");
        }
        return entry.getKey().trim();
    }
}
