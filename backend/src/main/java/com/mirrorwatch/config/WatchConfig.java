package com.mirrorwatch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mirrorwatch.watch.archive.ArchiveSink;
import com.mirrorwatch.watch.archive.JsonlArchiveSink;
import com.mirrorwatch.watch.archive.NoopArchiveSink;
import com.mirrorwatch.watch.fetch.DirectPageRenderer;
import com.mirrorwatch.watch.fetch.PageRenderer;
import com.mirrorwatch.watch.fetch.RenderServicePageRenderer;
import com.mirrorwatch.watch.http.OutboundHttpClient;
import com.mirrorwatch.watch.util.NamedThreadFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class WatchConfig {

    @Bean
    public Clock watchClock() {
        return Clock.systemUTC();
    }

    @Bean(name = "accountExecutor", destroyMethod = "shutdown")
    public ExecutorService accountExecutor(WatchProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getScheduler().getAccountConcurrency(),
            new NamedThreadFactory("watch-account-")
        );
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(WatchProperties properties) {
        int size = Math.max(4, properties.getHttp().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size, new NamedThreadFactory("watch-http-"));
    }

    @Bean(name = "deliveryExecutor", destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(WatchProperties properties) {
        return Executors.newFixedThreadPool(
            properties.getDelivery().getWorkerCount(),
            new NamedThreadFactory("watch-delivery-")
        );
    }

    @Bean
    public PageRenderer pageRenderer(WatchProperties properties, OutboundHttpClient httpClient, ObjectMapper objectMapper) {
        String mode = properties.getRenderer().getMode().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "direct":
                return new DirectPageRenderer(httpClient);
            case "service":
                return new RenderServicePageRenderer(httpClient, objectMapper, properties.getRenderer().getBaseUrl());
            default:
                throw new IllegalStateException("Unknown watch.renderer.mode: " + mode + " (expected direct or service)");
        }
    }

    @Bean
    public ArchiveSink archiveSink(WatchProperties properties, ObjectMapper objectMapper) {
        if (!properties.getArchive().isEnabled()) {
            return new NoopArchiveSink();
        }
        return new JsonlArchiveSink(Paths.get(properties.getArchive().getDir()), objectMapper);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
