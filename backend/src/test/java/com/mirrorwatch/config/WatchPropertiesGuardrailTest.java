package com.mirrorwatch.config;

import com.mirrorwatch.watch.model.TrackedAccount;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WatchPropertiesGuardrailTest {

    @Test
    void blankUserAgentFallsBackToBrowserDefault() {
        WatchProperties properties = new WatchProperties();
        assertThat(properties.getUserAgent()).startsWith("Mozilla/5.0");

        properties.setUserAgent("  custom-agent  ");
        assertThat(properties.getUserAgent()).isEqualTo("custom-agent");
    }

    @Test
    void numericSettingsAreClamped() {
        WatchProperties properties = new WatchProperties();
        properties.getMirror().setFailureThreshold(0);
        properties.getMirror().setBackoffBaseSeconds(120);
        properties.getMirror().setBackoffMaxSeconds(10);
        properties.getHttp().setGlobalConcurrency(-3);
        properties.getHttp().setRequestMaxRetries(-1);
        properties.getAnalysis().setMaxTokens(0);
        properties.getDedup().setSimilarityWindowMinutes(0);
        properties.getDedup().setSimilarityThreshold(1.7);

        assertThat(properties.getMirror().getFailureThreshold()).isEqualTo(1);
        assertThat(properties.getMirror().getBackoffMaxSeconds()).isEqualTo(120);
        assertThat(properties.getHttp().getGlobalConcurrency()).isEqualTo(1);
        assertThat(properties.getHttp().getRequestMaxRetries()).isZero();
        assertThat(properties.getAnalysis().getMaxTokens()).isEqualTo(1);
        assertThat(properties.getDedup().getSimilarityWindowMinutes()).isEqualTo(1);
        assertThat(properties.getDedup().getSimilarityThreshold()).isEqualTo(1.0);
    }

    @Test
    void trackedAccountsMergeStructuredAndCompactForms() {
        WatchProperties properties = new WatchProperties();
        WatchProperties.Account structured = new WatchProperties.Account();
        structured.setAlias("Alice");
        structured.setHandle("@alice");
        properties.setAccounts(List.of(structured));
        properties.setAccountList("Dup:alice, bob ,Carol:carol,Empty:");

        assertThat(properties.trackedAccounts()).containsExactly(
            new TrackedAccount("Alice", "alice"),
            new TrackedAccount("bob", "bob"),
            new TrackedAccount("Carol", "carol")
        );
    }
}
