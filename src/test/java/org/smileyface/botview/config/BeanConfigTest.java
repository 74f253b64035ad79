package org.smileyface.botview.config;

import org.junit.jupiter.api.Test;
import org.smileyface.botview.compare.CloakingComparator;
import org.smileyface.botview.engine.ContentAcquisitionEngine;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.strategy.FetchStrategy;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class BeanConfigTest {

    @Autowired
    private ContentAcquisitionEngine engine;

    @Autowired
    private CloakingComparator comparator;

    @Test
    void strategies_followConfiguredOrderPerIdentity() {
        List<String> crawler = engine.getContext().strategiesFor(Identity.CRAWLER).stream()
                .map(FetchStrategy::name).toList();
        List<String> visitor = engine.getContext().strategiesFor(Identity.VISITOR).stream()
                .map(FetchStrategy::name).toList();

        assertThat(crawler).containsExactly("affiliate-fm", "translate-proxy", "zyte", "browser-direct",
                "browser-stealth", "flaresolverr", "browser-proxy", "direct-http");
        assertThat(visitor).containsExactly("browser-visitor", "direct-http-visitor");
    }

    @Test
    void unconfiguredServices_areUnavailable() {
        for (FetchStrategy s : engine.getContext().strategiesFor(Identity.CRAWLER)) {
            switch (s.name()) {
                case "affiliate-fm", "zyte", "flaresolverr", "browser-proxy" -> assertThat(s.isAvailable())
                        .as(s.name()).isFalse();
                default -> {
                    // availability of the others depends on the environment
                }
            }
        }
    }

    @Test
    void caches_areMemoryBacked_withIdentityNamespaces() {
        assertThat(engine.getContext().cacheFor(Identity.CRAWLER).backendType()).isEqualTo("memory");
        assertThat(engine.getContext().cacheFor(Identity.CRAWLER).getNamespace()).isEqualTo("seo:html:crawler");
        assertThat(engine.getContext().cacheFor(Identity.VISITOR).getNamespace()).isEqualTo("seo:html:visitor");
        assertThat(engine.getContext().cacheFor(Identity.CRAWLER).getTtl()).isEqualTo(Duration.ofSeconds(600));
    }

    @Test
    void flaresolverrAttemptTimeout_comesFromOverride() {
        FetchStrategy flaresolverr = engine.getContext().strategiesFor(Identity.CRAWLER).stream()
                .filter(s -> s.name().equals("flaresolverr")).findFirst().orElseThrow();

        assertThat(flaresolverr.descriptor().getAttemptTimeout()).isEqualTo(Duration.ofMillis(140000));
        assertThat(comparator.compare("<p>a</p>", "<p>a</p>").detected()).isFalse();
    }
}
