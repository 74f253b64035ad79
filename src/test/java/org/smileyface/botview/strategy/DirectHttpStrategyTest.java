package org.smileyface.botview.strategy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.smileyface.botview.model.CapabilityTag;
import org.smileyface.botview.model.FailureKind;
import org.smileyface.botview.model.RawResult;
import org.smileyface.botview.testutil.Pages;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class DirectHttpStrategyTest {

    private FakeHttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
    }

    private static DirectHttpStrategy strategy(String userAgent) {
        return new DirectHttpStrategy(StrategyNames.DIRECT_HTTP, userAgent, 5000, Duration.ofSeconds(10));
    }

    @Test
    void fetch_sendsUserAgent_andReturnsBody() throws IOException {
        String page = Pages.page("Direct", 800);
        server = new FakeHttpServer().on("/page", 200, "text/html; charset=UTF-8", page);

        RawResult.Fetched fetched = (RawResult.Fetched) strategy("Googlebot/2.1").fetch(server.baseUrl() + "/page");

        assertThat(fetched.body()).isEqualTo(page);
        assertThat(fetched.status()).isEqualTo(200);
        assertThat(fetched.cloakedProvenance()).isFalse();
        assertThat(server.requests.get(0).userAgent()).isEqualTo("Googlebot/2.1");
    }

    @Test
    void errorStatus_isStillFetched_soTheDetectorCanClassifyIt() throws IOException {
        server = new FakeHttpServer().on("/denied", 403, "text/html", "<html><title>403 Forbidden</title></html>");

        RawResult result = strategy("UA").fetch(server.baseUrl() + "/denied");

        assertThat(result.isFetched()).isTrue();
        assertThat(result.statusCode()).contains(403);
    }

    @Test
    void redirect_isFollowed_andFinalUrlReported() throws IOException {
        server = new FakeHttpServer()
                .on("/old", (exchange, body) -> {
                    exchange.getResponseHeaders().add("Location", "/new");
                    exchange.sendResponseHeaders(301, -1);
                })
                .on("/new", 200, "text/html", Pages.page("New", 600));

        RawResult.Fetched fetched = (RawResult.Fetched) strategy("UA").fetch(server.baseUrl() + "/old");

        assertThat(fetched.finalUrl()).isEqualTo(server.baseUrl() + "/new");
    }

    @Test
    void connectionRefused_isTransportFailure() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        RawResult result = strategy("UA").fetch("http://localhost:" + port + "/");

        assertThat(result).isInstanceOf(RawResult.Failed.class);
        assertThat(((RawResult.Failed) result).kind()).isEqualTo(FailureKind.TRANSPORT);
    }

    @Test
    void nameIsConfigurable_andTaggedPlainHttp() {
        DirectHttpStrategy visitor = new DirectHttpStrategy(StrategyNames.DIRECT_HTTP_VISITOR, "UA", 1000, Duration.ofSeconds(1));

        assertThat(visitor.name()).isEqualTo("direct-http-visitor");
        assertThat(visitor.descriptor().hasTag(CapabilityTag.PLAIN_HTTP)).isTrue();
    }
}
