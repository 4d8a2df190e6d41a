package villagecompute.autopost.integration.notify;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;

/**
 * Tests for {@link WxPusherClient}.
 */
class WxPusherClientTest {

    private WireMockServer wireMockServer;
    private String baseUrl;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();
        baseUrl = "http://localhost:" + wireMockServer.port();
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null && wireMockServer.isRunning()) {
            wireMockServer.stop();
        }
    }

    @Test
    void testSend_success() {
        wireMockServer.stubFor(post(urlEqualTo("/api/send/message"))
                .willReturn(aResponse().withStatus(200).withBody("{\"code\":1000,\"msg\":\"处理成功\"}")));
        WxPusherClient client = new WxPusherClient(new ObjectMapper(), baseUrl, Optional.of("AT_token"),
                Optional.of("UID_a, UID_b"));

        assertTrue(client.send("✅ 周末咖啡探店", "笔记ID：note-123"));

        wireMockServer.verify(postRequestedFor(urlEqualTo("/api/send/message"))
                .withRequestBody(matchingJsonPath("$.appToken", equalTo("AT_token")))
                .withRequestBody(matchingJsonPath("$.contentType", equalTo("1")))
                .withRequestBody(matchingJsonPath("$.uids[1]", equalTo("UID_b"))));
    }

    @Test
    void testSend_rejectedCode() {
        wireMockServer.stubFor(post(urlEqualTo("/api/send/message"))
                .willReturn(aResponse().withStatus(200).withBody("{\"code\":1001,\"msg\":\"appToken错误\"}")));
        WxPusherClient client = new WxPusherClient(new ObjectMapper(), baseUrl, Optional.of("AT_bad"),
                Optional.of("UID_a"));

        assertFalse(client.send("s", "c"));
    }

    @Test
    void testSend_disabledWithoutToken() {
        WxPusherClient client = new WxPusherClient(new ObjectMapper(), baseUrl, Optional.empty(), Optional.of("UID_a"));

        assertFalse(client.isEnabled());
        assertFalse(client.send("s", "c"));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }
}
