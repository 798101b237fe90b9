package io.menucast.core.line;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.menucast.core.publish.PublishErrorKind;
import io.menucast.core.publish.PublishException;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LineRichMenuClientTest {

    private MockWebServer server;
    private LineRichMenuClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String base = server.url("/").toString();
        client = new LineRichMenuClient(base, base, Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldListMenusWithBearerToken() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "richmenus": [
                    { "richMenuId": "richmenu-1", "name": "Main", "size": { "width": 2500, "height": 1686 } },
                    { "richMenuId": "richmenu-2", "name": "Other" }
                  ]
                }
                """));

        List<RemoteRichMenu> menus = client.listMenus("token-1");

        assertThat(menus).containsExactly(
            new RemoteRichMenu("richmenu-1", "Main"),
            new RemoteRichMenu("richmenu-2", "Other")
        );
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/v2/bot/richmenu/list");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer token-1");
    }

    @Test
    void shouldCreateMenuAndReturnRemoteId() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"richMenuId\":\"richmenu-new\"}"));

        String id = client.createMenu("token", Map.of("name", "Main"));

        assertThat(id).isEqualTo("richmenu-new");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v2/bot/richmenu");
        assertThat(request.getHeader("Content-Type")).startsWith("application/json");
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"name\":\"Main\"}");
    }

    @Test
    void shouldUploadJpegContent() throws Exception {
        server.enqueue(new MockResponse().setBody("{}"));

        client.uploadContent("token", "richmenu-1", new byte[] {1, 2, 3}, "image/jpeg");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v2/bot/richmenu/richmenu-1/content");
        assertThat(request.getHeader("Content-Type")).isEqualTo("image/jpeg");
        assertThat(request.getBody().readByteArray()).containsExactly(1, 2, 3);
    }

    @Test
    void shouldAddressAliasDefaultAndUserEndpoints() throws Exception {
        for (int i = 0; i < 5; i++) {
            server.enqueue(new MockResponse().setBody("{}"));
        }

        client.updateAlias("token", "main-alias", "richmenu-1");
        client.createAlias("token", "main-alias", "richmenu-1");
        client.setDefaultMenu("token", "richmenu-1");
        client.linkMenuToUser("token", "U123", "richmenu-1");
        client.deleteMenu("token", "richmenu-old");

        RecordedRequest update = server.takeRequest();
        assertThat(update.getPath()).isEqualTo("/v2/bot/richmenu/alias/main-alias");
        assertThat(update.getBody().readUtf8()).isEqualTo("{\"richMenuId\":\"richmenu-1\"}");
        RecordedRequest create = server.takeRequest();
        assertThat(create.getPath()).isEqualTo("/v2/bot/richmenu/alias");
        assertThat(create.getBody().readUtf8())
            .isEqualTo("{\"richMenuAliasId\":\"main-alias\",\"richMenuId\":\"richmenu-1\"}");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v2/bot/user/all/richmenu/richmenu-1");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v2/bot/user/U123/richmenu/richmenu-1");
        RecordedRequest delete = server.takeRequest();
        assertThat(delete.getMethod()).isEqualTo("DELETE");
        assertThat(delete.getPath()).isEqualTo("/v2/bot/richmenu/richmenu-old");
    }

    @Test
    void shouldMapNon2xxToUpstreamRejectedWithTruncatedBody() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("x".repeat(500)));

        assertThatThrownBy(() -> client.createMenu("token", Map.of("name", "Main")))
            .isInstanceOfSatisfying(PublishException.class, error -> {
                assertThat(error.kind()).isEqualTo(PublishErrorKind.UPSTREAM_REJECTED);
                assertThat(error.upstreamStatus()).isEqualTo(400);
                assertThat(error.getMessage()).contains("(400)").doesNotContain("x".repeat(201));
            });
    }

    @Test
    void shouldMapTransportFailureToUpstreamUnavailable() throws Exception {
        MockWebServer closed = new MockWebServer();
        closed.start();
        String base = closed.url("/").toString();
        closed.shutdown();
        LineRichMenuClient offline = new LineRichMenuClient(base, base, Duration.ofSeconds(2), Duration.ofSeconds(2));

        assertThatThrownBy(() -> offline.setDefaultMenu("token", "richmenu-1"))
            .isInstanceOfSatisfying(PublishException.class, error ->
                assertThat(error.kind()).isEqualTo(PublishErrorKind.UPSTREAM_UNAVAILABLE));
    }

    @Test
    void shouldRejectCreateResponseWithoutId() {
        server.enqueue(new MockResponse().setBody("{}"));

        assertThatThrownBy(() -> client.createMenu("token", Map.of()))
            .isInstanceOfSatisfying(PublishException.class, error ->
                assertThat(error.kind()).isEqualTo(PublishErrorKind.UPSTREAM_REJECTED));
    }
}
