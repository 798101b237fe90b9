package io.menucast.core.line;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.menucast.core.config.model.LineApiConfig;
import io.menucast.core.publish.PublishErrorKind;
import io.menucast.core.publish.PublishException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls to the LINE Messaging API rich menu endpoints. The channel access token is passed
 * on every call so one client serves all accounts. Non-2xx responses become
 * {@code UPSTREAM_REJECTED}, transport failures {@code UPSTREAM_UNAVAILABLE}; nothing is retried.
 */
public final class LineRichMenuClient {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 200;

    private final HttpUrl apiBase;
    private final HttpUrl dataApiBase;
    private final OkHttpClient client;
    private final OkHttpClient uploadClient;
    private final ObjectMapper mapper;

    public LineRichMenuClient(LineApiConfig config) {
        this(
            config.apiBase(),
            config.dataApiBase(),
            Duration.ofSeconds(config.timeoutSeconds()),
            Duration.ofSeconds(config.uploadTimeoutSeconds())
        );
    }

    public LineRichMenuClient(String apiBase, String dataApiBase, Duration timeout, Duration uploadTimeout) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.dataApiBase = HttpUrl.get(Objects.requireNonNull(dataApiBase, "dataApiBase must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .callTimeout(timeout)
            .build();
        this.uploadClient = client.newBuilder()
            .callTimeout(uploadTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    public List<RemoteRichMenu> listMenus(String token) throws PublishException {
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/richmenu/list"))
            .get()
            .build();
        String body = execute(client, request, "List rich menus");
        try {
            List<RemoteRichMenu> menus = new ArrayList<>();
            for (JsonNode menu : mapper.readTree(body).path("richmenus")) {
                menus.add(new RemoteRichMenu(menu.path("richMenuId").asText(""), menu.path("name").asText("")));
            }
            return menus;
        } catch (IOException e) {
            throw PublishException.rejected("List rich menus returned unreadable body: " + truncate(body), 200);
        }
    }

    public void deleteMenu(String token, String richMenuId) throws PublishException {
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/richmenu").newBuilder().addPathSegment(richMenuId).build())
            .delete()
            .build();
        execute(client, request, "Delete rich menu " + richMenuId);
    }

    /**
     * Creates the menu object and returns the id assigned by LINE.
     */
    public String createMenu(String token, Map<String, Object> descriptor) throws PublishException {
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/richmenu"))
            .post(jsonBody(descriptor))
            .build();
        String body = execute(client, request, "Create rich menu");
        String richMenuId;
        try {
            richMenuId = mapper.readTree(body).path("richMenuId").asText("");
        } catch (IOException e) {
            richMenuId = "";
        }
        if (richMenuId.isBlank()) {
            throw PublishException.rejected("Create rich menu returned no richMenuId: " + truncate(body), 200);
        }
        return richMenuId;
    }

    public void uploadContent(String token, String richMenuId, byte[] content, String contentType) throws PublishException {
        Request request = authorized(token)
            .url(url(dataApiBase, "v2/bot/richmenu").newBuilder()
                .addPathSegment(richMenuId)
                .addPathSegment("content")
                .build())
            .post(RequestBody.create(content, MediaType.get(contentType)))
            .build();
        execute(uploadClient, request, "Upload image");
    }

    public void updateAlias(String token, String aliasId, String richMenuId) throws PublishException {
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/richmenu/alias").newBuilder().addPathSegment(aliasId).build())
            .post(jsonBody(Map.of("richMenuId", richMenuId)))
            .build();
        execute(client, request, "Update alias " + aliasId);
    }

    public void createAlias(String token, String aliasId, String richMenuId) throws PublishException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("richMenuAliasId", aliasId);
        payload.put("richMenuId", richMenuId);
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/richmenu/alias"))
            .post(jsonBody(payload))
            .build();
        execute(client, request, "Create alias " + aliasId);
    }

    public void setDefaultMenu(String token, String richMenuId) throws PublishException {
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/user/all/richmenu").newBuilder().addPathSegment(richMenuId).build())
            .post(emptyBody())
            .build();
        execute(client, request, "Set default rich menu");
    }

    public void linkMenuToUser(String token, String userId, String richMenuId) throws PublishException {
        Request request = authorized(token)
            .url(url(apiBase, "v2/bot/user").newBuilder()
                .addPathSegment(userId)
                .addPathSegment("richmenu")
                .addPathSegment(richMenuId)
                .build())
            .post(emptyBody())
            .build();
        execute(client, request, "Link rich menu to user " + userId);
    }

    private String execute(OkHttpClient httpClient, Request request, String operation) throws PublishException {
        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw PublishException.rejected(
                    operation + " failed (" + response.code() + "): " + truncate(body),
                    response.code()
                );
            }
            return body;
        } catch (IOException e) {
            throw PublishException.unavailable(operation + " failed: " + e.getMessage(), e);
        }
    }

    private Request.Builder authorized(String token) {
        return new Request.Builder().header("Authorization", "Bearer " + (token == null ? "" : token));
    }

    private RequestBody jsonBody(Map<String, Object> payload) throws PublishException {
        try {
            return RequestBody.create(mapper.writeValueAsString(payload), JSON);
        } catch (IOException e) {
            throw new PublishException(
                PublishErrorKind.UNEXPECTED,
                "Failed to serialize request: " + e.getMessage(),
                e
            );
        }
    }

    private RequestBody emptyBody() {
        return RequestBody.create(new byte[0], null);
    }

    private HttpUrl url(HttpUrl base, String path) {
        return base.newBuilder().addPathSegments(path).build();
    }

    static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() <= MAX_ERROR_BODY ? value : value.substring(0, MAX_ERROR_BODY);
    }
}
