package io.menucast.core.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.menucast.core.image.AdaptiveImageEncoder;
import io.menucast.core.line.LineRichMenuClient;
import io.menucast.core.model.RichMenuDefinition;
import io.menucast.core.model.ScheduledJob;
import io.menucast.core.publish.JobExecutionPipeline;
import io.menucast.core.schedule.ManualTrigger;
import io.menucast.core.store.SqliteJobStore;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GatewayServerTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();
    private MockWebServer line;
    private SqliteJobStore store;
    private GatewayServer server;
    private Path uploads;
    private long projectId;

    @BeforeEach
    void setUp() throws IOException {
        line = new MockWebServer();
        line.start();
        String base = line.url("/").toString();
        uploads = Files.createDirectories(tempDir.resolve("uploads"));
        store = new SqliteJobStore(tempDir.resolve("menucast.db"));
        projectId = store.createProject(store.createAccount("Shop", "token"), "Project");
        JobExecutionPipeline pipeline = new JobExecutionPipeline(
            store,
            new LineRichMenuClient(base, base, Duration.ofSeconds(5), Duration.ofSeconds(5)),
            new AdaptiveImageEncoder(4_500_000, 0.9f, 0.6f, 0.1f),
            uploads,
            Clock.fixed(Instant.parse("2026-01-15T01:00:00Z"), ZoneOffset.UTC),
            ZoneId.of("Asia/Taipei")
        );
        server = new GatewayServer(0, "127.0.0.1", store, new ManualTrigger(store, pipeline));
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
        line.shutdown();
    }

    @Test
    void shouldReportHealth() throws Exception {
        HttpResponse<String> response = send("GET", "/healthz");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(response.body()).path("status").asText()).isEqualTo("ok");
    }

    @Test
    void shouldReturnScheduleById() throws Exception {
        long jobId = store.createJob(job().weekly(4).build());

        HttpResponse<String> response = send("GET", "/schedules/" + jobId);

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode data = mapper.readTree(response.body()).path("data");
        assertThat(data.path("id").asLong()).isEqualTo(jobId);
        assertThat(data.path("repeatType").asText()).isEqualTo("weekly");
        assertThat(data.path("repeatWeekday").asInt()).isEqualTo(4);
        assertThat(data.path("runTime").asText()).isEqualTo("09:00");
        assertThat(data.path("startDate").asText()).isEqualTo("2026-01-01");
    }

    @Test
    void shouldListSchedulesOfProject() throws Exception {
        long daily = store.createJob(job().build());
        long monthly = store.createJob(job().runTime("18:30").monthly(15).build());
        long otherProject = store.createProject(store.createAccount("Other", "token-2"), "Other");
        store.createJob(ScheduledJob.builder(otherProject)
            .window(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31))
            .build());

        HttpResponse<String> response = send("GET", "/projects/" + projectId + "/schedules");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("ok").asBoolean()).isTrue();
        assertThat(body.path("data").size()).isEqualTo(2);
        List<Long> ids = new ArrayList<>();
        body.path("data").forEach(node -> ids.add(node.path("id").asLong()));
        assertThat(ids).containsExactlyInAnyOrder(daily, monthly);
        body.path("data").forEach(node -> assertThat(node.path("projectId").asLong()).isEqualTo(projectId));
    }

    @Test
    void projectSchedulesShouldBeEmptyForUnknownProjectAndRejectBadPaths() throws Exception {
        HttpResponse<String> unknown = send("GET", "/projects/999/schedules");
        HttpResponse<String> garbage = send("GET", "/projects/abc/schedules");
        HttpResponse<String> bare = send("GET", "/projects/" + projectId);
        HttpResponse<String> post = send("POST", "/projects/" + projectId + "/schedules");

        assertThat(unknown.statusCode()).isEqualTo(200);
        assertThat(mapper.readTree(unknown.body()).path("data").isArray()).isTrue();
        assertThat(mapper.readTree(unknown.body()).path("data").size()).isZero();
        assertThat(garbage.statusCode()).isEqualTo(404);
        assertThat(bare.statusCode()).isEqualTo(404);
        assertThat(post.statusCode()).isEqualTo(405);
    }

    @Test
    void unknownScheduleShouldBe404() throws Exception {
        HttpResponse<String> get = send("GET", "/schedules/999");
        HttpResponse<String> run = send("POST", "/schedules/999/run-now");
        HttpResponse<String> garbage = send("GET", "/schedules/abc");

        assertThat(get.statusCode()).isEqualTo(404);
        assertThat(run.statusCode()).isEqualTo(404);
        assertThat(mapper.readTree(run.body()).path("error").asText()).isEqualTo("NOT_FOUND");
        assertThat(garbage.statusCode()).isEqualTo(404);
    }

    @Test
    void runNowShouldPublishAndReturnOutcome() throws Exception {
        ImageIO.write(new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB), "png", uploads.resolve("main.png").toFile());
        store.createRichMenu(projectId, RichMenuDefinition.draft("Main", "", List.of(), "main.png"));
        long jobId = store.createJob(job().build());
        line.enqueue(new MockResponse().setBody("{\"richmenus\":[]}"));
        line.enqueue(new MockResponse().setBody("{\"richMenuId\":\"rm-1\"}"));
        line.enqueue(new MockResponse().setBody("{}"));
        line.enqueue(new MockResponse().setBody("{}"));

        HttpResponse<String> response = send("POST", "/schedules/" + jobId + "/run-now");

        assertThat(response.statusCode()).isEqualTo(200);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("ok").asBoolean()).isTrue();
        assertThat(body.path("data").path("status").asText()).isEqualTo("success");
        assertThat(body.path("data").path("message").asText()).isEqualTo("Manual trigger succeeded");
        assertThat(line.getRequestCount()).isEqualTo(4);
    }

    @Test
    void runNowFailureShouldMapKindToStatus() throws Exception {
        store.createRichMenu(projectId, RichMenuDefinition.draft("Main", "", List.of(), "absent.png"));
        long jobId = store.createJob(job().build());

        HttpResponse<String> response = send("POST", "/schedules/" + jobId + "/run-now");

        assertThat(response.statusCode()).isEqualTo(422);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.path("ok").asBoolean()).isFalse();
        assertThat(body.path("error").asText()).isEqualTo("PRECONDITION_FAILED");
        assertThat(body.path("message").asText()).contains("absent.png");
        assertThat(store.findJob(jobId).orElseThrow().lastRunMessage()).contains("absent.png");
    }

    @Test
    void runNowShouldRequirePost() throws Exception {
        long jobId = store.createJob(job().build());

        assertThat(send("GET", "/schedules/" + jobId + "/run-now").statusCode()).isEqualTo(405);
        assertThat(line.getRequestCount()).isZero();
    }

    private ScheduledJob.Builder job() {
        return ScheduledJob.builder(projectId)
            .window(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 31))
            .runTime("09:00");
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
