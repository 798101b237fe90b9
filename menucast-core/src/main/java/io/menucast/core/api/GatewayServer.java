package io.menucast.core.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.menucast.core.model.ScheduledJob;
import io.menucast.core.publish.PublishException;
import io.menucast.core.publish.RunOutcome;
import io.menucast.core.schedule.ManualTrigger;
import io.menucast.core.store.JobStore;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP surface for operators: health, schedule lookups and the manual run trigger.
 * Blocking work is dispatched off the IO thread onto Undertow's worker pool.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(GatewayServer.class);
    private static final String RUN_NOW_SUFFIX = "/run-now";
    private static final String SCHEDULES_SUFFIX = "/schedules";

    private final ObjectMapper mapper;
    private final String host;
    private final int requestedPort;
    private final JobStore store;
    private final ManualTrigger trigger;
    private final AtomicBoolean running;
    private Undertow server;
    private int actualPort;

    public GatewayServer(int port, String host, JobStore store, ManualTrigger trigger) {
        this.requestedPort = port;
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.trigger = Objects.requireNonNull(trigger, "trigger must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.running = new AtomicBoolean(false);
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addPrefixPath("/schedules", this::handleSchedules)
            .addPrefixPath("/projects", this::handleProjects);

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        this.actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Gateway listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        running.set(false);
        if (server != null) {
            server.stop();
            server = null;
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("ok", false, "error", "method_not_allowed"));
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleSchedules(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleSchedules(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String path = exchange.getRelativePath();
        String method = exchange.getRequestMethod().toString();
        boolean runNow = path.endsWith(RUN_NOW_SUFFIX);
        String rawId = trimSlashes(runNow ? path.substring(0, path.length() - RUN_NOW_SUFFIX.length()) : path);

        Long jobId = parseId(rawId);
        if (jobId == null) {
            sendJson(exchange, 404, Map.of("ok", false, "error", "NOT_FOUND", "message", "Unknown schedule path"));
            return;
        }

        if (runNow) {
            if (!"POST".equalsIgnoreCase(method)) {
                sendJson(exchange, 405, Map.of("ok", false, "error", "method_not_allowed"));
                return;
            }
            handleRunNow(exchange, jobId);
            return;
        }
        if (!"GET".equalsIgnoreCase(method)) {
            sendJson(exchange, 405, Map.of("ok", false, "error", "method_not_allowed"));
            return;
        }
        handleGetSchedule(exchange, jobId);
    }

    private void handleProjects(HttpServerExchange exchange) throws Exception {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> {
                try {
                    handleProjects(exchange);
                } catch (Exception e) {
                    sendInternalError(exchange, e);
                }
            });
            return;
        }

        String path = exchange.getRelativePath();
        Long projectId = path.endsWith(SCHEDULES_SUFFIX)
            ? parseId(trimSlashes(path.substring(0, path.length() - SCHEDULES_SUFFIX.length())))
            : null;
        if (projectId == null) {
            sendJson(exchange, 404, Map.of("ok", false, "error", "NOT_FOUND", "message", "Unknown project path"));
            return;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod().toString())) {
            sendJson(exchange, 405, Map.of("ok", false, "error", "method_not_allowed"));
            return;
        }

        List<Map<String, Object>> schedules = new ArrayList<>();
        for (ScheduledJob job : store.listJobsByProject(projectId)) {
            schedules.add(toResponse(job));
        }
        sendJson(exchange, 200, Map.of("ok", true, "data", schedules));
    }

    private void handleRunNow(HttpServerExchange exchange, long jobId) throws IOException {
        try {
            RunOutcome outcome = trigger.runNow(jobId);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", outcome.status().wireValue());
            data.put("message", outcome.message());
            data.put("richMenuIds", outcome.remoteMenuIds());
            sendJson(exchange, 200, Map.of("ok", true, "data", data));
        } catch (PublishException e) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("ok", false);
            error.put("error", e.kind().name());
            error.put("message", e.getMessage());
            sendJson(exchange, e.kind().httpStatus(), error);
        }
    }

    private void handleGetSchedule(HttpServerExchange exchange, long jobId) throws IOException {
        Optional<ScheduledJob> job = store.findJob(jobId);
        if (job.isEmpty()) {
            sendJson(exchange, 404, Map.of(
                "ok", false,
                "error", "NOT_FOUND",
                "message", "Schedule " + jobId + " not found"
            ));
            return;
        }
        sendJson(exchange, 200, Map.of("ok", true, "data", toResponse(job.get())));
    }

    private Map<String, Object> toResponse(ScheduledJob job) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", job.id());
        out.put("projectId", job.projectId());
        out.put("scope", job.scope().wireValue());
        out.put("currentTabIndex", job.currentTabIndex());
        out.put("publishTarget", job.publishTarget().wireValue());
        out.put("userIds", job.userIds());
        out.put("defaultMenuIndex", job.defaultMenuIndex());
        out.put("startDate", String.valueOf(job.startDate()));
        out.put("endDate", String.valueOf(job.endDate()));
        out.put("runTime", job.runTime());
        out.put("repeatType", job.repeatType().wireValue());
        out.put("repeatWeekday", job.repeatWeekday());
        out.put("repeatDay", job.repeatDay());
        out.put("enabled", job.enabled());
        out.put("lastRunAt", job.lastRunAt() == null ? null : job.lastRunAt().toString());
        out.put("lastRunStatus", job.lastRunStatus() == null ? null : job.lastRunStatus().wireValue());
        out.put("lastRunMessage", job.lastRunMessage());
        return out;
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        LOG.error("Request {} failed", exchange.getRequestPath(), error);
        try {
            sendJson(exchange, 500, Map.of(
                "ok", false,
                "error", "UNEXPECTED",
                "message", error.getMessage() == null ? "internal_error" : error.getMessage()
            ));
        } catch (IOException e) {
            LOG.debug("Could not send error response: {}", e.getMessage());
        }
    }

    private static String trimSlashes(String value) {
        String trimmed = value;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Long parseId(String raw) {
        if (raw.isEmpty() || raw.contains("/")) {
            return null;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }
}
