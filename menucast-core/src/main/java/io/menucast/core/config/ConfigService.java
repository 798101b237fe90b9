package io.menucast.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.menucast.core.config.model.GatewayConfig;
import io.menucast.core.config.model.LineApiConfig;
import io.menucast.core.config.model.MenucastConfig;
import io.menucast.core.config.model.SchedulerConfig;
import io.menucast.core.store.SqliteJobStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import okhttp3.HttpUrl;

/**
 * Reads and writes {@code config.json}. Keys missing from the file fall back to
 * {@link MenucastConfig#defaults()}, and a config the scheduler, LINE client or gateway could
 * not start with is rejected when it is loaded.
 */
public final class ConfigService {
    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public MenucastConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        MenucastConfig config = Files.exists(configPath)
            ? overDefaults(readTree(configPath))
            : MenucastConfig.defaults();
        validate(configPath, config);
        return config;
    }

    public void save(Path configPath, MenucastConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.toAbsolutePath().getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    /**
     * Brings the config file up to date and prepares storage: the upload folder is created and
     * the job database schema is initialized.
     *
     * @param reset replace an existing file with the defaults instead of filling in what it lacks
     */
    public OnboardResult onboard(Path configPath, boolean reset) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        OnboardResult.ConfigAction action;
        List<String> filledSections;
        MenucastConfig config;
        if (!Files.exists(configPath)) {
            action = OnboardResult.ConfigAction.CREATED;
            config = MenucastConfig.defaults();
            filledSections = sectionNames(mapper.valueToTree(config));
        } else if (reset) {
            action = OnboardResult.ConfigAction.RESET;
            config = MenucastConfig.defaults();
            filledSections = List.of();
        } else {
            action = OnboardResult.ConfigAction.MERGED;
            JsonNode existing = readTree(configPath);
            config = overDefaults(existing);
            filledSections = missingSections(existing);
        }
        validate(configPath, config);
        save(configPath, config);

        Path uploads = Files.createDirectories(ConfigPaths.resolveUploadFolder(config.storage().uploadFolder()));
        Path database = ConfigPaths.resolveDatabase(config.storage().databasePath());
        new SqliteJobStore(database);
        return new OnboardResult(action, configPath, database, uploads, filledSections);
    }

    private JsonNode readTree(Path configPath) throws IOException {
        JsonNode node = mapper.readTree(Files.readString(configPath));
        if (node == null || !node.isObject()) {
            throw new IOException("Config " + configPath + " must contain a JSON object");
        }
        return node;
    }

    private MenucastConfig overDefaults(JsonNode existing) throws IOException {
        JsonNode merged = deepMerge(mapper.valueToTree(MenucastConfig.defaults()), existing);
        return mapper.treeToValue(merged, MenucastConfig.class);
    }

    private List<String> missingSections(JsonNode existing) {
        List<String> missing = new ArrayList<>();
        for (String section : sectionNames(mapper.valueToTree(MenucastConfig.defaults()))) {
            if (!existing.has(section)) {
                missing.add(section);
            }
        }
        return missing;
    }

    private static List<String> sectionNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        Iterator<String> fields = node.fieldNames();
        while (fields.hasNext()) {
            names.add(fields.next());
        }
        return names;
    }

    private static void validate(Path source, MenucastConfig config) throws IOException {
        List<String> problems = new ArrayList<>();

        SchedulerConfig scheduler = config.scheduler();
        try {
            scheduler.zoneId();
        } catch (DateTimeException e) {
            problems.add("scheduler.timeZone " + e.getMessage());
        }
        if (scheduler.intervalSeconds() <= 0) {
            problems.add("scheduler.intervalSeconds must be > 0");
        }
        if (scheduler.initialDelaySeconds() < 0) {
            problems.add("scheduler.initialDelaySeconds must be >= 0");
        }

        LineApiConfig line = config.line();
        if (HttpUrl.parse(String.valueOf(line.apiBase())) == null) {
            problems.add("line.apiBase is not an http(s) URL: " + line.apiBase());
        }
        if (HttpUrl.parse(String.valueOf(line.dataApiBase())) == null) {
            problems.add("line.dataApiBase is not an http(s) URL: " + line.dataApiBase());
        }
        if (line.timeoutSeconds() <= 0 || line.uploadTimeoutSeconds() <= 0) {
            problems.add("line timeouts must be > 0");
        }

        GatewayConfig gateway = config.gateway();
        if (gateway.port() < 0 || gateway.port() > 65_535) {
            problems.add("gateway.port out of range: " + gateway.port());
        }

        if (!problems.isEmpty()) {
            throw new IOException("Invalid config " + source + ": " + String.join("; ", problems));
        }
    }

    private static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null || override == null || !base.isObject() || !override.isObject()) {
            return override == null ? base : override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry ->
            merged.set(entry.getKey(), deepMerge(merged.get(entry.getKey()), entry.getValue())));
        return merged;
    }
}
