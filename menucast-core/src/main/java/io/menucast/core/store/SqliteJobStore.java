package io.menucast.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.menucast.core.model.Account;
import io.menucast.core.model.JobScope;
import io.menucast.core.model.JobUpdate;
import io.menucast.core.model.MenuArea;
import io.menucast.core.model.Project;
import io.menucast.core.model.PublishTarget;
import io.menucast.core.model.RepeatType;
import io.menucast.core.model.RichMenuDefinition;
import io.menucast.core.model.RunStatus;
import io.menucast.core.model.ScheduledJob;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteJobStore implements JobStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteJobStore.class);
    private static final TypeReference<List<MenuArea>> MENU_AREAS = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> USER_IDS = new TypeReference<>() {
    };

    private final String jdbcUrl;
    private final ObjectMapper mapper;
    private final Clock clock;

    public SqliteJobStore(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteJobStore(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.clock = clock;
        init();
    }

    @Override
    public synchronized List<ScheduledJob> listDue(LocalDate today, String timeOfDay) throws IOException {
        String sql = """
            SELECT * FROM scheduled_jobs
            WHERE enabled = 1
              AND start_date <= ?
              AND end_date >= ?
              AND run_time = ?
            ORDER BY id ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, today.toString());
            statement.setString(2, today.toString());
            statement.setString(3, timeOfDay);
            try (ResultSet resultSet = statement.executeQuery()) {
                return readJobs(resultSet);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list due scheduled jobs", e);
        }
    }

    @Override
    public synchronized Optional<ScheduledJob> findJob(long jobId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT * FROM scheduled_jobs WHERE id = ?")) {
            statement.setLong(1, jobId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(toJob(resultSet)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load scheduled job " + jobId, e);
        }
    }

    @Override
    public synchronized List<ScheduledJob> listJobsByProject(long projectId) throws IOException {
        String sql = "SELECT * FROM scheduled_jobs WHERE project_id = ? ORDER BY created_at DESC, id DESC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, projectId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return readJobs(resultSet);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list scheduled jobs for project " + projectId, e);
        }
    }

    @Override
    public synchronized void updateJob(long jobId, JobUpdate update) throws IOException {
        if (update == null || update.isEmpty()) {
            return;
        }
        List<String> assignments = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        if (update.enabled() != null) {
            assignments.add("enabled = ?");
            values.add(update.enabled() ? 1 : 0);
        }
        if (update.lastRunAt() != null) {
            assignments.add("last_run_at = ?");
            values.add(update.lastRunAt().toString());
        }
        if (update.lastRunStatus() != null) {
            assignments.add("last_run_status = ?");
            values.add(update.lastRunStatus().wireValue());
        }
        if (update.lastRunMessage() != null) {
            assignments.add("last_run_message = ?");
            values.add(update.lastRunMessage());
        }
        assignments.add("updated_at = ?");
        values.add(now());

        String sql = "UPDATE scheduled_jobs SET " + String.join(", ", assignments) + " WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            int index = 1;
            for (Object value : values) {
                statement.setObject(index++, value);
            }
            statement.setLong(index, jobId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update scheduled job " + jobId, e);
        }
    }

    @Override
    public synchronized Optional<Project> findProject(long projectId) throws IOException {
        try (Connection connection = openConnection()) {
            long accountId;
            String name;
            try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM projects WHERE id = ?")) {
                statement.setLong(1, projectId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    accountId = resultSet.getLong("account_id");
                    name = resultSet.getString("name");
                }
            }

            List<RichMenuDefinition> menus = new ArrayList<>();
            String sql = "SELECT * FROM rich_menus WHERE project_id = ? ORDER BY created_at ASC, id ASC";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setLong(1, projectId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        menus.add(toMenu(resultSet));
                    }
                }
            }
            return Optional.of(new Project(projectId, accountId, name, menus));
        } catch (SQLException e) {
            throw new IOException("Failed to load project " + projectId, e);
        }
    }

    @Override
    public synchronized Optional<Account> findAccount(long accountId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT * FROM accounts WHERE id = ?")) {
            statement.setLong(1, accountId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Account(
                    resultSet.getLong("id"),
                    resultSet.getString("name"),
                    resultSet.getString("channel_access_token")
                ));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to load account " + accountId, e);
        }
    }

    @Override
    public synchronized void updateRemoteMenuId(long menuId, String remoteMenuId) throws IOException {
        String sql = "UPDATE rich_menus SET rich_menu_id = ?, updated_at = ? WHERE id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, remoteMenuId);
            statement.setString(2, now());
            statement.setLong(3, menuId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update rich menu " + menuId, e);
        }
    }

    public synchronized long createAccount(String name, String channelAccessToken) throws IOException {
        String sql = "INSERT INTO accounts (name, channel_access_token, created_at) VALUES (?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, name);
            statement.setString(2, channelAccessToken);
            statement.setString(3, now());
            statement.executeUpdate();
            return lastInsertId(connection);
        } catch (SQLException e) {
            throw new IOException("Failed to create account " + name, e);
        }
    }

    public synchronized long createProject(long accountId, String name) throws IOException {
        String sql = """
            INSERT INTO projects (account_id, name, description, created_at, updated_at)
            VALUES (?, ?, '', ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            String now = now();
            statement.setLong(1, accountId);
            statement.setString(2, name);
            statement.setString(3, now);
            statement.setString(4, now);
            statement.executeUpdate();
            return lastInsertId(connection);
        } catch (SQLException e) {
            throw new IOException("Failed to create project " + name, e);
        }
    }

    public synchronized void deleteProject(long projectId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM projects WHERE id = ?")) {
            statement.setLong(1, projectId);
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to delete project " + projectId, e);
        }
    }

    public synchronized long createRichMenu(long projectId, RichMenuDefinition menu) throws IOException {
        String sql = """
            INSERT INTO rich_menus (
                project_id, rich_menu_id, name, alias, chat_bar_text,
                size_width, size_height, selected, areas, image_path,
                created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            String now = now();
            statement.setLong(1, projectId);
            statement.setString(2, menu.remoteMenuId());
            statement.setString(3, menu.name());
            statement.setString(4, menu.alias());
            statement.setString(5, menu.chatBarText());
            statement.setInt(6, menu.width());
            statement.setInt(7, menu.height());
            statement.setInt(8, menu.selected() ? 1 : 0);
            statement.setString(9, mapper.writeValueAsString(menu.areas()));
            statement.setString(10, menu.imagePath());
            statement.setString(11, now);
            statement.setString(12, now);
            statement.executeUpdate();
            return lastInsertId(connection);
        } catch (SQLException e) {
            throw new IOException("Failed to create rich menu " + menu.name(), e);
        }
    }

    public synchronized long createJob(ScheduledJob job) throws IOException {
        String sql = """
            INSERT INTO scheduled_jobs (
                project_id, scope, current_tab_index, publish_target, user_ids,
                default_menu_index, start_date, end_date, run_time,
                repeat_type, repeat_weekday, repeat_day,
                enabled, created_at, updated_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            String now = now();
            statement.setLong(1, job.projectId());
            statement.setString(2, job.scope().wireValue());
            statement.setInt(3, job.currentTabIndex());
            statement.setString(4, job.publishTarget().wireValue());
            statement.setString(5, job.userIds().isEmpty() ? null : mapper.writeValueAsString(job.userIds()));
            statement.setInt(6, job.defaultMenuIndex());
            statement.setString(7, job.startDate().toString());
            statement.setString(8, job.endDate().toString());
            statement.setString(9, job.runTime());
            statement.setString(10, job.repeatType().wireValue());
            setNullableInt(statement, 11, job.repeatWeekday());
            setNullableInt(statement, 12, job.repeatDay());
            statement.setInt(13, job.enabled() ? 1 : 0);
            statement.setString(14, now);
            statement.setString(15, now);
            statement.executeUpdate();
            return lastInsertId(connection);
        } catch (SQLException e) {
            throw new IOException("Failed to create scheduled job for project " + job.projectId(), e);
        }
    }

    public synchronized boolean deleteJob(long jobId) throws IOException {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM scheduled_jobs WHERE id = ?")) {
            statement.setLong(1, jobId);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete scheduled job " + jobId, e);
        }
    }

    /**
     * Maps rows one at a time. A row holding a value this version cannot read (an unknown repeat
     * type, a malformed date) is logged and skipped so the remaining jobs are still returned.
     */
    private List<ScheduledJob> readJobs(ResultSet resultSet) throws SQLException, IOException {
        List<ScheduledJob> jobs = new ArrayList<>();
        while (resultSet.next()) {
            try {
                jobs.add(toJob(resultSet));
            } catch (IllegalArgumentException | DateTimeException e) {
                LOG.warn("Skipping unreadable scheduled job {}: {}", resultSet.getLong("id"), e.getMessage());
            }
        }
        return jobs;
    }

    private ScheduledJob toJob(ResultSet resultSet) throws SQLException, IOException {
        String userIdsJson = resultSet.getString("user_ids");
        List<String> userIds = List.of();
        if (userIdsJson != null && !userIdsJson.isBlank()) {
            try {
                userIds = mapper.readValue(userIdsJson, USER_IDS);
            } catch (IOException ignored) {
                // unreadable legacy value behaves as "no users"
            }
        }
        return new ScheduledJob(
            resultSet.getLong("id"),
            resultSet.getLong("project_id"),
            JobScope.fromWire(resultSet.getString("scope")),
            resultSet.getInt("current_tab_index"),
            PublishTarget.fromWire(resultSet.getString("publish_target")),
            userIds,
            nullableInt(resultSet, "default_menu_index", -1),
            LocalDate.parse(resultSet.getString("start_date")),
            LocalDate.parse(resultSet.getString("end_date")),
            resultSet.getString("run_time"),
            RepeatType.fromWire(resultSet.getString("repeat_type")),
            nullableInt(resultSet, "repeat_weekday"),
            nullableInt(resultSet, "repeat_day"),
            resultSet.getInt("enabled") != 0,
            parseRunAt(resultSet.getString("last_run_at")),
            RunStatus.fromWire(resultSet.getString("last_run_status")),
            resultSet.getString("last_run_message"),
            parseInstant(resultSet.getString("created_at")),
            parseInstant(resultSet.getString("updated_at"))
        );
    }

    private RichMenuDefinition toMenu(ResultSet resultSet) throws SQLException, IOException {
        String areasJson = resultSet.getString("areas");
        List<MenuArea> areas = areasJson == null || areasJson.isBlank()
            ? List.of()
            : mapper.readValue(areasJson, MENU_AREAS);
        return new RichMenuDefinition(
            resultSet.getLong("id"),
            resultSet.getLong("project_id"),
            resultSet.getString("rich_menu_id"),
            resultSet.getString("name"),
            resultSet.getString("alias"),
            resultSet.getString("chat_bar_text"),
            resultSet.getInt("size_width"),
            resultSet.getInt("size_height"),
            resultSet.getInt("selected") != 0,
            areas,
            resultSet.getString("image_path")
        );
    }

    /**
     * Older rows carry a zone-less UTC timestamp.
     */
    static OffsetDateTime parseRunAt(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(raw).atOffset(ZoneOffset.UTC);
        }
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
        }
    }

    private Integer nullableInt(ResultSet resultSet, String column) throws SQLException {
        int value = resultSet.getInt(column);
        return resultSet.wasNull() ? null : value;
    }

    private int nullableInt(ResultSet resultSet, String column, int fallback) throws SQLException {
        Integer value = nullableInt(resultSet, column);
        return value == null ? fallback : value;
    }

    private void setNullableInt(PreparedStatement statement, int index, Integer value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.INTEGER);
        } else {
            statement.setInt(index, value);
        }
    }

    private long lastInsertId(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("SELECT last_insert_rowid()")) {
            return resultSet.next() ? resultSet.getLong(1) : 0L;
        }
    }

    private String now() {
        return clock.instant().toString();
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
            statement.execute("PRAGMA foreign_keys=ON;");
        }
        return connection;
    }

    private void init() throws IOException {
        List<String> ddl = List.of(
            """
            CREATE TABLE IF NOT EXISTS accounts (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL UNIQUE,
                channel_access_token TEXT NOT NULL,
                created_at TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS projects (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                account_id INTEGER NOT NULL,
                name TEXT NOT NULL,
                description TEXT,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                FOREIGN KEY (account_id) REFERENCES accounts (id) ON DELETE CASCADE,
                UNIQUE (account_id, name)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rich_menus (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                project_id INTEGER NOT NULL,
                rich_menu_id TEXT,
                name TEXT NOT NULL,
                alias TEXT,
                chat_bar_text TEXT,
                size_width INTEGER NOT NULL DEFAULT 2500,
                size_height INTEGER NOT NULL DEFAULT 1686,
                selected INTEGER NOT NULL DEFAULT 1,
                areas TEXT,
                image_path TEXT,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                FOREIGN KEY (project_id) REFERENCES projects (id) ON DELETE CASCADE
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS scheduled_jobs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                project_id INTEGER NOT NULL,
                scope TEXT NOT NULL DEFAULT 'all',
                current_tab_index INTEGER DEFAULT 0,
                publish_target TEXT NOT NULL DEFAULT 'all',
                user_ids TEXT,
                default_menu_index INTEGER DEFAULT -1,
                start_date TEXT NOT NULL,
                end_date TEXT NOT NULL,
                run_time TEXT NOT NULL DEFAULT '00:00',
                repeat_type TEXT NOT NULL DEFAULT 'daily',
                repeat_weekday INTEGER,
                repeat_day INTEGER,
                enabled INTEGER NOT NULL DEFAULT 1,
                last_run_at TEXT,
                last_run_status TEXT,
                last_run_message TEXT,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                FOREIGN KEY (project_id) REFERENCES projects (id) ON DELETE CASCADE
            )
            """,
            """
            CREATE INDEX IF NOT EXISTS idx_scheduled_jobs_due
            ON scheduled_jobs(enabled, run_time)
            """
        );
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : ddl) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite job store", e);
        }
    }
}
