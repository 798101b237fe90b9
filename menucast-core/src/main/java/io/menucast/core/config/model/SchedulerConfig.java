package io.menucast.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    @JsonAlias({"time_zone"}) String timeZone,
    @JsonAlias({"interval_seconds"}) int intervalSeconds,
    @JsonAlias({"initial_delay_seconds"}) int initialDelaySeconds,
    boolean enabled
) {

    public static SchedulerConfig defaults() {
        return new SchedulerConfig("Asia/Taipei", 60, 5, true);
    }

    public ZoneId zoneId() {
        return timeZone == null || timeZone.isBlank() ? ZoneId.of("Asia/Taipei") : ZoneId.of(timeZone.trim());
    }
}
