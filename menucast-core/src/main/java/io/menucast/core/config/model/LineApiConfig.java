package io.menucast.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LineApiConfig(
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"data_api_base"}) String dataApiBase,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"upload_timeout_seconds"}) int uploadTimeoutSeconds
) {

    public static LineApiConfig defaults() {
        return new LineApiConfig("https://api.line.me", "https://api-data.line.me", 30, 60);
    }
}
