package io.menucast.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MenucastConfig(
    SchedulerConfig scheduler,
    LineApiConfig line,
    StorageConfig storage,
    ImageConfig image,
    GatewayConfig gateway
) {

    public static MenucastConfig defaults() {
        return new MenucastConfig(
            SchedulerConfig.defaults(),
            LineApiConfig.defaults(),
            StorageConfig.defaults(),
            ImageConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
