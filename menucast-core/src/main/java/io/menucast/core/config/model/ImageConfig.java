package io.menucast.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JPEG budget applied before uploading menu images. Qualities are in the 0..1 range
 * used by {@code javax.imageio}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImageConfig(
    @JsonAlias({"max_bytes"}) long maxBytes,
    @JsonAlias({"start_quality"}) float startQuality,
    @JsonAlias({"min_quality"}) float minQuality,
    @JsonAlias({"quality_step"}) float qualityStep
) {

    public static ImageConfig defaults() {
        return new ImageConfig(4_500_000L, 0.90f, 0.60f, 0.10f);
    }
}
