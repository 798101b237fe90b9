package io.menucast.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    @JsonAlias({"database_path"}) String databasePath,
    @JsonAlias({"upload_folder"}) String uploadFolder
) {

    public static StorageConfig defaults() {
        return new StorageConfig("~/.menucast/menucast.db", "~/.menucast/uploads");
    }
}
