package io.menucast.core.model;

import java.util.List;

public record Project(long id, long accountId, String name, List<RichMenuDefinition> richMenus) {
    public Project {
        name = name == null ? "" : name;
        richMenus = richMenus == null ? List.of() : List.copyOf(richMenus);
    }
}
