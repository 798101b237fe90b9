package io.menucast.core.model;

import java.util.List;

public record RichMenuDefinition(
    long id,
    long projectId,
    String remoteMenuId,
    String name,
    String alias,
    String chatBarText,
    int width,
    int height,
    boolean selected,
    List<MenuArea> areas,
    String imagePath
) {
    public static final int DEFAULT_WIDTH = 2500;
    public static final int DEFAULT_HEIGHT = 1686;

    public RichMenuDefinition {
        alias = alias == null ? "" : alias;
        chatBarText = chatBarText == null ? "" : chatBarText;
        width = width <= 0 ? DEFAULT_WIDTH : width;
        height = height <= 0 ? DEFAULT_HEIGHT : height;
        areas = areas == null ? List.of() : List.copyOf(areas);
    }

    public static RichMenuDefinition draft(String name, String alias, List<MenuArea> areas, String imagePath) {
        return new RichMenuDefinition(0, 0, null, name, alias, "", DEFAULT_WIDTH, DEFAULT_HEIGHT, true, areas, imagePath);
    }
}
