package io.menucast.core.publish;

import io.menucast.core.model.MenuArea;
import io.menucast.core.model.MenuBounds;
import io.menucast.core.model.RichMenuDefinition;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the JSON object sent when creating a rich menu. Areas without a publishable action
 * are dropped; a menu left with no areas gets one full-canvas placeholder so the API accepts it.
 */
public final class RichMenuDescriptorFactory {
    static final MenuBounds DEFAULT_BOUNDS = new MenuBounds(0, 0, 100, 100);

    public Map<String, Object> build(RichMenuDefinition menu, String name) {
        Map<String, Object> size = new LinkedHashMap<>();
        size.put("width", menu.width());
        size.put("height", menu.height());

        List<Map<String, Object>> areas = new ArrayList<>();
        for (MenuArea area : menu.areas()) {
            if (!area.publishable()) {
                continue;
            }
            areas.add(area(area.bounds() == null ? DEFAULT_BOUNDS : area.bounds(), area.action()));
        }
        if (areas.isEmpty()) {
            areas.add(area(
                new MenuBounds(0, 0, menu.width(), menu.height()),
                Map.of("type", "message", "text", "menu")
            ));
        }

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("size", size);
        descriptor.put("selected", menu.selected());
        descriptor.put("name", name);
        descriptor.put("chatBarText", menu.chatBarText().isBlank() ? name : menu.chatBarText());
        descriptor.put("areas", areas);
        return descriptor;
    }

    /**
     * Display name used for the menu at {@code position} (zero based) within the published set.
     */
    public static String displayName(RichMenuDefinition menu, int position) {
        String name = menu.name();
        return name == null || name.isBlank() ? "Rich Menu " + (position + 1) : name;
    }

    private Map<String, Object> area(MenuBounds bounds, Map<String, Object> action) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("x", bounds.x());
        json.put("y", bounds.y());
        json.put("width", bounds.width());
        json.put("height", bounds.height());

        Map<String, Object> area = new LinkedHashMap<>();
        area.put("bounds", json);
        area.put("action", new LinkedHashMap<>(action));
        return area;
    }
}
