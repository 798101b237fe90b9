package io.menucast.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tappable region of a menu image. {@code action} is the LINE action object as edited
 * (for example {@code {"type":"uri","uri":"https://..."}}); a null or {@code none} action
 * marks an area that is not published.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MenuArea(MenuBounds bounds, Map<String, Object> action) {
    public MenuArea {
        action = action == null ? null : new LinkedHashMap<>(action);
    }

    public boolean publishable() {
        if (action == null || action.isEmpty()) {
            return false;
        }
        Object type = action.get("type");
        return !"none".equals(type == null ? null : String.valueOf(type));
    }
}
