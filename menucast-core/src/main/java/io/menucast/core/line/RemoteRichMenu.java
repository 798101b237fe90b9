package io.menucast.core.line;

public record RemoteRichMenu(String richMenuId, String name) {
}
