package io.menucast.core.model;

public record MenuBounds(int x, int y, int width, int height) {
}
