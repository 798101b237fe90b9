package io.menucast.core.image;

/**
 * JPEG payload produced for upload. {@code withinBudget} is false only when even the
 * minimum quality exceeded the byte budget.
 */
public record EncodedImage(byte[] bytes, float quality, boolean withinBudget) {

    public int size() {
        return bytes.length;
    }

    public String contentType() {
        return "image/jpeg";
    }
}
