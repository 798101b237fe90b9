package io.menucast.core.publish;

import java.util.Objects;

/**
 * A publishing failure classified by {@link PublishErrorKind}. {@code upstreamStatus} carries
 * the external API's HTTP status for {@link PublishErrorKind#UPSTREAM_REJECTED}, otherwise -1.
 */
public class PublishException extends Exception {

    private static final long serialVersionUID = 1L;

    private final PublishErrorKind kind;
    private final int upstreamStatus;

    public PublishException(PublishErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public PublishException(PublishErrorKind kind, String message, Throwable cause) {
        this(kind, message, -1, cause);
    }

    public PublishException(PublishErrorKind kind, String message, int upstreamStatus, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.upstreamStatus = upstreamStatus;
    }

    public static PublishException notFound(String message) {
        return new PublishException(PublishErrorKind.NOT_FOUND, message);
    }

    public static PublishException precondition(String message) {
        return new PublishException(PublishErrorKind.PRECONDITION_FAILED, message);
    }

    public static PublishException rejected(String message, int upstreamStatus) {
        return new PublishException(PublishErrorKind.UPSTREAM_REJECTED, message, upstreamStatus, null);
    }

    public static PublishException unavailable(String message, Throwable cause) {
        return new PublishException(PublishErrorKind.UPSTREAM_UNAVAILABLE, message, cause);
    }

    public PublishErrorKind kind() {
        return kind;
    }

    public int upstreamStatus() {
        return upstreamStatus;
    }
}
