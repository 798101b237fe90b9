package io.menucast.core.publish;

public enum PublishErrorKind {
    NOT_FOUND(404),
    PRECONDITION_FAILED(422),
    UPSTREAM_REJECTED(502),
    UPSTREAM_UNAVAILABLE(504),
    UNEXPECTED(500);

    private final int httpStatus;

    PublishErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
