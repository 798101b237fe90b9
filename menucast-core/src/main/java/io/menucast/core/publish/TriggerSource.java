package io.menucast.core.publish;

public enum TriggerSource {
    SCHEDULED("Upload complete"),
    MANUAL("Manual trigger succeeded");

    private final String successMessage;

    TriggerSource(String successMessage) {
        this.successMessage = successMessage;
    }

    public String successMessage() {
        return successMessage;
    }
}
