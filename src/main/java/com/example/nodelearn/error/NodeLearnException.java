package com.example.nodelearn.error;

import java.util.Map;

/**
 * Base type of all engine failures. Every failure is reported to the calling layer,
 * which decides how to present it.
 */
public abstract class NodeLearnException extends RuntimeException {

    private final ErrorKind kind;

    protected NodeLearnException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected NodeLearnException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * Stable code used by the HTTP and tool surfaces, e.g. {@code CycleException -> CYCLE}.
     */
    public String getCode() {
        String name = getClass().getSimpleName().replace("Exception", "");
        return name.replaceAll("([a-z])([A-Z])", "$1_$2").toUpperCase();
    }

    /**
     * Error body shared by the HTTP and tool surfaces.
     */
    public Map<String, Object> toErrorMap() {
        return Map.of(
                "error", Map.of(
                        "kind", kind.name(),
                        "code", getCode(),
                        "message", String.valueOf(getMessage()),
                        "retryable", isRetryable()
                ),
                "isError", true
        );
    }
}
