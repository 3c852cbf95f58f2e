package com.storymaker.backend.exception;

/**
 * A provider call that did not produce acceptable content. Raised by adapters and by the
 * router's quality gate; always caught inside the router.
 */
public class ProviderException extends RuntimeException {

    private final FailureKind kind;

    public ProviderException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
