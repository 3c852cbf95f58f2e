package com.storymaker.backend.exception;

public enum FailureKind {
    CREDENTIAL_INVALID,
    RATE_LIMITED,
    AUTH_EXPIRED,
    QUOTA_EXCEEDED,
    TIMEOUT,
    QUALITY_GATE_FAILED,
    UNAVAILABLE
}
