package com.storymaker.backend.provider;

public record CredentialStatus(boolean configured, String reason) {

    public static CredentialStatus ok() {
        return new CredentialStatus(true, null);
    }

    public static CredentialStatus missing(String reason) {
        return new CredentialStatus(false, reason);
    }
}
