package com.storymaker.backend.provider;

/**
 * Vendor specific syntactic check on an already cleaned credential.
 */
@FunctionalInterface
public interface CredentialRule {

    boolean matches(String cleaned);
}
