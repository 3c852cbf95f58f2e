package com.storymaker.backend.provider;

import java.util.regex.Pattern;

public final class CredentialRules {

    private static final Pattern OPENAI = Pattern.compile("^sk-(proj-)?[A-Za-z0-9_-]{20,}$");
    private static final Pattern HUGGINGFACE = Pattern.compile("^hf_[A-Za-z0-9]{32,}$");
    private static final Pattern GOOGLE = Pattern.compile("^AIza[0-9A-Za-z_-]{35}$");
    private static final Pattern STABILITY = Pattern.compile("^sk-[A-Za-z0-9]{40,}$");
    private static final Pattern ELEVENLABS = Pattern.compile("^(sk_)?[0-9a-f]{32,}$");

    public static final CredentialRule OPENAI_RULE = key -> OPENAI.matcher(key).matches();
    public static final CredentialRule HUGGINGFACE_RULE = key -> HUGGINGFACE.matcher(key).matches();
    public static final CredentialRule GOOGLE_RULE = key -> GOOGLE.matcher(key).matches();
    public static final CredentialRule STABILITY_RULE = key -> STABILITY.matcher(key).matches();
    public static final CredentialRule ELEVENLABS_RULE = key -> ELEVENLABS.matcher(key).matches();
    public static final CredentialRule ANY = key -> true;

    private CredentialRules() {
    }
}
