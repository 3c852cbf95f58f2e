package com.storymaker.backend.service;

import com.storymaker.backend.exception.FailureKind;
import com.storymaker.backend.exception.ProviderException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps whatever a provider call threw onto a {@link FailureKind}.
 */
public final class FailureClassifier {

    private static final int MAX_MESSAGE = 200;

    private FailureClassifier() {
    }

    public static ProviderException classify(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof ProviderException providerException) {
            return providerException;
        }
        if (cause instanceof WebClientResponseException response) {
            return fromStatus(response);
        }
        if (findCause(cause, TimeoutException.class) != null) {
            return new ProviderException(FailureKind.TIMEOUT, "provider did not answer in time", cause);
        }
        if (cause instanceof WebClientRequestException) {
            return new ProviderException(FailureKind.UNAVAILABLE, truncate(cause.getMessage()), cause);
        }
        return new ProviderException(FailureKind.UNAVAILABLE,
                truncate(cause.getClass().getSimpleName() + ": " + cause.getMessage()), cause);
    }

    public static boolean isInterruption(Throwable error) {
        return findCause(error, InterruptedException.class) != null;
    }

    private static ProviderException fromStatus(WebClientResponseException response) {
        int status = response.getStatusCode().value();
        String body = response.getResponseBodyAsString();
        String message = "HTTP " + status + (body.isBlank() ? "" : ": " + truncate(body));
        FailureKind kind;
        if (status == 401) {
            kind = FailureKind.AUTH_EXPIRED;
        } else if (status == 403) {
            kind = FailureKind.CREDENTIAL_INVALID;
        } else if (status == 402 || (status == 429 && body.toLowerCase(Locale.ROOT).contains("quota"))) {
            kind = FailureKind.QUOTA_EXCEEDED;
        } else if (status == 429) {
            kind = FailureKind.RATE_LIMITED;
        } else if (status == 408 || status == 504) {
            kind = FailureKind.TIMEOUT;
        } else {
            kind = FailureKind.UNAVAILABLE;
        }
        return new ProviderException(kind, message, response);
    }

    private static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > MAX_MESSAGE ? value.substring(0, MAX_MESSAGE) + "..." : value;
    }
}
