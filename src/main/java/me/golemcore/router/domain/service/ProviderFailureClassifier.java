package me.golemcore.router.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.router.domain.model.FailureKind;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps provider exceptions to the typed {@link FailureKind} contract.
 *
 * <p>
 * langchain4j exceptions are matched by class name so the domain does not
 * depend on the SDK. The cause chain is walked; the first recognised link
 * wins. Anything unrecognised is {@link FailureKind#TRANSIENT}.
 */
public final class ProviderFailureClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private static final Pattern QUOTA_STATUS = statusPattern("429");
    private static final Pattern AUTH_STATUS = statusPattern("401|403");

    private ProviderFailureClassifier() {
    }

    /**
     * Classify a failure from its throwable and cause chain.
     */
    public static FailureKind classify(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            FailureKind byType = classifyKnownThrowable(current);
            if (byType != null) {
                return byType;
            }
            FailureKind byMessage = classifyFromMessage(current.getMessage());
            if (byMessage != null) {
                return byMessage;
            }
            current = current.getCause();
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * Map an HTTP status code of a provider or collaborator response.
     */
    public static FailureKind classifyHttpStatus(int statusCode) {
        if (statusCode == 429) {
            return FailureKind.QUOTA_EXCEEDED;
        }
        if (statusCode == 401 || statusCode == 403) {
            return FailureKind.AUTH_ERROR;
        }
        return FailureKind.TRANSIENT;
    }

    /**
     * Whether the failed request reached the provider. Only failures to
     * resolve or connect to the host are known to be unsent.
     */
    public static boolean wasSent(Throwable throwable) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && visited.add(current)) {
            if (current instanceof UnknownHostException
                    || current instanceof ConnectException
                    || current instanceof NoRouteToHostException
                    || CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(current.getClass().getName())) {
                return false;
            }
            current = current.getCause();
        }
        return true;
    }

    private static FailureKind classifyKnownThrowable(Throwable throwable) {
        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return null;
        }
        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return FailureKind.QUOTA_EXCEEDED;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className) || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)) {
            return FailureKind.AUTH_ERROR;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            Integer statusCode = readHttpStatusCode(throwable);
            return statusCode != null ? classifyHttpStatus(statusCode) : null;
        }
        return null;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException e) {
            return null;
        }
        return null;
    }

    private static FailureKind classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("rate limit")
                || normalized.contains("rate_limit")
                || normalized.contains("quota")
                || normalized.contains("too many requests")
                || QUOTA_STATUS.matcher(normalized).find()) {
            return FailureKind.QUOTA_EXCEEDED;
        }
        if (normalized.contains("invalid api key")
                || normalized.contains("invalid_api_key")
                || normalized.contains("unauthorized")
                || AUTH_STATUS.matcher(normalized).find()) {
            return FailureKind.AUTH_ERROR;
        }
        return null;
    }

    /**
     * A status code only counts when a status marker precedes it, e.g.
     * {@code HTTP 429}, {@code status: 401} or {@code status code=403}.
     */
    private static Pattern statusPattern(String codes) {
        return Pattern.compile("\\b(?:http(?:/[\\d.]+)?|status(?: code)?|error code|code)[\\s:=]*(?:" + codes
                + ")\\b");
    }
}
