package me.golemcore.router.domain.service;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.UnresolvedModelServerException;
import me.golemcore.router.domain.model.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.*;

class ProviderFailureClassifierTest {

    // ===== Typed langchain4j exceptions =====

    @Test
    void shouldClassifyRateLimitAsQuota() {
        assertEquals(FailureKind.QUOTA_EXCEEDED,
                ProviderFailureClassifier.classify(new RateLimitException("slow down")));
    }

    @Test
    void shouldClassifyAuthenticationAsAuth() {
        assertEquals(FailureKind.AUTH_ERROR,
                ProviderFailureClassifier.classify(new AuthenticationException("bad key")));
    }

    @Test
    void shouldClassifyModelNotFoundAsAuth() {
        assertEquals(FailureKind.AUTH_ERROR,
                ProviderFailureClassifier.classify(new ModelNotFoundException("no such model")));
    }

    @Test
    void shouldClassifyInvalidRequestAsTransient() {
        assertEquals(FailureKind.TRANSIENT,
                ProviderFailureClassifier.classify(new InvalidRequestException("bad payload")));
    }

    @Test
    void shouldClassifyHttpStatusCodes() {
        assertEquals(FailureKind.QUOTA_EXCEEDED,
                ProviderFailureClassifier.classify(new HttpException(429, "limited")));
        assertEquals(FailureKind.AUTH_ERROR,
                ProviderFailureClassifier.classify(new HttpException(403, "forbidden")));
        assertEquals(FailureKind.TRANSIENT,
                ProviderFailureClassifier.classify(new HttpException(503, "unavailable")));
    }

    @Test
    void shouldFindTypedExceptionInCauseChain() {
        RuntimeException wrapped = new RuntimeException("LLM call failed",
                new RateLimitException("rate limited"));

        assertEquals(FailureKind.QUOTA_EXCEEDED, ProviderFailureClassifier.classify(wrapped));
    }

    // ===== Message fallbacks =====

    @Test
    void shouldClassifyQuotaMessages() {
        assertEquals(FailureKind.QUOTA_EXCEEDED,
                ProviderFailureClassifier.classify(new RuntimeException("Quota exceeded for model")));
        assertEquals(FailureKind.QUOTA_EXCEEDED,
                ProviderFailureClassifier.classify(new RuntimeException("HTTP 429 Too Many Requests")));
    }

    @Test
    void shouldClassifyAuthMessages() {
        assertEquals(FailureKind.AUTH_ERROR,
                ProviderFailureClassifier.classify(new RuntimeException("Invalid API key provided")));
        assertEquals(FailureKind.AUTH_ERROR,
                ProviderFailureClassifier.classify(new RuntimeException("Request failed with status code 401")));
        assertEquals(FailureKind.QUOTA_EXCEEDED,
                ProviderFailureClassifier.classify(new RuntimeException("upstream error, status: 429")));
    }

    @Test
    void shouldIgnoreStatusLikeNumbersWithoutStatusMarker() {
        assertEquals(FailureKind.TRANSIENT,
                ProviderFailureClassifier.classify(new RuntimeException("Prompt of 4012 tokens exceeds the context")));
        assertEquals(FailureKind.TRANSIENT,
                ProviderFailureClassifier.classify(new RuntimeException("Generated 1429 tokens before stopping")));
        assertEquals(FailureKind.TRANSIENT,
                ProviderFailureClassifier.classify(new RuntimeException("Invalid request: error code 4010")));
    }

    @Test
    void shouldDefaultToTransient() {
        assertEquals(FailureKind.TRANSIENT,
                ProviderFailureClassifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(FailureKind.TRANSIENT, ProviderFailureClassifier.classify(new RuntimeException()));
        assertEquals(FailureKind.TRANSIENT, ProviderFailureClassifier.classify(null));
    }

    @Test
    void shouldMapHttpStatus() {
        assertEquals(FailureKind.QUOTA_EXCEEDED, ProviderFailureClassifier.classifyHttpStatus(429));
        assertEquals(FailureKind.AUTH_ERROR, ProviderFailureClassifier.classifyHttpStatus(401));
        assertEquals(FailureKind.TRANSIENT, ProviderFailureClassifier.classifyHttpStatus(500));
    }

    // ===== Sent detection =====

    @Test
    void shouldTreatConnectionFailuresAsUnsent() {
        assertFalse(ProviderFailureClassifier.wasSent(new ConnectException("Connection refused")));
        assertFalse(ProviderFailureClassifier.wasSent(
                new RuntimeException(new UnknownHostException("api.example.invalid"))));
        assertFalse(ProviderFailureClassifier.wasSent(new UnresolvedModelServerException("no host")));
    }

    @Test
    void shouldTreatOtherFailuresAsSent() {
        assertTrue(ProviderFailureClassifier.wasSent(new SocketTimeoutException("read timed out")));
        assertTrue(ProviderFailureClassifier.wasSent(new IOException("stream reset")));
        assertTrue(ProviderFailureClassifier.wasSent(new RateLimitException("limited")));
    }
}
