package me.golemcore.router.adapter.outbound.crew;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.router.domain.model.ComplexityScore;
import me.golemcore.router.domain.model.DispatchOutcome;
import me.golemcore.router.domain.model.FailureKind;
import me.golemcore.router.domain.model.MultiAgentTask;
import me.golemcore.router.domain.model.RequestCategory;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.infrastructure.config.RouterProperties;
import me.golemcore.router.testsupport.http.OkHttpMockEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;

import static me.golemcore.router.testsupport.TestModels.model;
import static org.junit.jupiter.api.Assertions.*;

class CrewHttpAdapterTest {

    private static final String CREW_URL = "http://crew.test";
    private static final String MODEL_ID = "gemini/gemini-1.5-flash";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private OkHttpMockEngine httpEngine;
    private RouterProperties properties;
    private CrewHttpAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        properties = new RouterProperties();
        properties.getCrew().setEnabled(true);
        properties.getCrew().setUrl(CREW_URL);
        adapter = new CrewHttpAdapter(properties, httpEngine.client(), objectMapper);
    }

    private MultiAgentTask task() {
        return MultiAgentTask.builder()
                .message("Plan a product launch")
                .context("launch is in May")
                .score(new ComplexityScore(4, true, RequestCategory.BUSINESS_STRATEGY, false))
                .model(model(MODEL_ID, 1, 10, 1000, 10, TaskType.DIALOG))
                .timeout(Duration.ofSeconds(30))
                .build();
    }

    @Test
    void shouldPostTaskAndReturnResponse() throws Exception {
        httpEngine.enqueueJson(200, "{\"response\": \"Launch plan\", \"processed_with_crewai\": true}");

        DispatchOutcome outcome = adapter.execute(task()).get();

        assertTrue(outcome.isSuccess());
        assertEquals("Launch plan", outcome.getContent());
        assertEquals(MODEL_ID, outcome.getModelId());

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/api/process", request.path());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("Plan a product launch", body.get("message").asText());
        assertEquals(MODEL_ID, body.get("model_id").asText());
        assertEquals("gemini", body.get("provider").asText());
        assertEquals(4, body.get("complexity").asInt());
        assertEquals("business_strategy", body.get("category").asText());
        assertEquals("launch is in May", body.get("context").asText());
    }

    @Test
    void shouldMapTooManyRequestsToQuota() throws Exception {
        httpEngine.enqueueJson(429, "{\"error\": \"rate limited\"}");

        DispatchOutcome outcome = adapter.execute(task()).get();

        assertEquals(FailureKind.QUOTA_EXCEEDED, outcome.getFailureKind());
        assertTrue(outcome.isSent());
    }

    @Test
    void shouldMapUnauthorizedToAuth() throws Exception {
        httpEngine.enqueueJson(401, "{}");

        assertEquals(FailureKind.AUTH_ERROR, adapter.execute(task()).get().getFailureKind());
    }

    @Test
    void shouldMapServerErrorToTransient() throws Exception {
        httpEngine.enqueueJson(502, "{}");

        assertEquals(FailureKind.TRANSIENT, adapter.execute(task()).get().getFailureKind());
    }

    @Test
    void shouldClassifyErrorReportedInBody() throws Exception {
        httpEngine.enqueueJson(200, "{\"error\": \"Quota exceeded for gemini\"}");

        DispatchOutcome outcome = adapter.execute(task()).get();

        assertEquals(FailureKind.QUOTA_EXCEEDED, outcome.getFailureKind());
    }

    @Test
    void shouldTreatEmptyResponseAsTransient() throws Exception {
        httpEngine.enqueueJson(200, "{\"response\": \"\"}");

        assertEquals(FailureKind.TRANSIENT, adapter.execute(task()).get().getFailureKind());
    }

    @Test
    void shouldReportConnectionRefusedAsUnsent() throws Exception {
        httpEngine.enqueueFailure(new ConnectException("Connection refused"));

        DispatchOutcome outcome = adapter.execute(task()).get();

        assertEquals(FailureKind.TRANSIENT, outcome.getFailureKind());
        assertFalse(outcome.isSent());
    }

    @Test
    void shouldReportReadFailureAsSent() throws Exception {
        httpEngine.enqueueFailure(new IOException("stream reset"));

        assertTrue(adapter.execute(task()).get().isSent());
    }

    @Test
    void shouldNotCallWhenDisabled() throws Exception {
        properties.getCrew().setEnabled(false);

        DispatchOutcome outcome = adapter.execute(task()).get();

        assertFalse(adapter.isAvailable());
        assertFalse(outcome.isSent());
        assertEquals(0, httpEngine.getRequestCount());
    }
}
