package me.golemcore.router.infrastructure.config;

import me.golemcore.router.domain.model.ModelDescriptor;
import me.golemcore.router.domain.model.ModelRegistryException;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.domain.service.ModelRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryLoaderTest {

    private RouterProperties properties;
    private ModelRegistryLoader loader;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        loader = new ModelRegistryLoader(properties, new DefaultResourceLoader(), AutoConfiguration.objectMapper());
    }

    // ===== Loading =====

    @Test
    void shouldLoadBundledCatalogue() {
        ModelRegistry registry = loader.load();

        assertEquals(5, registry.size());
        ModelDescriptor flash = registry.require("gemini/gemini-1.5-flash");
        assertEquals("Gemini 1.5 Flash", flash.getDisplayName());
        assertEquals(15, flash.getLimits().rpm());
        assertEquals(2_500_000, flash.getLimits().tpm());
        assertEquals(50, flash.getLimits().rpd());
        assertTrue(flash.supports(TaskType.SUMMARIZE));
    }

    @Test
    void shouldLoadFromConfiguredLocation() {
        properties.getRegistry().setLocation("classpath:registry/valid-models.json");

        ModelRegistry registry = loader.load();

        assertEquals(2, registry.size());
        assertEquals("test/primary", registry.modelsForTask(TaskType.DIALOG).get(0).getId());
    }

    @Test
    void shouldFailWhenResourceIsMissing() {
        properties.getRegistry().setLocation("classpath:registry/missing.json");

        ModelRegistryException exception = assertThrows(ModelRegistryException.class, () -> loader.load());
        assertTrue(exception.getMessage().contains("not found"));
    }

    // ===== Parsing =====

    @Test
    void shouldApplyDefaultsForOptionalKeys() {
        ModelRegistry registry = loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": ["dialog"], "priority": 1,
                  "rpm": 1, "tpm": 10, "rpd": 5, "unknown_key": true}]
                """);

        ModelDescriptor model = registry.require("p/m");
        assertEquals("p/m", model.getDisplayName());
        assertEquals(0.0, model.getBaseScore());
    }

    @Test
    void shouldRejectMissingLimits() {
        ModelRegistryException exception = assertThrows(ModelRegistryException.class, () -> loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": ["dialog"], "priority": 1, "rpm": 1}]
                """));
        assertTrue(exception.getMessage().contains("'p/m'"));
        assertTrue(exception.getMessage().contains("missing limits"));
    }

    @Test
    void shouldRejectMissingId() {
        ModelRegistryException exception = assertThrows(ModelRegistryException.class, () -> loader.parse("""
                [{"provider": "p", "task_types": ["dialog"], "priority": 1, "rpm": 1, "tpm": 1, "rpd": 1}]
                """));
        assertTrue(exception.getMessage().contains("#0"));
    }

    @Test
    void shouldRejectNegativeLimit() {
        assertThrows(ModelRegistryException.class, () -> loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": ["dialog"], "priority": 1,
                  "rpm": -1, "tpm": 1, "rpd": 1}]
                """));
    }

    @Test
    void shouldRejectUnknownTaskType() {
        ModelRegistryException exception = assertThrows(ModelRegistryException.class, () -> loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": ["telepathy"], "priority": 1,
                  "rpm": 1, "tpm": 1, "rpd": 1}]
                """));
        assertTrue(exception.getMessage().contains("telepathy"));
    }

    @Test
    void shouldRejectEmptyTaskTypes() {
        assertThrows(ModelRegistryException.class, () -> loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": [], "priority": 1, "rpm": 1, "tpm": 1, "rpd": 1}]
                """));
    }

    @Test
    void shouldRejectDuplicateIds() {
        assertThrows(ModelRegistryException.class, () -> loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": ["dialog"], "priority": 1, "rpm": 1, "tpm": 1, "rpd": 1},
                 {"id": "p/m", "provider": "p", "task_types": ["code"], "priority": 2, "rpm": 1, "tpm": 1, "rpd": 1}]
                """));
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThrows(ModelRegistryException.class, () -> loader.parse("[{\"id\": "));
    }

    @Test
    void shouldAcceptZeroLimitsAsDeclared() {
        ModelRegistry registry = loader.parse("""
                [{"id": "p/m", "provider": "p", "task_types": ["simple"], "priority": 1, "rpm": 5, "tpm": 5, "rpd": 0}]
                """);

        assertEquals(0, registry.require("p/m").getLimits().rpd());
        assertEquals(List.of("p/m"), registry.modelsForTask(TaskType.SIMPLE).stream()
                .map(ModelDescriptor::getId).toList());
    }
}
