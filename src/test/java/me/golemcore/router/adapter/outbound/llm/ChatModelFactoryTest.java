package me.golemcore.router.adapter.outbound.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.router.domain.model.TaskType;
import me.golemcore.router.infrastructure.config.RouterProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static me.golemcore.router.testsupport.TestModels.model;
import static org.junit.jupiter.api.Assertions.*;

class ChatModelFactoryTest {

    private static final String API_KEY = "test-api-key-0123456789";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private RouterProperties properties;
    private ChatModelFactory factory;

    @BeforeEach
    void setUp() {
        properties = new RouterProperties();
        RouterProperties.ProviderProperties openrouter = new RouterProperties.ProviderProperties();
        openrouter.setBaseUrl("https://openrouter.ai/api/v1");
        properties.getProviders().put("openrouter", openrouter);
        RouterProperties.ProviderProperties anthropic = new RouterProperties.ProviderProperties();
        anthropic.setProtocol("anthropic");
        properties.getProviders().put("anthropic", anthropic);
        factory = new ChatModelFactory(properties);
    }

    @Test
    void shouldBuildOpenAiCompatibleModelByDefault() {
        ChatModel chatModel = factory.create(model("openrouter/mistral-7b", 1, 10, 1000, 10, TaskType.DIALOG),
                API_KEY, TIMEOUT);

        assertInstanceOf(OpenAiChatModel.class, chatModel);
    }

    @Test
    void shouldBuildAnthropicModelForAnthropicProtocol() {
        ChatModel chatModel = factory.create(model("anthropic/claude-haiku", 1, 10, 1000, 10, TaskType.DIALOG),
                API_KEY, TIMEOUT);

        assertInstanceOf(AnthropicChatModel.class, chatModel);
    }

    @Test
    void shouldFallBackToOpenAiForUnconfiguredProvider() {
        ChatModel chatModel = factory.create(model("unknown/model", 1, 10, 1000, 10, TaskType.DIALOG), API_KEY,
                TIMEOUT);

        assertInstanceOf(OpenAiChatModel.class, chatModel);
    }
}
