package dev.depscout.infrastructure.ai;

import dev.depscout.config.AiProperties;
import dev.depscout.domain.enums.AiTier;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Routes AI requests to the cheapest capable Bedrock model.
 *
 * <p>Model ids per tier come from {@link AiProperties}. The requested tier is capped at
 * {@code maxTier}; on failure the router steps down one tier (SMART → CHEAP → LOCAL) before
 * giving up. Only created when {@code depscout.ai.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "depscout.ai", name = "enabled", havingValue = "true")
public class AiModelRouter {

    private static final Logger log = LoggerFactory.getLogger(AiModelRouter.class);

    private final AiProperties aiProperties;
    private final ChatModel chatModel;

    public AiModelRouter(AiProperties aiProperties, ChatModel chatModel) {
        this.aiProperties = aiProperties;
        this.chatModel = chatModel;
    }

    /**
     * Sends the prompt at the effective tier, falling back one tier on failure.
     * Throws when every attempted tier failed so the circuit breaker can count it.
     */
    @CircuitBreaker(name = "bedrock")
    public AiResponse route(String prompt, AiTier requested) {
        AiTier effective = aiProperties.effectiveTier(requested);
        Instant start = Instant.now();
        try {
            String content = callWithModel(prompt, aiProperties.modelFor(effective));
            return new AiResponse(content, effective, Duration.between(start, Instant.now()));
        } catch (RuntimeException e) {
            Optional<AiTier> fallback = effective.stepDown();
            if (fallback.isEmpty()) throw e;
            log.warn("Tier {} failed, trying {}: {}", effective, fallback.get(), e.getMessage());
            String content = callWithModel(prompt, aiProperties.modelFor(fallback.get()));
            return new AiResponse(content, fallback.get(), Duration.between(start, Instant.now()));
        }
    }

    private String callWithModel(String prompt, String modelId) {
        log.debug("Calling Bedrock model {}", modelId);
        ChatOptions options = ChatOptions.builder()
                .model(modelId)
                .temperature(0.1)
                .maxTokens(aiProperties.maxOutputTokens())
                .build();
        ChatResponse response = chatModel.call(new Prompt(prompt, options));
        return response.getResult().getOutput().getText();
    }

    public record AiResponse(String content, AiTier tierUsed, Duration latency) {}
}
