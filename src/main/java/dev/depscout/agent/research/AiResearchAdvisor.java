package dev.depscout.agent.research;

import dev.depscout.agent.PromptUtils;
import dev.depscout.config.AiProperties;
import dev.depscout.domain.valueobject.DeprecationAnalysis;
import dev.depscout.domain.valueobject.PackageMetadata;
import dev.depscout.infrastructure.ai.AiModelRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Optional AI note on a package's maintenance status and alternatives.
 *
 * <p>Advisory only. The note is attached as {@code ai_insight}; it never changes the
 * catalog's deprecation verdict, and any AI failure means no note.
 */
@Component
@ConditionalOnProperty(prefix = "depscout.ai", name = "enabled", havingValue = "true")
public class AiResearchAdvisor {

    private static final Logger log = LoggerFactory.getLogger(AiResearchAdvisor.class);

    private static final String BASE_PROMPT = """
            You are a Python dependency research assistant.
            In at most three sentences, say whether the package below looks actively maintained
            and name well-known alternatives if it does not. Do not contradict the known
            deprecation verdict. Respond with plain text only.""";

    private final AiModelRouter modelRouter;
    private final AiProperties aiProperties;

    public AiResearchAdvisor(AiModelRouter modelRouter, AiProperties aiProperties) {
        this.modelRouter = modelRouter;
        this.aiProperties = aiProperties;
    }

    public Optional<String> advise(PackageMetadata metadata, DeprecationAnalysis deprecation) {
        String prompt = PromptUtils.withPackageContext(BASE_PROMPT, metadata, deprecation);
        try {
            AiModelRouter.AiResponse response = modelRouter.route(prompt, aiProperties.researchTier());
            String content = response.content() == null ? "" : response.content().strip();
            log.debug("AI insight for {} from tier {} in {} ms", metadata.name(), response.tierUsed(),
                    response.latency().toMillis());
            return content.isEmpty() ? Optional.empty() : Optional.of(content);
        } catch (RuntimeException e) {
            log.warn("AI insight unavailable for {}: {}", metadata.name(), e.getMessage());
            return Optional.empty();
        }
    }
}
