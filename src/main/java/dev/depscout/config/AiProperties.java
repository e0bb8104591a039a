package dev.depscout.config;

import dev.depscout.domain.enums.AiTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * AI research config. Off unless {@code enabled}; researchTier is what the advisor asks for,
 * maxTier is the global cost ceiling.
 */
@ConfigurationProperties(prefix = "depscout.ai")
public record AiProperties(boolean enabled, AiTier researchTier, AiTier maxTier, int maxOutputTokens,
                           String smartModel, String cheapModel, String localModel) {
    public AiProperties {
        if (researchTier == null) researchTier = AiTier.CHEAP;
        if (maxTier == null) maxTier = AiTier.CHEAP;
        if (maxOutputTokens <= 0) maxOutputTokens = 512;
        if (smartModel == null) smartModel = "amazon.nova-pro-v1:0";
        if (cheapModel == null) cheapModel = "amazon.nova-lite-v1:0";
        if (localModel == null) localModel = "amazon.nova-micro-v1:0";
    }

    public AiTier effectiveTier(AiTier requested) {
        if (requested == null) return researchTier;
        return requested.isWithinBudget(maxTier) ? requested : maxTier;
    }

    public String modelFor(AiTier tier) {
        return switch (tier) {
            case SMART -> smartModel;
            case CHEAP -> cheapModel;
            case LOCAL -> localModel;
        };
    }
}
