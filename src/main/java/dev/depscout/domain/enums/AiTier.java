package dev.depscout.domain.enums;

import java.util.Optional;

/**
 * Bedrock model tiers, cheapest first. Research advice runs at CHEAP unless configured
 * otherwise, and a failed call steps down one tier.
 */
public enum AiTier {
    LOCAL, CHEAP, SMART;

    public boolean isWithinBudget(AiTier ceiling) {
        return compareTo(ceiling) <= 0;
    }

    public Optional<AiTier> stepDown() {
        return ordinal() == 0 ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }
}
