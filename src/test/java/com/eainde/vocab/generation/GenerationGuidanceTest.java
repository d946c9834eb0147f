package com.eainde.vocab.generation;

import com.eainde.vocab.model.RowKey;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GenerationGuidanceTest {

    private final GenerationGuidance guidance = new GenerationGuidance();

    @Test
    void earlyRoundsUseTheBaseRules() {
        assertThat(guidance.rulesFor(1)).isEqualTo(GenerationGuidance.BASE_RULES);
        assertThat(guidance.rulesFor(2)).isEqualTo(GenerationGuidance.BASE_RULES);
    }

    @Test
    void rulesAccumulateAsRoundsGrow() {
        assertThat(guidance.rulesFor(3)).endsWith(GenerationGuidance.SPECIFIC);
        assertThat(guidance.rulesFor(6)).endsWith(GenerationGuidance.SPECIFIC, GenerationGuidance.ADJACENT);
        assertThat(guidance.rulesFor(9)).endsWith(
                GenerationGuidance.SPECIFIC, GenerationGuidance.ADJACENT, GenerationGuidance.DIVERSIFY);
        assertThat(guidance.rulesFor(12)).hasSize(GenerationGuidance.BASE_RULES.size() + 3);
    }

    @Test
    void promptRendersAvoidPairs() {
        GenerationPrompt prompt = new GenerationPrompt("food", 10,
                List.of(new RowKey("寿司", "すし"), new RowKey("ラーメン", "")), List.of());

        assertThat(prompt.avoidPairs()).isEqualTo("寿司|すし; ラーメン|");
    }
}
