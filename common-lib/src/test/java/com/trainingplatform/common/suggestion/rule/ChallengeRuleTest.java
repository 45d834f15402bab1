package com.trainingplatform.common.suggestion.rule;

import com.trainingplatform.common.model.SuggestionSource;
import com.trainingplatform.common.model.TrainingSuggestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.trainingplatform.common.suggestion.TrainingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ChallengeRuleTest {

    @Test
    @DisplayName("low draw → challenge suggestion")
    void fires() {
        ChallengeRule rule = new ChallengeRule(() -> 0L);
        List<TrainingSuggestion> out = rule.propose(context(List.of(), WEDNESDAY), emptySet());
        assertEquals(1, out.size());
        assertEquals(SuggestionSource.CHALLENGE, out.get(0).source());
    }

    @Test
    @DisplayName("high draw → nothing")
    void silent() {
        ChallengeRule rule = new ChallengeRule(() -> -1L);
        assertTrue(rule.propose(context(List.of(), WEDNESDAY), emptySet()).isEmpty());
    }
}
