package com.trainingplatform.common.suggestion;

import com.trainingplatform.common.model.TrainingSuggestion;

import java.util.List;

/**
 * One independent recommendation rule.
 *
 * <p>Implementations must be stateless and must not mutate {@code accepted};
 * they may read it to honour "only if nothing similar fired yet" conditions.
 * Most rules return zero or one suggestion; a few emit a related pair.
 */
public interface SuggestionRule {

    List<TrainingSuggestion> propose(SuggestionContext context, SuggestionSet accepted);
}
