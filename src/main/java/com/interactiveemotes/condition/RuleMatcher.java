package com.interactiveemotes.condition;

import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.Rule;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * First-match search over an ordered rule list.
 *
 * <p>Rules are scanned in authored order and the first one whose condition holds wins.
 * There is no scoring: rule authors express specificity by putting narrower rules first.
 * Rules that failed to parse are skipped.
 */
@Component
public class RuleMatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleMatcher.class);

    private final ConditionEvaluator conditionEvaluator;

    public RuleMatcher(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    public <R extends Rule> Optional<R> findFirstMatch(List<R> rules, FactSnapshot facts) {
        if (rules == null || rules.isEmpty()) {
            return Optional.empty();
        }

        for (R rule : rules) {
            if (rule.getDefinitionError() != null) {
                log.warn("Skipping invalid rule: {}", rule.getDefinitionError());
                continue;
            }
            if (conditionEvaluator.evaluate(rule.getCondition(), facts)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
