package com.interactiveemotes.api.dto.response;

import com.interactiveemotes.domain.model.RuleBook;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Counts of the loaded rules, either for one emote or for the whole rule book. */
@Getter
@Builder
public class RuleSummaryResponse {

    private final List<String> signals;
    private final int immediateRules;
    private final int comboRules;

    public static RuleSummaryResponse of(RuleBook ruleBook) {
        return RuleSummaryResponse.builder()
                .signals(ruleBook.signals().stream().sorted().toList())
                .immediateRules(ruleBook.immediateRuleCount())
                .comboRules(ruleBook.comboRuleCount())
                .build();
    }
}
