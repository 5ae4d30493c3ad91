package com.interactiveemotes.event;

import com.interactiveemotes.domain.model.RuleBook;
import org.springframework.context.ApplicationEvent;

public class RulesReloadedEvent extends ApplicationEvent {

    private final RuleBook ruleBook;

    public RulesReloadedEvent(Object source, RuleBook ruleBook) {
        super(source);
        this.ruleBook = ruleBook;
    }

    public RuleBook getRuleBook() {
        return ruleBook;
    }
}
