package com.interactiveemotes.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

import com.interactiveemotes.domain.enums.ReactionKind;
import com.interactiveemotes.domain.model.ReactionOutcome;
import com.interactiveemotes.domain.model.RuleBook;
import com.interactiveemotes.event.DayStartedEvent;
import com.interactiveemotes.event.EventPublisherHelper;
import com.interactiveemotes.event.ReactionPerformedEvent;
import com.interactiveemotes.event.RulesReloadedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class EventPublisherHelperTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private EventPublisherHelper eventPublisherHelper;

    @BeforeEach
    void setUp() {
        eventPublisherHelper = new EventPublisherHelper(applicationEventPublisher);
    }

    private ApplicationEvent published() {
        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher).publishEvent(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Reaction performed event carries the outcome")
    void reactionPerformed() {
        ReactionOutcome outcome = ReactionOutcome.builder()
                .kind(ReactionKind.COMBO)
                .targetId("npc-haley")
                .build();

        eventPublisherHelper.publishReactionPerformed(this, outcome);

        ApplicationEvent event = published();
        assertThat(event).isInstanceOf(ReactionPerformedEvent.class);
        assertThat(((ReactionPerformedEvent) event).getOutcome()).isSameAs(outcome);
        assertThat(event.getSource()).isSameAs(this);
    }

    @Test
    @DisplayName("Day started event is stamped with its start time")
    void dayStarted() {
        eventPublisherHelper.publishDayStarted(this);

        ApplicationEvent event = published();
        assertThat(event).isInstanceOf(DayStartedEvent.class);
        assertThat(((DayStartedEvent) event).getStartedAt()).isNotNull();
    }

    @Test
    @DisplayName("Rules reloaded event carries the rule book")
    void rulesReloaded() {
        eventPublisherHelper.publishRulesReloaded(this, RuleBook.EMPTY);

        ApplicationEvent event = published();
        assertThat(((RulesReloadedEvent) event).getRuleBook()).isSameAs(RuleBook.EMPTY);
    }
}
