package com.interactiveemotes.condition;

import com.interactiveemotes.domain.enums.ActorType;
import com.interactiveemotes.domain.model.Condition;
import com.interactiveemotes.domain.model.FactSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pure predicate over a rule {@link Condition} and a {@link FactSnapshot}.
 *
 * <p>Every set field must hold (short-circuit AND); an unset field is vacuously true.
 * Field semantics:
 * <ul>
 *   <li>{@code actorTypes} -- the target's type must be one of the listed authored names</li>
 *   <li>{@code petType} -- exact match on the derived subtype</li>
 *   <li>{@code name}, {@code isSpouse}, {@code isDateable}, friendship bounds -- only meaningful
 *       for full actors; any of them set on a non-actor target fails the condition</li>
 *   <li>friendship -- inclusive lower bound, exclusive upper bound</li>
 *   <li>{@code season}, {@code weather} -- case-insensitive</li>
 * </ul>
 *
 * <p>The season, weather and friendship toggles in {@link ReactionEngineConfig} disable the
 * corresponding fields for all rules. A malformed condition fails closed and is logged.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ReactionEngineConfig reactionEngineConfig;

    public ConditionEvaluator(ReactionEngineConfig reactionEngineConfig) {
        this.reactionEngineConfig = reactionEngineConfig;
    }

    public boolean evaluate(Condition condition, FactSnapshot facts) {
        if (condition == null) {
            return true;
        }

        if (condition.isMalformed()) {
            log.warn(
                    "Malformed condition treated as non-matching for target {}: {}",
                    facts.getTargetId(),
                    condition.getDefinitionError());
            return false;
        }

        if (!matchesActorType(condition, facts)) {
            return false;
        }

        if (condition.getPetType() != null && !condition.getPetType().equals(facts.getPetType())) {
            return false;
        }

        if (facts.isActor()) {
            if (!matchesActorFacts(condition, facts)) {
                return false;
            }
        } else if (condition.hasActorOnlyFields()) {
            return false;
        }

        if (condition.getIsBaby() != null && (facts.getActorType() == ActorType.BABY) != condition.getIsBaby()) {
            return false;
        }

        if (reactionEngineConfig.isEnableSeasonConditions()
                && condition.getSeason() != null
                && !condition.getSeason().equalsIgnoreCase(facts.getSeason())) {
            return false;
        }

        return !reactionEngineConfig.isEnableWeatherConditions()
                || condition.getWeather() == null
                || condition.getWeather().equalsIgnoreCase(facts.getWeather());
    }

    private boolean matchesActorType(Condition condition, FactSnapshot facts) {
        if (condition.getActorTypes().isEmpty()) {
            return true;
        }
        ActorType actorType = facts.getActorType();
        return condition.getActorTypes().values().stream().anyMatch(actorType::matches);
    }

    private boolean matchesActorFacts(Condition condition, FactSnapshot facts) {
        if (condition.getName() != null && !condition.getName().equals(facts.getTargetName())) {
            return false;
        }
        if (condition.getIsSpouse() != null && facts.isSpouse() != condition.getIsSpouse()) {
            return false;
        }
        if (condition.getIsDateable() != null && facts.isDateable() != condition.getIsDateable()) {
            return false;
        }

        if (reactionEngineConfig.isEnableFriendshipConditions()) {
            int score = facts.getRelationshipScore();
            if (condition.getFriendshipAtLeast() != null && score < condition.getFriendshipAtLeast()) {
                return false;
            }
            if (condition.getFriendshipBelow() != null && score >= condition.getFriendshipBelow()) {
                return false;
            }
        }
        return true;
    }
}
