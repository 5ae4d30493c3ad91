package com.interactiveemotes.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.interactiveemotes.domain.model.ComboRule;
import com.interactiveemotes.domain.model.Condition;
import com.interactiveemotes.domain.model.OneOrMany;
import com.interactiveemotes.domain.model.ReactionAction;
import com.interactiveemotes.domain.model.ReactionRule;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the JSON trees of {@code reactions.json} and {@code combos.json} into rule lists.
 *
 * <p>Property names are matched case-insensitively. Both {@code Action} fields and
 * {@code CharacterType} accept a string or an array of strings.
 *
 * <p>Bad data is contained at the smallest level possible: a malformed condition becomes a
 * never-matching condition, a malformed action or unknown rule field marks the rule invalid,
 * and a signal entry of the wrong shape is skipped. Only a root that is not an object fails the
 * whole file.
 */
@Component
public class RuleDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(RuleDefinitionParser.class);

    static final String REACTIONS_FIELD = "reactions";
    static final String COMBO_REACTIONS_FIELD = "comboreactions";

    /**
     * Parses {@code {signal: {"Reactions": [...]}}}.
     *
     * @throws IllegalArgumentException if the root is not a JSON object
     */
    public Map<String, List<ReactionRule>> parseReactions(JsonNode root) {
        Map<String, List<ReactionRule>> result = new LinkedHashMap<>();
        forEachSignalList(root, REACTIONS_FIELD, (signal, rules) -> {
            List<ReactionRule> parsed = new ArrayList<>();
            for (JsonNode ruleNode : rules) {
                parsed.add(parseReactionRule(signal, ruleNode));
            }
            result.put(signal, parsed);
        });
        return result;
    }

    /**
     * Parses {@code {signal: {"ComboReactions": [...]}}}.
     *
     * @throws IllegalArgumentException if the root is not a JSON object
     */
    public Map<String, List<ComboRule>> parseCombos(JsonNode root) {
        Map<String, List<ComboRule>> result = new LinkedHashMap<>();
        forEachSignalList(root, COMBO_REACTIONS_FIELD, (signal, rules) -> {
            List<ComboRule> parsed = new ArrayList<>();
            for (JsonNode ruleNode : rules) {
                parsed.add(parseComboRule(signal, ruleNode));
            }
            result.put(signal, parsed);
        });
        return result;
    }

    ReactionRule parseReactionRule(String signal, JsonNode node) {
        if (node == null || !node.isObject()) {
            return invalidReaction(signal, "rule must be an object");
        }

        Condition condition = null;
        ReactionAction action = ReactionAction.NONE;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey().toLowerCase(Locale.ROOT);
            try {
                switch (name) {
                    case "conditions" -> condition = parseCondition(field.getValue());
                    case "action" -> action = parseAction(field.getValue());
                    default -> throw new IllegalArgumentException("unknown rule field '" + field.getKey() + "'");
                }
            } catch (IllegalArgumentException e) {
                return invalidReaction(signal, e.getMessage());
            }
        }
        warnIfMalformed(signal, condition);
        return ReactionRule.builder().condition(condition).action(action).build();
    }

    ComboRule parseComboRule(String signal, JsonNode node) {
        if (node == null || !node.isObject()) {
            return invalidCombo(signal, "rule must be an object");
        }

        Condition condition = null;
        Integer triggerCount = null;
        ReactionAction action = ReactionAction.NONE;
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey().toLowerCase(Locale.ROOT);
            try {
                switch (name) {
                    case "conditions" -> condition = parseCondition(field.getValue());
                    case "triggercount" -> triggerCount = positiveTriggerCount(field.getKey(), field.getValue());
                    case "action" -> action = parseAction(field.getValue());
                    default -> throw new IllegalArgumentException("unknown rule field '" + field.getKey() + "'");
                }
            } catch (IllegalArgumentException e) {
                return invalidCombo(signal, e.getMessage());
            }
        }
        warnIfMalformed(signal, condition);
        return ComboRule.builder()
                .condition(condition)
                .triggerCount(triggerCount)
                .action(action)
                .build();
    }

    private Integer positiveTriggerCount(String fieldName, JsonNode value) {
        Integer count = intValue(fieldName, value);
        if (count != null && count <= 0) {
            throw new IllegalArgumentException("'" + fieldName + "' must be positive, got " + count);
        }
        return count;
    }

    /**
     * Returns null for an absent condition block. Any unknown field or wrongly typed value
     * yields {@link Condition#malformed}.
     */
    Condition parseCondition(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (!node.isObject()) {
            return Condition.malformed("Conditions must be an object");
        }

        Condition.ConditionBuilder builder = Condition.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            try {
                switch (key.toLowerCase(Locale.ROOT)) {
                    case "name" -> builder.name(textValue(key, value));
                    case "isspouse" -> builder.isSpouse(booleanValue(key, value));
                    case "isdateable" -> builder.isDateable(booleanValue(key, value));
                    case "isbaby" -> builder.isBaby(booleanValue(key, value));
                    case "friendshipgreaterthanorequalto" -> builder.friendshipAtLeast(intValue(key, value));
                    case "friendshiplessthan" -> builder.friendshipBelow(intValue(key, value));
                    case "charactertype" -> builder.actorTypes(oneOrMany(key, value));
                    case "pettype" -> builder.petType(textValue(key, value));
                    case "season" -> builder.season(textValue(key, value));
                    case "weather" -> builder.weather(textValue(key, value));
                    default -> throw new IllegalArgumentException("unknown condition field '" + key + "'");
                }
            } catch (IllegalArgumentException e) {
                return Condition.malformed(e.getMessage());
            }
        }
        return builder.build();
    }

    /**
     * A bare string is shorthand for {@code {"Emote": value}}.
     */
    ReactionAction parseAction(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return ReactionAction.NONE;
        }
        if (node.isTextual()) {
            return node.asText().isEmpty() ? ReactionAction.NONE : ReactionAction.signal(node.asText());
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("Action must be a string or an object");
        }

        ReactionAction.ReactionActionBuilder builder = ReactionAction.builder();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            switch (field.getKey().toLowerCase(Locale.ROOT)) {
                case "emote" -> builder.primaryChoices(oneOrMany(field.getKey(), field.getValue()));
                case "displaytext" -> builder.textChoices(oneOrMany(field.getKey(), field.getValue()));
                default -> throw new IllegalArgumentException("unknown action field '" + field.getKey() + "'");
            }
        }
        return builder.build();
    }

    OneOrMany<String> oneOrMany(String key, JsonNode value) {
        if (value == null || value.isNull()) {
            return OneOrMany.none();
        }
        if (value.isTextual()) {
            return OneOrMany.one(value.asText());
        }
        if (value.isArray()) {
            List<String> values = new ArrayList<>();
            for (JsonNode element : value) {
                values.add(textValue(key, element));
            }
            return OneOrMany.many(values);
        }
        throw new IllegalArgumentException("'" + key + "' must be a string or an array of strings");
    }

    private void forEachSignalList(JsonNode root, String listField, SignalListConsumer consumer) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("rule file root must be an object keyed by emote");
        }

        Iterator<Map.Entry<String, JsonNode>> signals = root.fields();
        while (signals.hasNext()) {
            Map.Entry<String, JsonNode> entry = signals.next();
            String signal = entry.getKey();
            JsonNode rules = findField(entry.getValue(), listField);
            if (rules == null || rules.isNull()) {
                continue;
            }
            if (!rules.isArray()) {
                log.warn("Skipping rules for emote '{}': '{}' is not a list", signal, listField);
                continue;
            }
            consumer.accept(signal, rules);
        }
    }

    private JsonNode findField(JsonNode node, String lowerCaseName) {
        if (node == null || !node.isObject()) {
            return null;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().toLowerCase(Locale.ROOT).equals(lowerCaseName)) {
                return field.getValue();
            }
        }
        return null;
    }

    private String textValue(String key, JsonNode value) {
        if (!value.isTextual()) {
            throw new IllegalArgumentException("'" + key + "' must be a string");
        }
        return value.asText();
    }

    private Boolean booleanValue(String key, JsonNode value) {
        if (!value.isBoolean()) {
            throw new IllegalArgumentException("'" + key + "' must be true or false");
        }
        return value.asBoolean();
    }

    private Integer intValue(String key, JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("'" + key + "' must be an integer");
        }
        return value.asInt();
    }

    private void warnIfMalformed(String signal, Condition condition) {
        if (condition != null && condition.isMalformed()) {
            log.warn(
                    "Rule for emote '{}' has a malformed condition and will never match: {}",
                    signal,
                    condition.getDefinitionError());
        }
    }

    private ReactionRule invalidReaction(String signal, String reason) {
        log.warn("Invalid reaction rule for emote '{}': {}", signal, reason);
        return ReactionRule.builder().definitionError("emote '" + signal + "': " + reason).build();
    }

    private ComboRule invalidCombo(String signal, String reason) {
        log.warn("Invalid combo rule for emote '{}': {}", signal, reason);
        return ComboRule.builder().definitionError("emote '" + signal + "': " + reason).build();
    }

    @FunctionalInterface
    private interface SignalListConsumer {
        void accept(String signal, JsonNode rules);
    }
}
