package com.interactiveemotes.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.domain.model.ComboRule;
import com.interactiveemotes.domain.model.ReactionRule;
import com.interactiveemotes.domain.model.RuleBook;
import com.interactiveemotes.domain.model.SignalRules;
import com.interactiveemotes.event.EventPublisherHelper;
import com.interactiveemotes.exception.RuleDefinitionException;
import com.interactiveemotes.port.RuleStore;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * {@link RuleStore} backed by two JSON files: immediate reactions and combo reactions.
 *
 * <p>Both files are read on startup and on {@link #reload()}, merged per emote, and published
 * as one immutable {@link RuleBook}. Readers always see either the old or the new rule book,
 * never a mix.
 *
 * <p>A missing file counts as an empty one. A file that cannot be parsed at all leaves the
 * current rule book in place.
 */
@Component
public class JsonRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(JsonRuleStore.class);

    private final ReactionEngineConfig reactionEngineConfig;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RuleDefinitionParser ruleDefinitionParser;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicReference<RuleBook> current = new AtomicReference<>(RuleBook.EMPTY);

    public JsonRuleStore(
            ReactionEngineConfig reactionEngineConfig,
            ResourceLoader resourceLoader,
            ObjectMapper objectMapper,
            RuleDefinitionParser ruleDefinitionParser,
            EventPublisherHelper eventPublisherHelper) {
        this.reactionEngineConfig = reactionEngineConfig;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.ruleDefinitionParser = ruleDefinitionParser;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @PostConstruct
    public void loadOnStartup() {
        try {
            reload();
        } catch (RuleDefinitionException e) {
            log.error("Starting with no reaction rules: {}", e.getMessage(), e);
        }
    }

    @Override
    public SignalRules rulesFor(String signalId) {
        return current.get().forSignal(signalId);
    }

    @Override
    public RuleBook current() {
        return current.get();
    }

    @Override
    public RuleBook reload() {
        String reactionsLocation = reactionEngineConfig.getReactionsLocation();
        String combosLocation = reactionEngineConfig.getCombosLocation();

        Map<String, List<ReactionRule>> reactions =
                parse(reactionsLocation, root -> ruleDefinitionParser.parseReactions(root));
        Map<String, List<ComboRule>> combos = parse(combosLocation, root -> ruleDefinitionParser.parseCombos(root));

        RuleBook ruleBook = merge(reactions, combos);
        current.set(ruleBook);

        log.info(
                "Loaded {} immediate and {} combo rules for {} emotes",
                ruleBook.immediateRuleCount(),
                ruleBook.comboRuleCount(),
                ruleBook.signals().size());
        eventPublisherHelper.publishRulesReloaded(this, ruleBook);
        return ruleBook;
    }

    @Override
    public RuleBook reset() {
        current.set(RuleBook.EMPTY);
        log.info("Reaction and combo rules reset to empty");
        eventPublisherHelper.publishRulesReloaded(this, RuleBook.EMPTY);
        return RuleBook.EMPTY;
    }

    private <T> Map<String, List<T>> parse(String location, RuleFileParser<T> parser) {
        JsonNode root = readTree(location);
        if (root == null) {
            return Map.of();
        }
        try {
            return parser.parse(root);
        } catch (IllegalArgumentException e) {
            throw new RuleDefinitionException(location, e);
        }
    }

    private JsonNode readTree(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Rule file {} not found, no rules loaded from it", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new RuleDefinitionException(location, e);
        }
    }

    private RuleBook merge(Map<String, List<ReactionRule>> reactions, Map<String, List<ComboRule>> combos) {
        Set<String> signals = new LinkedHashSet<>(reactions.keySet());
        signals.addAll(combos.keySet());

        Map<String, SignalRules> merged = new HashMap<>();
        for (String signal : signals) {
            merged.put(signal, new SignalRules(reactions.get(signal), combos.get(signal)));
        }
        return new RuleBook(merged);
    }

    @FunctionalInterface
    private interface RuleFileParser<T> {
        Map<String, List<T>> parse(JsonNode root);
    }
}
