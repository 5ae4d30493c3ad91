package com.interactiveemotes.api.controller;

import com.interactiveemotes.api.dto.request.SignalRequest;
import com.interactiveemotes.api.dto.response.RuleSummaryResponse;
import com.interactiveemotes.api.dto.response.SignalAcceptedResponse;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.domain.model.InspectionReport;
import com.interactiveemotes.domain.model.SignalRules;
import com.interactiveemotes.engine.ReactionEngine;
import com.interactiveemotes.engine.ReactionInspector;
import com.interactiveemotes.exception.ResourceNotFoundException;
import com.interactiveemotes.port.RuleStore;
import com.interactiveemotes.world.WorldStateRegistry;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for performing emotes and managing reaction rules.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/reactions/signals} -- an initiator performs an emote</li>
 *   <li>{@code POST /api/reactions/rules/reload} -- re-read the rule files</li>
 *   <li>{@code POST /api/reactions/rules/reset} -- drop all loaded rules</li>
 *   <li>{@code GET /api/reactions/rules} -- rule counts for every emote</li>
 *   <li>{@code GET /api/reactions/rules/{signal}} -- rule counts for one emote</li>
 *   <li>{@code GET /api/reactions/inspect} -- how a target would react, without reacting</li>
 *   <li>{@code POST /api/reactions/day-start} -- start a new day and reset daily rewards</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/reactions")
public class ReactionController {

    private final ReactionEngine reactionEngine;
    private final ReactionInspector reactionInspector;
    private final RuleStore ruleStore;
    private final WorldStateRegistry worldStateRegistry;

    public ReactionController(
            ReactionEngine reactionEngine,
            ReactionInspector reactionInspector,
            RuleStore ruleStore,
            WorldStateRegistry worldStateRegistry) {
        this.reactionEngine = reactionEngine;
        this.reactionInspector = reactionInspector;
        this.ruleStore = ruleStore;
        this.worldStateRegistry = worldStateRegistry;
    }

    @PostMapping("/signals")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public SignalAcceptedResponse performSignal(@RequestBody @Valid SignalRequest request) {
        InitiatorProfile initiator = requireInitiator(request.getInitiatorId());
        List<String> targets = request.getTargetIds() != null
                ? request.getTargetIds()
                : worldStateRegistry.targetsNear(initiator.getId());

        reactionEngine.processSignal(initiator, request.getSignal(), targets);

        return SignalAcceptedResponse.builder()
                .initiatorId(initiator.getId())
                .signal(request.getSignal())
                .consideredTargets(targets)
                .build();
    }

    @PostMapping("/rules/reload")
    public RuleSummaryResponse reloadRules() {
        return RuleSummaryResponse.of(reactionEngine.reloadRules());
    }

    @PostMapping("/rules/reset")
    public RuleSummaryResponse resetRules() {
        return RuleSummaryResponse.of(reactionEngine.resetRules());
    }

    @GetMapping("/rules")
    public RuleSummaryResponse getRules() {
        return RuleSummaryResponse.of(ruleStore.current());
    }

    @GetMapping("/rules/{signal}")
    public RuleSummaryResponse getRulesForSignal(@PathVariable String signal) {
        SignalRules rules = ruleStore.rulesFor(signal);
        if (rules.isEmpty()) {
            throw new ResourceNotFoundException("Reaction rules", signal);
        }
        return RuleSummaryResponse.builder()
                .signals(List.of(signal))
                .immediateRules(rules.immediateRules().size())
                .comboRules(rules.comboRules().size())
                .build();
    }

    @GetMapping("/inspect")
    public InspectionReport inspect(
            @RequestParam String initiatorId, @RequestParam String signal, @RequestParam String targetId) {
        return reactionInspector.inspect(requireInitiator(initiatorId), signal, targetId);
    }

    @PostMapping("/day-start")
    public Map<String, Object> startDay() {
        reactionEngine.startDay();
        return Map.of("dayStarted", true);
    }

    private InitiatorProfile requireInitiator(String initiatorId) {
        return worldStateRegistry
                .findInitiator(initiatorId)
                .orElseThrow(() -> new ResourceNotFoundException("Initiator", initiatorId));
    }
}
