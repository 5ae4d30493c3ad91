package com.interactiveemotes.world;

import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.port.FactProvider;
import com.interactiveemotes.port.RelationshipPort;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory world model fed by the host: current season and weather, initiator and actor
 * positions, and relationship scores.
 *
 * <p>Serves as the default {@link FactProvider}: a target farther than
 * {@code eventDistanceTiles} from the initiator produces no snapshot. An initiator without
 * a registered position is not range-checked.
 */
@Component
public class WorldStateRegistry implements FactProvider, RelationshipPort {

    private static final Logger log = LoggerFactory.getLogger(WorldStateRegistry.class);

    private final ReactionEngineConfig reactionEngineConfig;

    private volatile WorldConditions conditions = WorldConditions.DEFAULT;
    private final Map<String, InitiatorPlacement> initiators = new ConcurrentHashMap<>();
    private final Map<String, ActorProfile> actors = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Integer>> relationships = new ConcurrentHashMap<>();

    public WorldStateRegistry(ReactionEngineConfig reactionEngineConfig) {
        this.reactionEngineConfig = reactionEngineConfig;
    }

    // ========================
    // HOST UPDATES
    // ========================

    public void updateConditions(WorldConditions conditions) {
        this.conditions = conditions;
        log.debug("World conditions now season={}, weather={}", conditions.season(), conditions.weather());
    }

    public WorldConditions getConditions() {
        return conditions;
    }

    public void placeInitiator(InitiatorProfile profile, double x, double y) {
        initiators.put(profile.getId(), new InitiatorPlacement(profile, x, y));
    }

    public Optional<InitiatorProfile> findInitiator(String initiatorId) {
        return Optional.ofNullable(initiators.get(initiatorId)).map(InitiatorPlacement::profile);
    }

    public void putActor(ActorProfile actor) {
        actors.put(actor.getId(), actor);
    }

    public Optional<ActorProfile> findActor(String actorId) {
        return Optional.ofNullable(actors.get(actorId));
    }

    public void setRelationship(String initiatorId, String targetId, int score) {
        relationships.computeIfAbsent(initiatorId, id -> new ConcurrentHashMap<>()).put(targetId, score);
    }

    /**
     * Ids of all registered actors in reaction range of the initiator, nearest first.
     */
    public List<String> targetsNear(String initiatorId) {
        InitiatorPlacement placement = initiators.get(initiatorId);
        if (placement == null) {
            return List.of();
        }
        return actors.values().stream()
                .filter(actor -> !actor.getId().equals(initiatorId))
                .filter(actor -> placement.distanceTo(actor) <= reactionEngineConfig.getEventDistanceTiles())
                .sorted(Comparator.comparingDouble(placement::distanceTo))
                .map(ActorProfile::getId)
                .toList();
    }

    // ========================
    // FACT PROVIDER
    // ========================

    @Override
    public Optional<FactSnapshot> snapshot(InitiatorProfile initiator, String targetId) {
        ActorProfile actor = actors.get(targetId);
        if (actor == null) {
            return Optional.empty();
        }

        double distance = 0;
        InitiatorPlacement placement = initiators.get(initiator.getId());
        if (placement != null) {
            distance = placement.distanceTo(actor);
            if (distance > reactionEngineConfig.getEventDistanceTiles()) {
                return Optional.empty();
            }
        }

        WorldConditions current = conditions;
        return Optional.of(FactSnapshot.builder()
                .targetId(actor.getId())
                .targetName(actor.getName())
                .displayName(actor.getDisplayName() != null ? actor.getDisplayName() : actor.getName())
                .actor(actor.isActor())
                .actorType(actor.getActorType())
                .petType(actor.getPetType())
                .spouse(initiator.getId().equals(actor.getSpouseOf()))
                .dateable(actor.isDateable())
                .relationshipScore(get(initiator.getId(), targetId))
                .partnerName(actor.getPartnerName())
                .season(current.season())
                .weather(current.weather())
                .distanceTiles(distance)
                .build());
    }

    // ========================
    // RELATIONSHIP PORT
    // ========================

    @Override
    public void grant(String initiatorId, String targetId, int amount) {
        ActorProfile actor = actors.get(targetId);
        if (actor == null || !actor.isActor()) {
            throw new IllegalStateException("No relationship can be tracked with " + targetId);
        }
        int score = relationships
                .computeIfAbsent(initiatorId, id -> new ConcurrentHashMap<>())
                .merge(targetId, amount, Integer::sum);
        log.debug("Relationship {} -> {} is now {}", initiatorId, targetId, score);
    }

    @Override
    public int get(String initiatorId, String targetId) {
        Map<String, Integer> scores = relationships.get(initiatorId);
        if (scores == null) {
            return 0;
        }
        return scores.getOrDefault(targetId, 0);
    }

    @Override
    public boolean hasRelationship(String initiatorId, String targetId) {
        Map<String, Integer> scores = relationships.get(initiatorId);
        return scores != null && scores.containsKey(targetId);
    }
}
