package com.interactiveemotes.api.controller;

import com.interactiveemotes.api.dto.request.ActorRequest;
import com.interactiveemotes.api.dto.request.InitiatorRequest;
import com.interactiveemotes.api.dto.request.RelationshipRequest;
import com.interactiveemotes.api.dto.request.WorldConditionsRequest;
import com.interactiveemotes.domain.model.InitiatorProfile;
import com.interactiveemotes.exception.ResourceNotFoundException;
import com.interactiveemotes.world.ActorProfile;
import com.interactiveemotes.world.WorldConditions;
import com.interactiveemotes.world.WorldStateRegistry;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Host-facing API that feeds world facts into the {@link WorldStateRegistry}.
 */
@RestController
@RequestMapping("/api/world")
public class WorldController {

    private final WorldStateRegistry worldStateRegistry;

    public WorldController(WorldStateRegistry worldStateRegistry) {
        this.worldStateRegistry = worldStateRegistry;
    }

    @GetMapping("/conditions")
    public WorldConditions getConditions() {
        return worldStateRegistry.getConditions();
    }

    @PutMapping("/conditions")
    public WorldConditions updateConditions(@RequestBody @Valid WorldConditionsRequest request) {
        WorldConditions conditions = new WorldConditions(request.getSeason(), request.getWeather());
        worldStateRegistry.updateConditions(conditions);
        return conditions;
    }

    @PutMapping("/initiators/{id}")
    public InitiatorProfile placeInitiator(@PathVariable String id, @RequestBody @Valid InitiatorRequest request) {
        InitiatorProfile profile = InitiatorProfile.builder()
                .id(id)
                .name(request.getName())
                .teamName(request.getTeamName())
                .favoriteThing(request.getFavoriteThing())
                .companionName(request.getCompanionName())
                .male(request.isMale())
                .local(request.isLocal())
                .build();
        worldStateRegistry.placeInitiator(profile, request.getX(), request.getY());
        return profile;
    }

    @PutMapping("/actors/{id}")
    public ActorProfile putActor(@PathVariable String id, @RequestBody @Valid ActorRequest request) {
        ActorProfile.ActorProfileBuilder builder = ActorProfile.builder()
                .id(id)
                .name(request.getName())
                .displayName(request.getDisplayName())
                .actor(request.isActor())
                .actorType(request.getActorType())
                .dateable(request.isDateable())
                .spouseOf(request.getSpouseOf())
                .partnerName(request.getPartnerName())
                .x(request.getX())
                .y(request.getY());
        if (request.getPetType() != null) {
            builder.petType(request.getPetType());
        }
        ActorProfile actor = builder.build();
        worldStateRegistry.putActor(actor);
        return actor;
    }

    @PutMapping("/relationships/{initiatorId}/{targetId}")
    public Map<String, Object> setRelationship(
            @PathVariable String initiatorId,
            @PathVariable String targetId,
            @RequestBody @Valid RelationshipRequest request) {
        if (worldStateRegistry.findActor(targetId).isEmpty()) {
            throw new ResourceNotFoundException("Actor", targetId);
        }
        worldStateRegistry.setRelationship(initiatorId, targetId, request.getScore());
        return Map.of("initiatorId", initiatorId, "targetId", targetId, "score", request.getScore());
    }
}
