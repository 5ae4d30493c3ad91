package com.interactiveemotes.api.dto.request;

import com.interactiveemotes.domain.enums.ActorType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Registers or replaces a reaction target.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActorRequest {

    @NotBlank
    private String name;

    private String displayName;

    @Builder.Default
    private boolean actor = true;

    @NotNull
    private ActorType actorType;

    private String petType;
    private boolean dateable;

    /** Id of the initiator this target is married to. */
    private String spouseOf;

    private String partnerName;

    private double x;
    private double y;
}
