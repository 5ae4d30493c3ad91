package com.interactiveemotes.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InitiatorRequest {

    @NotBlank
    private String name;

    private String teamName;
    private String favoriteThing;
    private String companionName;

    @Builder.Default
    private boolean male = true;

    @Builder.Default
    private boolean local = true;

    private double x;
    private double y;
}
