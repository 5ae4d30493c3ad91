package com.interactiveemotes.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * An emote performed by a registered initiator. When {@code targetIds} is omitted, every
 * registered actor in range is considered.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalRequest {

    @NotBlank
    private String initiatorId;

    @NotBlank
    private String signal;

    private List<String> targetIds;
}
