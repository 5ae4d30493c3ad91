package com.interactiveemotes.api.dto.response;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Reactions run asynchronously; this only reports which targets were considered. */
@Getter
@Builder
public class SignalAcceptedResponse {

    private final String initiatorId;
    private final String signal;
    private final List<String> consideredTargets;
}
