package com.interactiveemotes.port;

import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import java.util.Optional;

/**
 * Resolves world facts for one (initiator, target) pair.
 *
 * <p>Returns empty when the target is unknown or out of reaction range.
 */
public interface FactProvider {

    Optional<FactSnapshot> snapshot(InitiatorProfile initiator, String targetId);
}
