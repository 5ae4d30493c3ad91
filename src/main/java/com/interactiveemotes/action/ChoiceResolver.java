package com.interactiveemotes.action;

import com.interactiveemotes.domain.model.OneOrMany;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.springframework.stereotype.Component;

/**
 * Source of randomness for reactions: picks one of several authored alternatives and
 * draws the latency jitter.
 */
@Component
public class ChoiceResolver {

    private final Random random;

    public ChoiceResolver() {
        this(new Random());
    }

    public ChoiceResolver(Random random) {
        this.random = random;
    }

    /**
     * Empty yields nothing, a single value is returned as is, several values are picked from
     * uniformly at random.
     */
    public <T> Optional<T> resolveChoice(OneOrMany<T> choices) {
        if (choices == null || choices.isEmpty()) {
            return Optional.empty();
        }
        List<T> values = choices.values();
        if (values.size() == 1) {
            return Optional.of(values.get(0));
        }
        synchronized (random) {
            return Optional.of(values.get(random.nextInt(values.size())));
        }
    }

    /** Uniform in {@code [0, bound)}; 0 when bound is not positive. */
    public int nextJitter(int bound) {
        if (bound <= 0) {
            return 0;
        }
        synchronized (random) {
            return random.nextInt(bound);
        }
    }
}
