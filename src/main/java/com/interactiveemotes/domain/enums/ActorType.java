package com.interactiveemotes.domain.enums;

/**
 * Coarse category of a reaction target, derived by the fact provider.
 *
 * <p>Rule files refer to these by their authored name ({@code "Villager"},
 * {@code "FarmAnimal"}, ...). The enum constant name is accepted as well.
 */
public enum ActorType {
    VILLAGER("Villager"),
    PET("Pet"),
    FARM_ANIMAL("FarmAnimal"),
    BABY("Baby"),
    OTHER("Other");

    private final String authoredName;

    ActorType(String authoredName) {
        this.authoredName = authoredName;
    }

    /** True if the given rule-file value names this type. */
    public boolean matches(String value) {
        return authoredName.equals(value) || name().equals(value);
    }
}
