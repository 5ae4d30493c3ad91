package com.interactiveemotes.port;

/**
 * Relationship scores between initiators and targets, owned by the host world.
 */
public interface RelationshipPort {

    /**
     * Applies a relationship delta.
     *
     * @throws IllegalStateException if the host cannot track a relationship with the target
     */
    void grant(String initiatorId, String targetId, int amount);

    int get(String initiatorId, String targetId);

    boolean hasRelationship(String initiatorId, String targetId);
}
