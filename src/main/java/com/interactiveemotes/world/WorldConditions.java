package com.interactiveemotes.world;

public record WorldConditions(String season, String weather) {

    public static final WorldConditions DEFAULT = new WorldConditions("spring", "sunny");
}
