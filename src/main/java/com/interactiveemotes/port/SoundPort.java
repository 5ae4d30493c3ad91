package com.interactiveemotes.port;

public interface SoundPort {

    void play(String effectId);
}
