package com.interactiveemotes.port;

/** Shows a short-lived text fragment above the target. */
public interface TextPort {

    void show(String targetId, String text);
}
