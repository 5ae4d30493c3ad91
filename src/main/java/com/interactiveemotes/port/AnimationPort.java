package com.interactiveemotes.port;

/** Renders a full-body animation, e.g. {@code laugh} or {@code sick}. */
public interface AnimationPort {

    void performNamed(String targetId, String animationName);
}
