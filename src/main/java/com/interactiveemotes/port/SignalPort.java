package com.interactiveemotes.port;

/** Renders a reaction bubble above the target. */
public interface SignalPort {

    void perform(String targetId, String signalId);
}
