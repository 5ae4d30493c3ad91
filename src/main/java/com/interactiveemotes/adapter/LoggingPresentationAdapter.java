package com.interactiveemotes.adapter;

import com.interactiveemotes.port.AnimationPort;
import com.interactiveemotes.port.NotificationPort;
import com.interactiveemotes.port.SignalPort;
import com.interactiveemotes.port.SoundPort;
import com.interactiveemotes.port.TextPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default presentation layer for a headless host: every bubble, animation, text, sound and
 * notification is written to the log. A rendering host replaces this bean with its own ports.
 */
@Component
public class LoggingPresentationAdapter implements SignalPort, AnimationPort, TextPort, SoundPort, NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(LoggingPresentationAdapter.class);

    @Override
    public void perform(String targetId, String signalId) {
        log.info("[{}] emote {}", targetId, signalId);
    }

    @Override
    public void performNamed(String targetId, String animationName) {
        log.info("[{}] animation {}", targetId, animationName);
    }

    @Override
    public void show(String targetId, String text) {
        log.info("[{}] says \"{}\"", targetId, text);
    }

    @Override
    public void play(String effectId) {
        log.debug("sound {}", effectId);
    }

    @Override
    public void notify(String initiatorId, String message) {
        log.info("[{}] notification: {}", initiatorId, message);
    }
}
