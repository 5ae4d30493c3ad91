package com.interactiveemotes.adapter;

import com.interactiveemotes.condition.ReactionEngineConfig;
import com.interactiveemotes.port.Localization;
import java.util.Locale;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

/**
 * Resolves text keys from the {@code i18n/reactions} bundle in the configured locale.
 * Unknown keys raise {@link org.springframework.context.NoSuchMessageException}.
 */
@Component
public class MessageSourceLocalization implements Localization {

    private final MessageSource messageSource;
    private final ReactionEngineConfig reactionEngineConfig;

    public MessageSourceLocalization(MessageSource messageSource, ReactionEngineConfig reactionEngineConfig) {
        this.messageSource = messageSource;
        this.reactionEngineConfig = reactionEngineConfig;
    }

    @Override
    public String resolve(String textKey) {
        return messageSource.getMessage(textKey, null, Locale.forLanguageTag(reactionEngineConfig.getLocale()));
    }
}
