package com.interactiveemotes.action;

import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import org.springframework.stereotype.Component;

/**
 * Substitutes dialogue tokens in one text fragment.
 *
 * <ul>
 *   <li>{@code male^female} -- the second branch is used when the initiator is not male</li>
 *   <li>{@code @} -- initiator name</li>
 *   <li>{@code %farm} -- initiator's team name</li>
 *   <li>{@code %favorite_thing} -- initiator's favorite thing</li>
 *   <li>{@code %pet} -- initiator's companion name, left as is when they have none</li>
 *   <li>{@code %spouse} -- the speaker's partner, left as is when the speaker has none</li>
 * </ul>
 */
@Component
public class TextTokenParser {

    static final String GENDER_SPLITTER = "^";

    public String parse(String text, InitiatorProfile initiator, FactSnapshot speaker) {
        String parsed = text;
        if (parsed.contains(GENDER_SPLITTER)) {
            String[] branches = parsed.split("\\^", -1);
            parsed = branches.length >= 2 && !initiator.isMale() ? branches[1] : branches[0];
        }

        parsed = parsed.replace("@", nullToEmpty(initiator.getName()));
        parsed = parsed.replace("%farm", nullToEmpty(initiator.getTeamName()));
        parsed = parsed.replace("%favorite_thing", nullToEmpty(initiator.getFavoriteThing()));
        if (initiator.hasCompanion()) {
            parsed = parsed.replace("%pet", initiator.getCompanionName());
        }
        if (speaker.getPartnerName() != null) {
            parsed = parsed.replace("%spouse", speaker.getPartnerName());
        }
        return parsed;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
