package com.interactiveemotes.unit.action;

import static org.assertj.core.api.Assertions.assertThat;

import com.interactiveemotes.action.TextTokenParser;
import com.interactiveemotes.domain.enums.ActorType;
import com.interactiveemotes.domain.model.FactSnapshot;
import com.interactiveemotes.domain.model.InitiatorProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TextTokenParserTest {

    private final TextTokenParser textTokenParser = new TextTokenParser();

    private final InitiatorProfile alex = InitiatorProfile.builder()
            .id("farmer-1")
            .name("Alex")
            .teamName("Sunny Acres")
            .favoriteThing("Parsnips")
            .companionName("Rex")
            .male(true)
            .build();

    private final FactSnapshot speaker = FactSnapshot.builder()
            .targetId("npc-penny")
            .actor(true)
            .actorType(ActorType.VILLAGER)
            .partnerName("Sam")
            .build();

    @Test
    @DisplayName("Initiator tokens are substituted")
    void initiatorTokens() {
        String parsed = textTokenParser.parse("Hi @ from %farm! Still like %favorite_thing?", alex, speaker);

        assertThat(parsed).isEqualTo("Hi Alex from Sunny Acres! Still like Parsnips?");
    }

    @Test
    @DisplayName("Companion and partner tokens are substituted when present")
    void companionAndPartner() {
        assertThat(textTokenParser.parse("How is %pet? Ask %spouse.", alex, speaker))
                .isEqualTo("How is Rex? Ask Sam.");
    }

    @Test
    @DisplayName("Companion and partner tokens stay literal when absent")
    void absentTokensStayLiteral() {
        InitiatorProfile noPet = alex.toBuilder().companionName(null).build();
        FactSnapshot single = speaker.toBuilder().partnerName(null).build();

        assertThat(textTokenParser.parse("%pet and %spouse", noPet, single)).isEqualTo("%pet and %spouse");
    }

    @Nested
    @DisplayName("Gender split")
    class GenderSplit {

        @Test
        @DisplayName("Male initiator gets the first branch")
        void maleFirstBranch() {
            assertThat(textTokenParser.parse("Hey handsome^Hey beautiful", alex, speaker))
                    .isEqualTo("Hey handsome");
        }

        @Test
        @DisplayName("Other initiators get the second branch with tokens applied")
        void otherSecondBranch() {
            InitiatorProfile sam = alex.toBuilder().name("Sam").male(false).build();

            assertThat(textTokenParser.parse("Hey handsome @^Hey beautiful @", sam, speaker))
                    .isEqualTo("Hey beautiful Sam");
        }

        @Test
        @DisplayName("Empty second branch yields empty text; unsplit text is unchanged")
        void emptySecondBranch() {
            InitiatorProfile sam = alex.toBuilder().male(false).build();

            assertThat(textTokenParser.parse("Only^", sam, speaker)).isEmpty();
            assertThat(textTokenParser.parse("No split here", sam, speaker)).isEqualTo("No split here");
        }
    }
}
