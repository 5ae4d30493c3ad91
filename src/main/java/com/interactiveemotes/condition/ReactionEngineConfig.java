package com.interactiveemotes.condition;

import com.interactiveemotes.domain.enums.ComboCountMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the reaction engine under the {@code reaction-engine} prefix.
 *
 * <p>Groups:
 * <ul>
 *   <li>{@code enabled}, {@code eventDistanceTiles} -- master toggle and reaction radius</li>
 *   <li>{@code emoteDelayMs}, {@code emoteDelayJitterMs}, {@code signalTextPauseMs},
 *       {@code fragmentPauseMs} -- timing of a reaction sequence</li>
 *   <li>{@code rewardAmount}, {@code showRewardMessage}, {@code playReplySound} -- daily reward</li>
 *   <li>{@code comboEnabled}, {@code comboCountMode}, {@code globalComboTarget},
 *       {@code comboTimeoutMs} -- combo streaks</li>
 *   <li>{@code enableSeasonConditions}, {@code enableWeatherConditions},
 *       {@code enableFriendshipConditions} -- when off, the matching condition fields are ignored
 *       for every rule</li>
 * </ul>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "reaction-engine")
public class ReactionEngineConfig {

    private boolean enabled = true;
    private double eventDistanceTiles = 3;

    private long emoteDelayMs = 700;
    private int emoteDelayJitterMs = 300;
    private long signalTextPauseMs = 1200;
    private long fragmentPauseMs = 1800;

    private boolean playReplySound = true;
    private String replySoundId = "pickUpItem";
    private int rewardAmount = 10;
    private boolean showRewardMessage = true;

    private boolean comboEnabled = true;
    private ComboCountMode comboCountMode = ComboCountMode.PER_COMBO;
    private int globalComboTarget = 3;
    private long comboTimeoutMs = 2100;

    private boolean enableWeatherConditions = true;
    private boolean enableSeasonConditions = true;
    private boolean enableFriendshipConditions = true;

    private String animationPrefix = "anim_";
    private String textSplitter = "|";
    private String locale = "en";

    private String reactionsLocation = "classpath:rules/reactions.json";
    private String combosLocation = "classpath:rules/combos.json";
}
