package com.interactiveemotes.port;

/**
 * Looks up the raw localized string for a text key. Tokens are not yet substituted.
 * Implementations throw a runtime exception when the key is unknown.
 */
public interface Localization {

    String resolve(String textKey);
}
