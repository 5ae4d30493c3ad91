package com.interactiveemotes.exception;

import java.util.Map;

/**
 * A rule file could not be read as a whole. Individual malformed rules do not raise this;
 * they are loaded as never-matching rules instead.
 */
public class RuleDefinitionException extends BaseException {

    public RuleDefinitionException(String location, Throwable cause) {
        super(
                ErrorCode.INVALID_RULE_DEFINITION,
                "Rule file could not be parsed: " + location,
                Map.of("location", location, "reason", String.valueOf(cause.getMessage())),
                cause);
    }
}
