package org.tarik.autoheal.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of failure categories a diagnosis can carry.
 * The category drives the repair hint and the consecutive-unknown stop rule.
 */
public enum ErrorCategory {
    /**
     * A selector or locator could not be resolved to an element.
     */
    SELECTOR_NOT_FOUND("selector_not_found"),

    /**
     * An operation exceeded its time limit, or the whole execution ran for at least the configured timeout.
     */
    TIMEOUT("timeout"),

    /**
     * The page could not be reached: DNS, refused connection, dropped network.
     */
    NETWORK_ERROR("network_error"),

    /**
     * The page was reachable but navigation did not complete (aborted, redirected in a loop, detached frame).
     */
    NAVIGATION_FAILURE("navigation_failure"),

    /**
     * The script ran but one of its checks on the page state did not hold.
     */
    ASSERTION_FAILURE("assertion_failure"),

    /**
     * The browser or its page crashed or was closed under the script.
     */
    BROWSER_CRASH("browser_crash"),

    /**
     * The script itself is broken: syntax, type or reference errors.
     */
    SCRIPT_RUNTIME_ERROR("script_runtime_error"),

    /**
     * No rule matched. Carries zero confidence.
     */
    UNKNOWN("unknown");

    private final String value;

    ErrorCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
