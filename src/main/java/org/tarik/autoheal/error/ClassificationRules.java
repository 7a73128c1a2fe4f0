/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.autoheal.error;

import java.util.List;

import static org.tarik.autoheal.error.ErrorCategory.*;

/**
 * Built-in rule list. Earlier rules take precedence, so a locator wait which timed out is reported as a selector
 * problem rather than as a timeout.
 */
public final class ClassificationRules {
    private ClassificationRules() {
    }

    public static List<ClassificationRule> defaults() {
        return List.of(
                selector(),
                new TimeoutClassificationRule(List.of(
                        "timeout \\d+\\s*ms exceeded",
                        "\\btimed? ?out\\b",
                        "timeouterror",
                        "deadline exceeded")),
                network(),
                navigation(),
                assertion(),
                browserCrash(),
                scriptRuntime());
    }

    private static ClassificationRule selector() {
        return new PatternClassificationRule("selector", SELECTOR_NOT_FOUND, List.of(
                "waiting for (selector|locator|element)",
                "element (is )?not found",
                "no (such )?element",
                "could not find (element|selector)",
                "unable to locate",
                "resolved to 0 elements",
                "strict mode violation"),
                0.8,
                "Element could not be located on the page",
                "Use more robust selectors (text=, role=, data-testid); wait for the element to be visible before " +
                        "interacting with it; check whether the element is inside an iframe or shadow DOM");
    }

    private static ClassificationRule network() {
        return new PatternClassificationRule("network", NETWORK_ERROR, List.of(
                "net::err_(name_not_resolved|connection_\\w+|internet_disconnected|network_\\w+|" +
                        "address_unreachable|proxy_\\w+)",
                "connection (refused|reset)",
                "econn(refused|reset)",
                "enotfound",
                "\\bdns\\b",
                "host (is )?unreachable",
                "socket hang up"),
                0.9,
                "Network request failed",
                "Check that the target URL is correct and reachable; retry the navigation once after a short " +
                        "pause; avoid depending on third-party resources which may be blocked");
    }

    private static ClassificationRule navigation() {
        return new PatternClassificationRule("navigation", NAVIGATION_FAILURE, List.of(
                "navigation (failed|to .* (was )?interrupted)",
                "net::err_aborted",
                "err_too_many_redirects",
                "frame (was )?detached",
                "page\\.goto",
                "ns_binding_aborted"),
                0.75,
                "Page navigation did not complete",
                "Wait for the navigation to finish before interacting with the page; use page.goto with " +
                        "wait_until='domcontentloaded'; re-query elements after the page changed");
    }

    private static ClassificationRule assertion() {
        return new PatternClassificationRule("assertion", ASSERTION_FAILURE, List.of(
                "assertionerror",
                "assertion failed",
                "expect\\(",
                "expected .+ but (was|got|received)",
                "to(be|have)(visible|text|url|title|count)"),
                0.8,
                "Page state did not match an expectation of the script",
                "Verify that the expected text or state is correct for the current page; wait for the page to " +
                        "settle before asserting; prefer partial text matches");
    }

    private static ClassificationRule browserCrash() {
        return new PatternClassificationRule("browser-crash", BROWSER_CRASH, List.of(
                "target (page, context or browser )?(has been )?closed",
                "browser has (been )?(closed|disconnected)",
                "page crashed",
                "crash",
                "segmentation fault",
                "\\bkilled\\b"),
                0.7,
                "Browser or page process terminated unexpectedly",
                "Reduce the memory footprint of the script; avoid opening many pages at once; close pages and " +
                        "contexts only after the last interaction");
    }

    private static ClassificationRule scriptRuntime() {
        return new PatternClassificationRule("script-runtime", SCRIPT_RUNTIME_ERROR, List.of(
                "syntaxerror",
                "typeerror",
                "referenceerror",
                "nameerror",
                "attributeerror",
                "indentationerror",
                "traceback",
                "uncaught",
                "is not a function",
                "is not defined"),
                0.75,
                "Automation code raised an error",
                "Fix the syntax or the API usage of the failing statement; check that every variable is defined " +
                        "before use; use the documented browser automation API");
    }
}
