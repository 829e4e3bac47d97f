package com.frontline.core.domain.errors;

import java.util.List;

/**
 * World definition that must never reach the live store: broken hierarchy,
 * asymmetric cross-links, out of range authoring values.
 */
public class GraphConsistencyException extends RuntimeException {

    private final List<String> problems;

    public GraphConsistencyException(List<String> problems) {
        super(buildMessage(problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    private static String buildMessage(List<String> problems) {
        if (problems == null || problems.isEmpty()) return "Invalid world definition";
        if (problems.size() == 1) return "Invalid world definition: " + problems.get(0);
        return "Invalid world definition (" + problems.size() + " problems): " + problems.get(0) + " ...";
    }
}
