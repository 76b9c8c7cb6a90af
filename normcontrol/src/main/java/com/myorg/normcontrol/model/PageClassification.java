package com.myorg.normcontrol.model;

/**
 * Classifier output for one page: a role and a heuristic score in {@code [0, 1]}.
 */
public record PageClassification(PageRole role, double confidence) {

    public PageClassification {
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
