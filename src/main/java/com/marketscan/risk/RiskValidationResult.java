package com.marketscan.risk;

import java.util.List;

/**
 * Outcome of the pre-entry gate. An empty violation list means the entry may proceed.
 */
public record RiskValidationResult(List<RiskViolation> violations) {

    private static final RiskValidationResult APPROVED = new RiskValidationResult(List.of());

    public RiskValidationResult {
        violations = List.copyOf(violations);
    }

    public static RiskValidationResult approved() {
        return APPROVED;
    }

    public static RiskValidationResult rejected(List<RiskViolation> violations) {
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("A rejection needs at least one violation");
        }
        return new RiskValidationResult(violations);
    }

    public boolean isApproved() {
        return violations.isEmpty();
    }

    public boolean isRejected() {
        return !violations.isEmpty();
    }

    public boolean breached(RiskViolation.Kind kind) {
        return violations.stream().anyMatch(v -> v.kind() == kind);
    }
}
