package com.healer.remediator.diagnosis;

import java.util.Optional;

/**
 * One classification rule. The engine asks rules in order and takes the
 * first non-empty answer.
 *
 * Implementations must be pure: no I/O, no shared mutable state.
 */
public interface DiagnosisRule {

    String name();

    Optional<Diagnosis> match(DiagnosisContext context);
}
