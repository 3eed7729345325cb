package com.example.audiobooksync.domain.enumtype;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of an import job. A job moves forward through
 * {@code IMPORTING -> ENRICHING -> ORGANIZING -> COMPLETED}; {@code CANCELED} and
 * {@code FAILED} are reachable from any non-terminal phase.
 */
public enum JobPhase {

    IMPORTING,

    ENRICHING,

    ORGANIZING,

    COMPLETED,

    CANCELED,

    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED || this == FAILED;
    }

    public boolean canTransitionTo(JobPhase next) {
        return next != null && allowedNext().contains(next);
    }

    /**
     * Phases this phase may hand over to. Optional phases may be skipped, so
     * {@code IMPORTING} can go straight to {@code ORGANIZING} or {@code COMPLETED}.
     */
    public Set<JobPhase> allowedNext() {
        switch (this) {
            case IMPORTING:
                return EnumSet.of(ENRICHING, ORGANIZING, COMPLETED, CANCELED, FAILED);
            case ENRICHING:
                return EnumSet.of(ORGANIZING, COMPLETED, CANCELED, FAILED);
            case ORGANIZING:
                return EnumSet.of(COMPLETED, CANCELED, FAILED);
            default:
                return Collections.emptySet();
        }
    }

    /**
     * Resolves a persisted phase name, returning {@code null} for blank or unknown values.
     */
    public static JobPhase fromName(String name) {
        if (name == null || name.trim().isEmpty()) {
            return null;
        }
        for (JobPhase phase : values()) {
            if (phase.name().equalsIgnoreCase(name.trim())) {
                return phase;
            }
        }
        return null;
    }
}
