package com.entity.linker.core.model;

/**
 * Informational record of a match that was superseded because its source entity
 * already had a higher-confidence match.
 *
 * @param sourceId             the contested source entity
 * @param acceptedTargetId     target of the retained decision
 * @param supersededTargetId   target of the suppressed decision
 * @param acceptedConfidence   confidence of the retained decision, may be {@code null}
 * @param supersededConfidence confidence of the suppressed decision, may be {@code null}
 */
public record PairConflictWarning(
        String sourceId,
        String acceptedTargetId,
        String supersededTargetId,
        Double acceptedConfidence,
        Double supersededConfidence
) {
}
