package it.aw.docorganizer.model;

/**
 * Risultato di {@code OrganizationService.apply}.
 * <p>
 * {@code operation} è valorizzata solo per APPLIED e ALREADY_IN_PLACE.
 */
public record ApplyResult(
        String       pendingOperationId,
        ApplyOutcome outcome,
        String       sourcePath,
        String       targetPath,
        String       finalPath,
        Operation    operation,
        String       message
) {
    public boolean applied() {
        return outcome == ApplyOutcome.APPLIED || outcome == ApplyOutcome.ALREADY_IN_PLACE;
    }
}
