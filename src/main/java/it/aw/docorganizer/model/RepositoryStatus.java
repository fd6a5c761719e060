package it.aw.docorganizer.model;

/**
 * Riepilogo dello stato di organizzazione di un repository.
 */
public record RepositoryStatus(
        String repositoryPath,
        int    unorganized,
        int    organized,
        int    ignored,
        int    pendingOperations,
        int    duplicateGroups
) {
    public int totalCopies() {
        return unorganized + organized + ignored;
    }
}
