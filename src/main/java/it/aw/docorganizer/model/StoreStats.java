package it.aw.docorganizer.model;

/**
 * Statistiche aggregate sul database dei documenti.
 */
public record StoreStats(
        int    totalDocuments,
        int    totalCopies,
        int    pendingOperations,
        int    operations,
        String storeType
) {}
