package it.aw.docorganizer.model;

/**
 * Contatori di fine scansione.
 */
public record ScanSummary(
        String repositoryPath,
        int    totalFiles,
        int    newDocuments,
        int    duplicateDocuments,
        int    updatedDocuments,
        int    reusedCopies,
        int    extractionFailed,
        int    hashFailed,
        int    storeErrors,
        int    orphansRemoved
) {}
