package it.aw.docorganizer.model;

import java.time.LocalDateTime;

/**
 * Suggerimento di riorganizzazione non ancora applicato.
 * <p>
 * Al massimo uno per copia: un nuovo suggerimento sostituisce il precedente.
 * {@code documentCopyId} diventa {@code null} se la copia viene eliminata.
 */
public record PendingOperation(
        String        id,
        String        documentCopyId,
        String        suggestedDirectoryPath,  // relativa alla radice, può essere vuota
        String        suggestedFilename,
        String        reason,
        double        confidence,              // 0.0 - 1.0
        String        promptHash,              // identifica la richiesta che l'ha prodotto
        String        documentContentHash,     // hash del contenuto al momento del suggerimento
        String        modelName,
        LocalDateTime createdAt
) {
    /** Destinazione relativa nella forma {@code dir/filename} (o solo filename). */
    public String targetRelativePath() {
        if (suggestedDirectoryPath == null || suggestedDirectoryPath.isEmpty()) {
            return suggestedFilename;
        }
        return suggestedDirectoryPath + "/" + suggestedFilename;
    }
}
