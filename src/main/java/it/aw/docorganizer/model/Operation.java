package it.aw.docorganizer.model;

import java.time.LocalDateTime;

/**
 * Record storico di un suggerimento applicato o scartato.
 * <p>
 * {@code originalFilePath} e {@code originalRepositoryPath} sono una fotografia
 * presa alla creazione: non vengono mai ricalcolati dalla copia, così lo storico
 * sopravvive alla sua eliminazione.
 */
public record Operation(
        String           id,
        String           documentCopyId,          // null se la copia è stata eliminata
        OperationOutcome outcome,
        String           originalFilePath,
        String           originalRepositoryPath,
        String           suggestedDirectoryPath,
        String           suggestedFilename,
        String           finalFilePath,           // null per REJECTED
        String           reason,
        String           promptHash,
        LocalDateTime    createdAt,               // quando è stato prodotto il suggerimento
        LocalDateTime    decidedAt
) {}
