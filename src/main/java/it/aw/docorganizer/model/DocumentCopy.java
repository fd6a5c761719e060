package it.aw.docorganizer.model;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Istanza fisica di un {@link Document}: un file in una posizione precisa
 * di un repository.
 * <p>
 * La coppia {@code (repositoryPath, filePath)} è univoca. I campi {@code stored*}
 * sono la cache dei metadati del file system usata per evitare il re-hash
 * dei file non modificati.
 */
public record DocumentCopy(
        String             id,
        String             documentId,
        String             repositoryPath,        // radice assoluta del repository
        String             filePath,              // percorso relativo alla radice
        String             storedContentHash,
        Long               storedSize,
        Long               storedMtime,           // epoch in microsecondi
        OrganizationStatus organizationStatus,
        String             acceptedOperationId,   // operazione che ha organizzato la copia
        LocalDateTime      lastSeenAt,
        LocalDateTime      createdAt,
        LocalDateTime      updatedAt
) {
    /** Percorso assoluto del file sul disco. */
    public Path absolutePath() {
        return Path.of(repositoryPath).resolve(filePath);
    }
}
