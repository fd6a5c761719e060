package it.aw.docorganizer.model;

import java.time.LocalDateTime;

/**
 * Documento canonico, identificato dal contenuto.
 * <p>
 * Esiste un solo Document per ogni {@code contentHash} distinto, indipendentemente
 * da quanti file sul disco ne contengano i byte. {@code content} è il testo estratto:
 * {@code null} significa estrazione mai tentata oppure fallita.
 */
public record Document(
        String        id,
        String        contentHash,   // SHA-256 esadecimale dell'intero file
        String        content,       // testo estratto, nullable
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public boolean hasContent() {
        return content != null;
    }
}
