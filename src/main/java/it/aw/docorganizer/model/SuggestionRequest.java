package it.aw.docorganizer.model;

/**
 * Suggerimento prodotto dal motore esterno per una copia.
 */
public record SuggestionRequest(
        String documentCopyId,
        String suggestedDirectoryPath,
        String suggestedFilename,
        String reason,
        double confidence,
        String promptHash,
        String modelName
) {
    /** Costruttore compatto con validazione. */
    public SuggestionRequest {
        if (documentCopyId == null || documentCopyId.isBlank()) {
            throw new IllegalArgumentException("documentCopyId obbligatorio");
        }
        if (suggestedFilename == null || suggestedFilename.isBlank()) {
            throw new IllegalArgumentException("suggestedFilename obbligatorio");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "confidence deve essere compresa tra 0.0 e 1.0 (ricevuto: " + confidence + ")");
        }
        if (suggestedDirectoryPath == null) suggestedDirectoryPath = "";
        if (reason == null) reason = "";
        if (promptHash == null) promptHash = "";
    }
}
