package it.aw.docorganizer.registry;

/**
 * Errore di accesso al database dei documenti.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
