package it.aw.docorganizer.security;

/**
 * Il percorso suggerito non è valido oppure esce dal repository.
 * <p>
 * Sollevata prima di qualsiasi modifica: il chiamante può scartare il suggerimento
 * o sceglierne un altro.
 */
public class PathSecurityException extends RuntimeException {

    public PathSecurityException(String message) {
        super(message);
    }

    public PathSecurityException(String message, Throwable cause) {
        super(message, cause);
    }
}
