package it.aw.docorganizer.service;

/**
 * Richiesta di organizzazione non eseguibile: suggerimento o copia inesistenti,
 * suggerimento orfano.
 */
public class OrganizationException extends RuntimeException {

    public enum Reason { NOT_FOUND, ORPHANED }

    private final Reason reason;

    public OrganizationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    static OrganizationException pendingNotFound(String pendingOperationId) {
        return new OrganizationException(Reason.NOT_FOUND, "Suggerimento inesistente: " + pendingOperationId);
    }

    static OrganizationException copyNotFound(String copyId) {
        return new OrganizationException(Reason.NOT_FOUND, "Copia inesistente: " + copyId);
    }

    static OrganizationException orphaned(String pendingOperationId) {
        return new OrganizationException(Reason.ORPHANED,
                "Il suggerimento " + pendingOperationId + " non è più collegato a una copia");
    }

    public Reason getReason() {
        return reason;
    }
}
