package it.aw.docorganizer.model;

/**
 * Stato di organizzazione di una copia.
 * <p>
 * Persistito come stringa fissa (il nome della costante); in lettura
 * un valore sconosciuto viene rifiutato.
 */
public enum OrganizationStatus {

    /** Serve ancora una decisione. */
    UNORGANIZED,
    /** Spostata secondo un suggerimento applicato. */
    ORGANIZED,
    /** L'utente ha escluso il file dall'organizzazione. */
    IGNORED;

    public String dbValue() {
        return name();
    }

    public static OrganizationStatus fromDbValue(String value) {
        if (value != null) {
            for (OrganizationStatus s : values()) {
                if (s.name().equals(value)) return s;
            }
        }
        throw new IllegalArgumentException("Stato di organizzazione sconosciuto: " + value);
    }
}
