package it.aw.docorganizer.model;

/**
 * Esito storico di un suggerimento: applicato oppure scartato.
 */
public enum OperationOutcome {

    ACCEPTED,
    REJECTED;

    public String dbValue() {
        return name();
    }

    public static OperationOutcome fromDbValue(String value) {
        if (value != null) {
            for (OperationOutcome o : values()) {
                if (o.name().equals(value)) return o;
            }
        }
        throw new IllegalArgumentException("Esito operazione sconosciuto: " + value);
    }
}
