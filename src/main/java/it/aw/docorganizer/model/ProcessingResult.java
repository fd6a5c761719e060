package it.aw.docorganizer.model;

/**
 * Esito dell'elaborazione di un singolo file durante una scansione.
 */
public enum ProcessingResult {

    /** Primo file visto con questo contenuto: creati documento e copia. */
    NEW_DOCUMENT,
    /** Il file è stato sovrascritto: la copia punta ora a un altro documento. */
    UPDATED_DOCUMENT,
    /** Nuova posizione di un contenuto già noto. */
    DUPLICATE_DOCUMENT,
    /** Copia esistente e contenuto invariato. */
    REUSED_COPY,
    /** Il testo del documento non è disponibile (estrazione fallita). */
    EXTRACTION_FAILED,
    /** Impossibile leggere il file per calcolarne l'hash. */
    HASH_FAILED
}
