package it.aw.docorganizer.model;

/**
 * Esito dell'applicazione di un suggerimento.
 */
public enum ApplyOutcome {

    /** File spostato, copia marcata ORGANIZED. */
    APPLIED,
    /** Il file era già nella destinazione: solo aggiornamento dello stato. */
    ALREADY_IN_PLACE,
    /** Destinazione occupata con politica SKIP: nulla è cambiato. */
    CONFLICT,
    /** Il file sorgente non esiste più: nulla è cambiato. */
    SOURCE_MISSING,
    /** Errore durante l'applicazione massiva (dettaglio nel messaggio). */
    FAILED
}
