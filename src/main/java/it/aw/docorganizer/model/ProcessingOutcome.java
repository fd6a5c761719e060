package it.aw.docorganizer.model;

/**
 * Risultato di {@code DocumentProcessor.process}: la copia e il documento
 * risolti (eventualmente {@code null} in caso di errore) più l'esito.
 */
public record ProcessingOutcome(
        DocumentCopy     copy,
        Document         document,
        ProcessingResult result
) {}
