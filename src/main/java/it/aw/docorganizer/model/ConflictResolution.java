package it.aw.docorganizer.model;

/**
 * Politica da adottare quando il file di destinazione esiste già.
 */
public enum ConflictResolution {

    /** Nessuno spostamento, entrambi i file restano invariati. */
    SKIP,
    /** Il file di destinazione viene sostituito. */
    OVERWRITE,
    /** Il file viene spostato su un nome libero: {@code nome_1.ext}, {@code nome_2.ext}, ... */
    RENAME
}
