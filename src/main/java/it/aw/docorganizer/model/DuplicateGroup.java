package it.aw.docorganizer.model;

import java.util.List;

/**
 * Copie dello stesso documento presenti in un repository (almeno due).
 */
public record DuplicateGroup(
        String             documentId,
        String             contentHash,
        List<DocumentCopy> copies       // ordinate per data di creazione
) {}
