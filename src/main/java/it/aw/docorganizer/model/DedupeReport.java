package it.aw.docorganizer.model;

import java.util.List;

/**
 * Esito di una deduplicazione: copie mantenute e file rimossi (o da rimuovere in dry run).
 */
public record DedupeReport(
        boolean      dryRun,
        List<String> keptPaths,
        List<String> deletedPaths,
        List<String> failedPaths
) {}
