package it.aw.docorganizer.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Forma canonica della radice di un repository, usata come chiave nel database.
 */
public final class RepositoryPaths {

    private RepositoryPaths() {}

    /**
     * Percorso reale della radice (symlink risolti). Se la directory non esiste più
     * si usa la forma normalizzata, così le interrogazioni sui dati storici funzionano ancora.
     *
     * @throws IllegalArgumentException se il percorso non è assoluto
     */
    public static String canonical(String repositoryPath) {
        if (repositoryPath == null || repositoryPath.isBlank()) {
            throw new IllegalArgumentException("repositoryPath obbligatorio");
        }
        Path path = Path.of(repositoryPath);
        if (!path.isAbsolute()) {
            throw new IllegalArgumentException("Il percorso del repository deve essere assoluto: " + repositoryPath);
        }
        try {
            return path.toRealPath().toString();
        } catch (IOException e) {
            return path.normalize().toString();
        }
    }
}
