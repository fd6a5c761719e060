package it.aw.docorganizer.fileops;

import java.nio.file.Path;

/**
 * Esito di {@link FileMover#move}.
 * <p>
 * I casi attesi (sorgente mancante, conflitto con SKIP) sono valori, non eccezioni;
 * {@link #orThrow()} li converte per chi preferisce la gestione a eccezioni.
 *
 * @param outcome   esito
 * @param source    sorgente risolta (quella richiesta se non esiste)
 * @param target    destinazione richiesta, risolta
 * @param finalPath percorso effettivo del file dopo l'operazione ({@code null} se non spostato)
 */
public record MoveResult(Outcome outcome, Path source, Path target, Path finalPath) {

    public enum Outcome {
        MOVED,
        UNCHANGED,
        SOURCE_NOT_FOUND,
        CONFLICT
    }

    static MoveResult moved(Path source, Path target, Path finalPath) {
        return new MoveResult(Outcome.MOVED, source, target, finalPath);
    }

    static MoveResult unchanged(Path path) {
        return new MoveResult(Outcome.UNCHANGED, path, path, path);
    }

    static MoveResult sourceNotFound(Path source, Path target) {
        return new MoveResult(Outcome.SOURCE_NOT_FOUND, source, target, null);
    }

    static MoveResult conflict(Path source, Path target) {
        return new MoveResult(Outcome.CONFLICT, source, target, null);
    }

    /** {@code true} se il file si trova ora in {@link #finalPath()}. */
    public boolean completed() {
        return outcome == Outcome.MOVED || outcome == Outcome.UNCHANGED;
    }

    /**
     * Restituisce il percorso finale oppure solleva l'eccezione corrispondente all'esito.
     *
     * @throws SourceNotFoundException se la sorgente non esiste
     * @throws FileConflictException   se la destinazione era occupata
     */
    public Path orThrow() {
        switch (outcome) {
            case SOURCE_NOT_FOUND:
                throw new SourceNotFoundException(source);
            case CONFLICT:
                throw new FileConflictException(source, target);
            default:
                return finalPath;
        }
    }
}
