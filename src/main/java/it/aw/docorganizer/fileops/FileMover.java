package it.aw.docorganizer.fileops;

import it.aw.docorganizer.model.ConflictResolution;
import it.aw.docorganizer.security.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Predicate;

/**
 * Sposta un singolo file verso una destinazione già validata, applicando
 * la politica di conflitto richiesta.
 * <p>
 * Tocca solo il file system: l'aggiornamento del database è responsabilità del chiamante,
 * da fare solo dopo uno spostamento riuscito.
 */
@Component
public class FileMover {

    private static final Logger log = LoggerFactory.getLogger(FileMover.class);

    /**
     * Sposta {@code source} su {@code target}.
     *
     * @param source     file da spostare, deve esistere ed essere un file regolare
     * @param target     destinazione assoluta
     * @param resolution politica se la destinazione esiste già
     * @param createDirs crea le directory mancanti della destinazione
     * @return esito con il percorso effettivamente usato (diverso da target con RENAME)
     * @throws FileMovePermissionException permessi insufficienti
     * @throws FileOperationException      qualsiasi altro errore di I/O
     */
    public MoveResult move(Path source, Path target, ConflictResolution resolution, boolean createDirs) {
        return move(source, target, resolution, createDirs, p -> false);
    }

    /**
     * Come {@link #move(Path, Path, ConflictResolution, boolean)}, ma i percorsi per cui
     * {@code reserved} è vero sono considerati occupati anche se non esistono su disco
     * (es. ancora assegnati a un'altra copia nel database).
     */
    public MoveResult move(Path source, Path target, ConflictResolution resolution, boolean createDirs,
                           Predicate<Path> reserved) {
        if (!Files.isRegularFile(source)) {
            return MoveResult.sourceNotFound(source, target);
        }
        if (!target.isAbsolute()) {
            throw new FileOperationException("La destinazione deve essere un percorso assoluto: " + target);
        }

        Path resolvedTarget = PathValidator.resolve(target);
        try {
            Path resolvedSource = source.toRealPath();
            if (resolvedSource.equals(resolvedTarget)) {
                log.debug("Spostamento no-op: {} è già nella destinazione", resolvedSource);
                return MoveResult.unchanged(resolvedTarget);
            }

            Path parent = resolvedTarget.getParent();
            if (createDirs) {
                Files.createDirectories(parent);
            } else if (!Files.isDirectory(parent)) {
                throw new FileOperationException("La directory di destinazione non esiste: " + parent);
            }

            Path finalTarget = resolvedTarget;
            boolean onDisk = Files.exists(resolvedTarget, LinkOption.NOFOLLOW_LINKS);
            if (onDisk || reserved.test(resolvedTarget)) {
                switch (resolution) {
                    case SKIP:
                        log.debug("Conflitto su {}: politica SKIP, nessuno spostamento", resolvedTarget);
                        return MoveResult.conflict(resolvedSource, resolvedTarget);
                    case OVERWRITE:
                        if (Files.isDirectory(resolvedTarget, LinkOption.NOFOLLOW_LINKS)) {
                            throw new FileOperationException(
                                    "La destinazione è una directory, impossibile sovrascriverla: " + resolvedTarget);
                        }
                        if (onDisk) {
                            Files.delete(resolvedTarget);
                        }
                        break;
                    case RENAME:
                        finalTarget = uniqueSibling(resolvedTarget, reserved);
                        break;
                }
            }

            transfer(source, finalTarget);
            log.info("File spostato: {} -> {}", source, finalTarget);
            return MoveResult.moved(resolvedSource, resolvedTarget, finalTarget);
        } catch (AccessDeniedException e) {
            throw new FileMovePermissionException(
                    "Permesso negato spostando " + source + " in " + target + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FileOperationException(
                    "Impossibile spostare " + source + " in " + target + ": " + e.getMessage(), e);
        }
    }

    /**
     * Primo nome libero nella stessa directory aggiungendo {@code _1}, {@code _2}, ...
     * prima dell'estensione: {@code file.pdf -> file_1.pdf}.
     */
    static Path uniqueSibling(Path path) {
        return uniqueSibling(path, p -> false);
    }

    static Path uniqueSibling(Path path, Predicate<Path> reserved) {
        Predicate<Path> taken = p -> Files.exists(p, LinkOption.NOFOLLOW_LINKS) || reserved.test(p);
        if (!taken.test(path)) {
            return path;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = name;
        String suffix = "";
        if (dot > 0 && dot < name.length() - 1) {
            stem = name.substring(0, dot);
            suffix = name.substring(dot);
        }
        Path parent = path.getParent();
        for (int counter = 1; ; counter++) {
            Path candidate = parent.resolve(stem + "_" + counter + suffix);
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
    }

    // rename atomico se possibile, altrimenti copia + cancellazione (file system diversi)
    private static void transfer(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Rename atomico non supportato tra {} e {}, uso copia + cancellazione", source, target);
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
            Files.delete(source);
        }
    }
}
