package it.aw.docorganizer.service;

import it.aw.docorganizer.model.DocumentCopy;
import it.aw.docorganizer.model.ProcessingOutcome;
import it.aw.docorganizer.model.ScanRequest;
import it.aw.docorganizer.model.ScanSummary;
import it.aw.docorganizer.registry.DocumentStore;
import it.aw.docorganizer.registry.DocumentStoreException;
import it.aw.docorganizer.security.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scansione di un repository: scoperta dei file supportati, pulizia delle copie
 * orfane ed elaborazione sequenziale di ogni file con {@link DocumentProcessor}.
 */
@Service
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            ".pdf", ".docx", ".doc", ".pptx", ".ppt", ".xlsx", ".xls",
            ".txt", ".md", ".html", ".htm");

    static final Set<String> EXCLUDED_DIRECTORIES = Set.of(
            ".git", ".svn", ".hg", "__pycache__", "node_modules", ".venv", "venv", ".env",
            ".tox", "dist", "build", ".pytest_cache", ".mypy_cache", ".ruff_cache", ".docorganizer");

    private final DocumentStore store;
    private final DocumentProcessor processor;

    public RepositoryScanner(DocumentStore store, DocumentProcessor processor) {
        this.store = store;
        this.processor = processor;
    }

    /**
     * Scansiona il repository (o una sua parte) e aggiorna il database.
     *
     * @throws IllegalArgumentException se la radice non è una directory assoluta esistente
     *                                  o il percorso richiesto non esiste
     * @throws it.aw.docorganizer.security.PathSecurityException se il percorso è fuori dal repository
     */
    public ScanSummary scan(ScanRequest request) {
        String repoKey = RepositoryPaths.canonical(request.repositoryPath());
        Path root = Path.of(repoKey);
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Il repository non è una directory esistente: " + request.repositoryPath());
        }

        Path start = root;
        if (request.path() != null && !request.path().isBlank()) {
            Path requested = Path.of(request.path());
            start = requested.isAbsolute() ? requested : root.resolve(requested);
            PathValidator.validateRepositoryPath(start, root);
            start = PathValidator.resolve(start);
            if (!Files.exists(start)) {
                throw new IllegalArgumentException("Percorso da scansionare inesistente: " + request.path());
            }
        }

        log.info("Inizio scansione: {} (percorso={}, ricorsiva={}, rescan={})",
                repoKey, start, request.recursive(), request.rescan());

        int orphansRemoved = cleanupOrphans(repoKey);
        List<String> files = discover(root, start, request.recursive());
        log.debug("Scansione {}: {} file supportati trovati", repoKey, files.size());

        Counters counters = new Counters();
        for (String filePath : files) {
            try {
                ProcessingOutcome outcome = processor.process(repoKey, filePath, request.rescan());
                counters.add(outcome);
            } catch (DocumentStoreException e) {
                counters.storeErrors++;
                log.error("Errore database elaborando {}: {}", filePath, e.getMessage(), e);
            }
        }

        ScanSummary summary = new ScanSummary(repoKey, files.size(),
                counters.newDocuments, counters.duplicates, counters.updated, counters.reused,
                counters.extractionFailed, counters.hashFailed, counters.storeErrors, orphansRemoved);
        log.info("Scansione completata: {} — {} file, {} nuovi, {} duplicati, {} aggiornati, {} invariati, "
                        + "{} estrazioni fallite, {} hash falliti, {} errori database, {} orfani rimossi",
                repoKey, summary.totalFiles(), summary.newDocuments(), summary.duplicateDocuments(),
                summary.updatedDocuments(), summary.reusedCopies(), summary.extractionFailed(),
                summary.hashFailed(), summary.storeErrors(), summary.orphansRemoved());
        return summary;
    }

    /**
     * Elenca i file supportati sotto {@code start}, come percorsi relativi a {@code root}
     * ordinati. Le directory escluse non vengono visitate; quelle illeggibili vengono
     * saltate con un warning.
     */
    List<String> discover(Path root, Path start, boolean recursive) {
        List<String> found = new ArrayList<>();
        if (Files.isRegularFile(start)) {
            if (isSupported(start)) {
                found.add(toRelative(root, start));
            }
            return found;
        }
        try {
            Files.walkFileTree(start, Set.of(), recursive ? Integer.MAX_VALUE : 1, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(start) && EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && isSupported(file)) {
                        found.add(toRelative(root, file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Percorso non leggibile, saltato: {} ({})", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile esplorare " + start, e);
        }
        found.sort(null);
        return found;
    }

    /**
     * Elimina le copie del repository il cui file non esiste più; le altre ricevono
     * {@code last_seen_at} aggiornato.
     *
     * @return numero di copie eliminate
     */
    int cleanupOrphans(String repoKey) {
        LocalDateTime now = LocalDateTime.now();
        int removed = 0;
        for (DocumentCopy copy : store.findCopiesByRepository(repoKey)) {
            if (Files.isRegularFile(copy.absolutePath())) {
                store.touchLastSeen(copy.id(), now);
                continue;
            }
            boolean documentDeleted = store.deleteCopy(copy.id());
            removed++;
            log.info("Copia orfana rimossa: {}{}", copy.filePath(),
                    documentDeleted ? " (documento eliminato)" : "");
        }
        return removed;
    }

    static boolean isSupported(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && SUPPORTED_EXTENSIONS.contains(name.substring(dot));
    }

    private static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static final class Counters {
        int newDocuments;
        int duplicates;
        int updated;
        int reused;
        int extractionFailed;
        int hashFailed;
        int storeErrors;

        void add(ProcessingOutcome outcome) {
            switch (outcome.result()) {
                case NEW_DOCUMENT -> newDocuments++;
                case DUPLICATE_DOCUMENT -> duplicates++;
                case UPDATED_DOCUMENT -> updated++;
                case REUSED_COPY -> reused++;
                case EXTRACTION_FAILED -> extractionFailed++;
                case HASH_FAILED -> hashFailed++;
            }
        }
    }
}
