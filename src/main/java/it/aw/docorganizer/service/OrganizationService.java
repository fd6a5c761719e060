package it.aw.docorganizer.service;

import it.aw.docorganizer.fileops.FileMover;
import it.aw.docorganizer.fileops.MoveResult;
import it.aw.docorganizer.model.*;
import it.aw.docorganizer.registry.DocumentStore;
import it.aw.docorganizer.security.PathValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Applica, rifiuta e gestisce i suggerimenti di organizzazione.
 * <p>
 * Applicazione di un suggerimento:
 * <ol>
 *   <li>Validazione della destinazione (dentro il repository, componenti sicuri)</li>
 *   <li>Validazione della sorgente</li>
 *   <li>Spostamento con la politica di conflitto richiesta</li>
 *   <li>In un'unica transazione: copia ri-localizzata e marcata ORGANIZED,
 *       operazione ACCEPTED nello storico, suggerimento eliminato</li>
 * </ol>
 * Conflitti e sorgenti mancanti non modificano nulla. Se la transazione fallisce dopo
 * lo spostamento, il file viene riportato nella posizione originale.
 */
@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    private final DocumentStore store;
    private final FileMover mover;

    public OrganizationService(DocumentStore store, FileMover mover) {
        this.store = store;
        this.mover = mover;
    }

    // -------------------------------------------------------------------------
    // Suggerimenti
    // -------------------------------------------------------------------------

    /**
     * Registra il suggerimento del motore esterno per una copia, sostituendo il precedente.
     * I componenti del percorso vengono validati subito.
     */
    public PendingOperation suggest(SuggestionRequest request) {
        DocumentCopy copy = store.findCopyById(request.documentCopyId())
                .orElseThrow(() -> OrganizationException.copyNotFound(request.documentCopyId()));
        PathValidator.validatePathComponent(request.suggestedDirectoryPath(), true);
        PathValidator.validatePathComponent(request.suggestedFilename(), false);
        String documentHash = store.findDocumentById(copy.documentId())
                .map(Document::contentHash)
                .orElse(null);
        PendingOperation pending = store.savePendingOperation(request, documentHash);
        log.debug("Suggerimento salvato per {}: {}", copy.filePath(), pending.targetRelativePath());
        return pending;
    }

    public List<PendingOperation> findPendingOperations(String repositoryPath) {
        return store.findPendingOperations(RepositoryPaths.canonical(repositoryPath));
    }

    public List<Operation> findOperations(String repositoryPath) {
        return store.findOperations(RepositoryPaths.canonical(repositoryPath));
    }

    /**
     * Applica un suggerimento pendente.
     *
     * @throws OrganizationException                                suggerimento inesistente o orfano
     * @throws it.aw.docorganizer.security.PathSecurityException    destinazione o sorgente non sicure
     * @throws it.aw.docorganizer.fileops.FileOperationException    errore di I/O durante lo spostamento
     */
    public ApplyResult apply(String pendingOperationId, ConflictResolution resolution) {
        PendingOperation pending = store.findPendingOperation(pendingOperationId)
                .orElseThrow(() -> OrganizationException.pendingNotFound(pendingOperationId));
        if (pending.documentCopyId() == null) {
            throw OrganizationException.orphaned(pendingOperationId);
        }
        DocumentCopy copy = store.findCopyById(pending.documentCopyId())
                .orElseThrow(() -> OrganizationException.orphaned(pendingOperationId));

        Path root = Path.of(copy.repositoryPath());
        Path target = PathValidator.validateTargetPath(root, pending.suggestedDirectoryPath(),
                pending.suggestedFilename());
        Path source = copy.absolutePath();
        PathValidator.validateRepositoryPath(source, root);

        // un percorso ancora assegnato a un'altra copia è occupato anche se il file non c'è più
        Optional<DocumentCopy> overwritten = resolution == ConflictResolution.OVERWRITE
                ? trackedCopyAt(copy, root, target)
                : Optional.empty();

        MoveResult move = mover.move(source, target, resolution, true,
                candidate -> trackedCopyAt(copy, root, candidate).isPresent());
        switch (move.outcome()) {
            case SOURCE_NOT_FOUND:
                log.warn("Suggerimento {}: file sorgente mancante {}", pendingOperationId, source);
                return new ApplyResult(pendingOperationId, ApplyOutcome.SOURCE_MISSING,
                        source.toString(), target.toString(), null, null,
                        "File sorgente inesistente: " + source);
            case CONFLICT:
                log.info("Suggerimento {}: destinazione occupata {}, nessuno spostamento", pendingOperationId, target);
                return new ApplyResult(pendingOperationId, ApplyOutcome.CONFLICT,
                        source.toString(), target.toString(), null, null,
                        "Destinazione già esistente: " + target);
            default:
                break;
        }

        // la riga della copia sovrascritta va eliminata prima che il suo percorso venga riusato
        overwritten.ifPresent(o -> {
            store.deleteCopy(o.id());
            log.info("Copia {} sovrascritta da {}, rimossa dal database", o.filePath(), copy.filePath());
        });

        String newFilePath = relativeTo(root, move.finalPath());
        Operation operation;
        try {
            operation = store.inTransaction(() -> {
                Operation op = store.recordOperation(pending, copy, OperationOutcome.ACCEPTED, newFilePath);
                store.relocateCopy(copy.id(), newFilePath, OrganizationStatus.ORGANIZED, op.id());
                store.deletePendingOperation(pending.id());
                return op;
            });
        } catch (RuntimeException e) {
            if (move.outcome() == MoveResult.Outcome.MOVED) {
                restore(move.finalPath(), source, e);
            }
            throw e;
        }

        ApplyOutcome outcome = move.outcome() == MoveResult.Outcome.UNCHANGED
                ? ApplyOutcome.ALREADY_IN_PLACE
                : ApplyOutcome.APPLIED;
        log.info("Suggerimento {} applicato: {} -> {}", pendingOperationId, copy.filePath(), newFilePath);
        return new ApplyResult(pendingOperationId, outcome, source.toString(), target.toString(),
                move.finalPath().toString(), operation, null);
    }

    /**
     * Applica in sequenza tutti i suggerimenti del repository. Gli errori di un
     * suggerimento sono riportati nel suo risultato e non interrompono gli altri.
     */
    public List<ApplyResult> applyAll(String repositoryPath, ConflictResolution resolution) {
        List<PendingOperation> pendings = findPendingOperations(repositoryPath);
        List<ApplyResult> results = new ArrayList<>(pendings.size());
        for (PendingOperation pending : pendings) {
            try {
                results.add(apply(pending.id(), resolution));
            } catch (RuntimeException e) {
                log.error("Applicazione del suggerimento {} fallita: {}", pending.id(), e.getMessage());
                results.add(new ApplyResult(pending.id(), ApplyOutcome.FAILED, null,
                        pending.targetRelativePath(), null, null, e.getMessage()));
            }
        }
        long applied = results.stream().filter(ApplyResult::applied).count();
        log.info("Applicazione massiva su {}: {}/{} suggerimenti applicati", repositoryPath, applied, results.size());
        return results;
    }

    /** Rifiuta un suggerimento: storico REJECTED, suggerimento eliminato, copia invariata. */
    public Operation reject(String pendingOperationId) {
        PendingOperation pending = store.findPendingOperation(pendingOperationId)
                .orElseThrow(() -> OrganizationException.pendingNotFound(pendingOperationId));
        if (pending.documentCopyId() == null) {
            throw OrganizationException.orphaned(pendingOperationId);
        }
        DocumentCopy copy = store.findCopyById(pending.documentCopyId())
                .orElseThrow(() -> OrganizationException.orphaned(pendingOperationId));
        Operation operation = store.inTransaction(() -> {
            Operation op = store.recordOperation(pending, copy, OperationOutcome.REJECTED, null);
            store.deletePendingOperation(pending.id());
            return op;
        });
        log.info("Suggerimento {} rifiutato per {}", pendingOperationId, copy.filePath());
        return operation;
    }

    // -------------------------------------------------------------------------
    // Stato delle copie
    // -------------------------------------------------------------------------

    /** Esclude la copia dall'organizzazione; l'eventuale suggerimento viene eliminato. */
    public DocumentCopy ignore(String copyId) {
        return changeStatus(copyId, OrganizationStatus.IGNORED);
    }

    /** Riporta la copia a UNORGANIZED; l'eventuale suggerimento viene eliminato. */
    public DocumentCopy unmark(String copyId) {
        return changeStatus(copyId, OrganizationStatus.UNORGANIZED);
    }

    private DocumentCopy changeStatus(String copyId, OrganizationStatus status) {
        store.findCopyById(copyId).orElseThrow(() -> OrganizationException.copyNotFound(copyId));
        DocumentCopy updated = store.inTransaction(() -> {
            store.deletePendingOperationsForCopy(copyId);
            return store.updateOrganizationStatus(copyId, status);
        });
        log.info("Copia {} marcata {}", updated.filePath(), status);
        return updated;
    }

    // -------------------------------------------------------------------------
    // Duplicati
    // -------------------------------------------------------------------------

    public List<DuplicateGroup> findDuplicates(String repositoryPath) {
        return store.findDuplicateGroups(RepositoryPaths.canonical(repositoryPath));
    }

    /**
     * Mantiene la prima copia di ogni gruppo di duplicati il cui file esiste ancora ed
     * elimina i file delle altre.
     * In dry run riporta soltanto cosa verrebbe eliminato.
     */
    public DedupeReport dedupe(String repositoryPath, boolean dryRun) {
        String repoKey = RepositoryPaths.canonical(repositoryPath);
        Path root = Path.of(repoKey);
        List<String> kept = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (DuplicateGroup group : store.findDuplicateGroups(repoKey)) {
            // si mantiene la prima copia ancora presente su disco
            Optional<DocumentCopy> keeper = group.copies().stream()
                    .filter(c -> Files.isRegularFile(c.absolutePath()))
                    .findFirst();
            if (keeper.isEmpty()) {
                log.warn("Duplicati di {}: nessuna copia presente su disco, gruppo saltato", group.contentHash());
                continue;
            }
            kept.add(keeper.get().filePath());
            for (DocumentCopy duplicate : group.copies()) {
                if (duplicate.id().equals(keeper.get().id())) {
                    continue;
                }
                Path file = duplicate.absolutePath();
                PathValidator.validateRepositoryPath(file, root);
                if (dryRun) {
                    deleted.add(duplicate.filePath());
                    continue;
                }
                try {
                    Files.deleteIfExists(file);
                    store.deleteCopy(duplicate.id());
                    deleted.add(duplicate.filePath());
                    log.info("Duplicato eliminato: {}", duplicate.filePath());
                } catch (IOException e) {
                    failed.add(duplicate.filePath());
                    log.warn("Impossibile eliminare il duplicato {}: {}", file, e.getMessage());
                }
            }
        }
        log.info("Deduplicazione {}{}: {} mantenuti, {} eliminati, {} falliti",
                repoKey, dryRun ? " (dry run)" : "", kept.size(), deleted.size(), failed.size());
        return new DedupeReport(dryRun, kept, deleted, failed);
    }

    /**
     * Destinazioni suggerite per due o più copie del repository, con le copie coinvolte.
     */
    public Map<String, List<DocumentCopy>> findTargetConflicts(String repositoryPath) {
        Map<String, List<DocumentCopy>> byTarget = new TreeMap<>();
        for (PendingOperation pending : findPendingOperations(repositoryPath)) {
            store.findCopyById(pending.documentCopyId()).ifPresent(copy ->
                    byTarget.computeIfAbsent(pending.targetRelativePath(), k -> new ArrayList<>()).add(copy));
        }
        byTarget.values().removeIf(copies -> copies.size() < 2);
        return byTarget;
    }

    // -------------------------------------------------------------------------
    // Riepiloghi
    // -------------------------------------------------------------------------

    public RepositoryStatus status(String repositoryPath) {
        String repoKey = RepositoryPaths.canonical(repositoryPath);
        Map<OrganizationStatus, Integer> counts = store.countByStatus(repoKey);
        return new RepositoryStatus(repoKey,
                counts.get(OrganizationStatus.UNORGANIZED),
                counts.get(OrganizationStatus.ORGANIZED),
                counts.get(OrganizationStatus.IGNORED),
                store.findPendingOperations(repoKey).size(),
                store.findDuplicateGroups(repoKey).size());
    }

    public StoreStats stats() {
        return new StoreStats(store.totalDocuments(), store.totalCopies(),
                store.totalPendingOperations(), store.totalOperations(), "DuckDB");
    }

    // -------------------------------------------------------------------------

    /**
     * Copia registrata sul percorso di destinazione (diversa da quella da spostare),
     * che il file esista ancora su disco o no.
     */
    private Optional<DocumentCopy> trackedCopyAt(DocumentCopy moving, Path root, Path target) {
        String relative = relativeTo(root, target);
        return store.findCopy(moving.repositoryPath(), relative)
                .filter(c -> !c.id().equals(moving.id()));
    }

    private static String relativeTo(Path root, Path file) {
        return PathValidator.resolve(root).relativize(file).toString().replace('\\', '/');
    }

    private void restore(Path movedTo, Path originalLocation, RuntimeException cause) {
        try {
            mover.move(movedTo, originalLocation, ConflictResolution.SKIP, true).orThrow();
            log.warn("Aggiornamento del database fallito: file riportato in {}", originalLocation);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("Impossibile riportare {} in {}: il file resta nella nuova posizione",
                    movedTo, originalLocation, e);
        }
    }
}
