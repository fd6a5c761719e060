package it.aw.docorganizer.service;

import it.aw.docorganizer.model.Document;
import it.aw.docorganizer.model.DocumentCopy;
import it.aw.docorganizer.model.ProcessingOutcome;
import it.aw.docorganizer.model.ProcessingResult;
import it.aw.docorganizer.registry.DocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Elabora un singolo file scansionato e mantiene coerenti documenti e copie.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Lookup della copia per (repository, percorso)</li>
 *   <li>Short-circuit: dimensione e mtime invariati → nessun hash, REUSED_COPY</li>
 *   <li>Hash SHA-256 del contenuto (errore di I/O → HASH_FAILED, nessuna modifica)</li>
 *   <li>Hash invariato → aggiornamento della sola cache dei metadati</li>
 *   <li>Lookup del documento per hash; se nuovo, estrazione del testo</li>
 *   <li>Creazione della copia oppure ri-puntamento (file sovrascritto) con eliminazione
 *       del suggerimento pendente, in un'unica transazione</li>
 *   <li>Documento senza testo → EXTRACTION_FAILED, qualunque sia l'esito precedente</li>
 * </ol>
 * Unico componente che modifica documenti e copie a partire da una scansione.
 */
@Service
public class DocumentProcessor {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessor.class);

    private final DocumentStore store;
    private final ContentHasher hasher;
    private final TextExtractor extractor;

    public DocumentProcessor(DocumentStore store, ContentHasher hasher, TextExtractor extractor) {
        this.store = store;
        this.hasher = hasher;
        this.extractor = extractor;
    }

    /** Metadati del file usati per il controllo di obsolescenza. */
    record FileStat(long size, long mtime) {

        static FileStat of(Path file) throws IOException {
            BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
            if (!attrs.isRegularFile()) {
                throw new IOException("Non è un file regolare: " + file);
            }
            return new FileStat(attrs.size(), attrs.lastModifiedTime().to(TimeUnit.MICROSECONDS));
        }
    }

    /**
     * Elabora il file {@code repositoryPath/filePath}.
     *
     * @param repositoryPath radice assoluta (forma canonica)
     * @param filePath       percorso relativo alla radice
     * @param rescan         forza il calcolo dell'hash anche se i metadati sono invariati
     * @return copia e documento risolti con l'esito; in caso di HASH_FAILED i record
     *         precedenti, invariati
     */
    public ProcessingOutcome process(String repositoryPath, String filePath, boolean rescan) {
        Path fullPath = Path.of(repositoryPath).resolve(filePath);
        Optional<DocumentCopy> existing = store.findCopy(repositoryPath, filePath);
        Document currentDocument = existing
                .flatMap(c -> store.findDocumentById(c.documentId()))
                .orElse(null);

        FileStat stat;
        try {
            stat = FileStat.of(fullPath);
        } catch (IOException e) {
            log.warn("Impossibile leggere i metadati di {}: {}", fullPath, e.getMessage());
            return new ProcessingOutcome(existing.orElse(null), currentDocument, ProcessingResult.HASH_FAILED);
        }

        if (!rescan && existing.isPresent() && currentDocument != null
                && isUnchanged(existing.get(), currentDocument, stat)) {
            log.debug("{}: metadati invariati, copia riutilizzata senza hash", filePath);
            return finish(existing.get(), currentDocument, ProcessingResult.REUSED_COPY, false);
        }

        String contentHash;
        try {
            contentHash = hasher.hash(fullPath);
        } catch (IOException e) {
            log.warn("Calcolo hash fallito per {}: {}", fullPath, e.getMessage());
            return new ProcessingOutcome(existing.orElse(null), currentDocument, ProcessingResult.HASH_FAILED);
        }

        if (existing.isPresent() && currentDocument != null
                && contentHash.equals(currentDocument.contentHash())) {
            DocumentCopy refreshed = store.updateCopyMetadata(existing.get().id(), contentHash, stat.size(), stat.mtime());
            log.debug("{}: contenuto invariato (hash {}), aggiornata la cache dei metadati",
                    filePath, shortHash(contentHash));
            return finish(refreshed, currentDocument, ProcessingResult.REUSED_COPY, false);
        }

        // l'estrazione può essere lenta: avviene fuori dalla transazione
        boolean extractionAttempted = false;
        String extracted = null;
        if (store.findDocumentByHash(contentHash).isEmpty()) {
            extracted = extractor.extract(fullPath).orElse(null);
            extractionAttempted = true;
            if (extracted == null) {
                log.warn("{}: estrazione del contenuto fallita", filePath);
            } else {
                log.debug("{}: estratti {} caratteri", filePath, extracted.length());
            }
        }
        String content = extracted;

        ProcessingOutcome outcome = store.inTransaction(() -> {
            boolean created = false;
            Document document = store.findDocumentByHash(contentHash).orElse(null);
            if (document == null) {
                document = store.insertDocument(contentHash, content);
                created = true;
            }

            if (existing.isEmpty()) {
                DocumentCopy copy = store.insertCopy(document.id(), repositoryPath, filePath,
                        contentHash, stat.size(), stat.mtime());
                ProcessingResult result = created ? ProcessingResult.NEW_DOCUMENT : ProcessingResult.DUPLICATE_DOCUMENT;
                log.debug("{}: {} (hash {})", filePath, result, shortHash(contentHash));
                return new ProcessingOutcome(copy, document, result);
            }

            DocumentCopy copy = store.repointCopy(existing.get().id(), document.id(),
                    contentHash, stat.size(), stat.mtime());
            int stale = store.deletePendingOperationsForCopy(copy.id());
            log.info("{}: contenuto cambiato, copia spostata sul documento {} ({} suggerimenti obsoleti eliminati)",
                    filePath, document.id(), stale);
            return new ProcessingOutcome(copy, document, ProcessingResult.UPDATED_DOCUMENT);
        });

        return finish(outcome.copy(), outcome.document(), outcome.result(), extractionAttempted);
    }

    /**
     * I metadati in cache valgono solo se anche l'hash memorizzato coincide con quello
     * del documento: una divergenza forza il ricalcolo.
     */
    private static boolean isUnchanged(DocumentCopy copy, Document document, FileStat stat) {
        return document.contentHash().equals(copy.storedContentHash())
                && copy.storedSize() != null && copy.storedSize() == stat.size()
                && copy.storedMtime() != null && copy.storedMtime() == stat.mtime();
    }

    /**
     * Se il documento è ancora senza testo ritenta l'estrazione (una volta per scansione)
     * e, se fallisce di nuovo, riporta EXTRACTION_FAILED.
     */
    private ProcessingOutcome finish(DocumentCopy copy, Document document, ProcessingResult result,
                                     boolean extractionAttempted) {
        Document resolved = document;
        if (!resolved.hasContent() && !extractionAttempted) {
            Optional<String> content = extractor.extract(copy.absolutePath());
            if (content.isPresent()) {
                resolved = store.updateDocumentContent(resolved.id(), content.get());
                log.info("{}: testo recuperato al nuovo tentativo ({} caratteri)",
                        copy.filePath(), content.get().length());
            }
        }
        if (!resolved.hasContent()) {
            return new ProcessingOutcome(copy, resolved, ProcessingResult.EXTRACTION_FAILED);
        }
        return new ProcessingOutcome(copy, resolved, result);
    }

    private static String shortHash(String hash) {
        return hash.substring(0, Math.min(8, hash.length())) + "...";
    }
}
