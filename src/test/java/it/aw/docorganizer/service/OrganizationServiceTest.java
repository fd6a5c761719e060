package it.aw.docorganizer.service;

import it.aw.docorganizer.fileops.FileMover;
import it.aw.docorganizer.model.*;
import it.aw.docorganizer.registry.DocumentStore;
import it.aw.docorganizer.registry.DocumentStoreException;
import it.aw.docorganizer.security.PathSecurityException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class OrganizationServiceTest {

    @TempDir
    Path tmp;

    private Path repo;
    private String repoKey;
    private DocumentStore store;
    private RepositoryScanner scanner;
    private OrganizationService service;

    @BeforeEach
    void setUp() throws Exception {
        repo = Files.createDirectories(tmp.resolve("r")).toRealPath();
        repoKey = repo.toString();
        store = new DocumentStore(tmp.resolve("db.duckdb").toString());
        store.init();
        TextExtractor extractor = file -> Optional.of("testo di " + file.getFileName());
        DocumentProcessor processor = new DocumentProcessor(store, new ContentHasher(ContentHasher.DEFAULT_BUFFER_SIZE), extractor);
        scanner = new RepositoryScanner(store, processor);
        service = new OrganizationService(store, new FileMover());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void appliesSuggestionIntoNewDirectory() throws IOException {
        write("a.pdf", "X");
        scanner.scan(ScanRequest.of(repoKey));
        DocumentCopy copy = copyAt("a.pdf");
        assertThat(copy.organizationStatus()).isEqualTo(OrganizationStatus.UNORGANIZED);
        PendingOperation pending = service.suggest(
                new SuggestionRequest(copy.id(), "Fin/2024", "inv.pdf", "fattura", 0.9, "prompt", "modello"));

        ApplyResult result = service.apply(pending.id(), ConflictResolution.OVERWRITE);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(repo.resolve("Fin/2024/inv.pdf")).hasContent("X");
        assertThat(repo.resolve("a.pdf")).doesNotExist();

        DocumentCopy moved = store.findCopyById(copy.id()).orElseThrow();
        assertThat(moved.filePath()).isEqualTo("Fin/2024/inv.pdf");
        assertThat(moved.organizationStatus()).isEqualTo(OrganizationStatus.ORGANIZED);
        assertThat(moved.acceptedOperationId()).isEqualTo(result.operation().id());
        assertThat(moved.documentId()).isEqualTo(copy.documentId());

        assertThat(store.findOperations(repoKey)).singleElement().satisfies(op -> {
            assertThat(op.outcome()).isEqualTo(OperationOutcome.ACCEPTED);
            assertThat(op.originalFilePath()).isEqualTo("a.pdf");
            assertThat(op.originalRepositoryPath()).isEqualTo(repoKey);
            assertThat(op.finalFilePath()).isEqualTo("Fin/2024/inv.pdf");
            assertThat(op.documentCopyId()).isEqualTo(copy.id());
        });
        assertThat(store.findPendingOperation(pending.id())).isEmpty();
    }

    @Test
    void conflictWithSkipChangesNothing() throws IOException {
        write("a.pdf", "uno");
        write("dest/b.pdf", "due");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.SKIP);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.CONFLICT);
        assertThat(result.applied()).isFalse();
        assertThat(repo.resolve("a.pdf")).hasContent("uno");
        assertThat(repo.resolve("dest/b.pdf")).hasContent("due");
        assertThat(copyAt("a.pdf").organizationStatus()).isEqualTo(OrganizationStatus.UNORGANIZED);
        assertThat(store.findPendingOperation(pending.id())).isPresent();
        assertThat(store.totalOperations()).isZero();
    }

    @Test
    void renameRecordsActualFinalPath() throws IOException {
        write("a.pdf", "uno");
        write("dest/b.pdf", "due");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.RENAME);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(repo.resolve("dest/b_1.pdf")).hasContent("uno");
        assertThat(store.findCopy(repoKey, "dest/b_1.pdf")).isPresent();
        assertThat(result.operation().finalFilePath()).isEqualTo("dest/b_1.pdf");
    }

    @Test
    void overwriteOfTrackedFileRemovesItsCopy() throws IOException {
        write("a.pdf", "uno");
        write("dest/b.pdf", "due");
        scanner.scan(ScanRequest.of(repoKey));
        DocumentCopy replaced = copyAt("dest/b.pdf");
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.OVERWRITE);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(repo.resolve("dest/b.pdf")).hasContent("uno");
        assertThat(store.findCopyById(replaced.id())).isEmpty();
        assertThat(store.findDocumentById(replaced.documentId())).isEmpty();
        assertThat(copyAt("dest/b.pdf").organizationStatus()).isEqualTo(OrganizationStatus.ORGANIZED);
        assertThat(store.totalCopies()).isEqualTo(1);
    }

    @Test
    void fileAlreadyInPlaceIsMarkedOrganized() throws IOException {
        write("dest/a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("dest/a.pdf", "dest", "a.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.SKIP);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.ALREADY_IN_PLACE);
        assertThat(copyAt("dest/a.pdf").organizationStatus()).isEqualTo(OrganizationStatus.ORGANIZED);
    }

    @Test
    void missingSourceLeavesRecordsUntouched() throws IOException {
        Path file = write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "a.pdf");
        Files.delete(file);

        ApplyResult result = service.apply(pending.id(), ConflictResolution.SKIP);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.SOURCE_MISSING);
        assertThat(copyAt("a.pdf").organizationStatus()).isEqualTo(OrganizationStatus.UNORGANIZED);
        assertThat(store.findPendingOperation(pending.id())).isPresent();
    }

    @Test
    void escapingSuggestionIsRejectedWithoutSideEffects() throws IOException {
        write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        DocumentCopy copy = copyAt("a.pdf");
        // scritto direttamente nel database, come farebbe un motore esterno che non valida
        PendingOperation pending = store.savePendingOperation(
                new SuggestionRequest(copy.id(), "../../etc", "passwd", "", 0.1, "", null), null);

        assertThatThrownBy(() -> service.apply(pending.id(), ConflictResolution.OVERWRITE))
                .isInstanceOf(PathSecurityException.class);

        assertThat(repo.resolve("a.pdf")).hasContent("uno");
        assertThat(copyAt("a.pdf").organizationStatus()).isEqualTo(OrganizationStatus.UNORGANIZED);
        assertThat(store.findPendingOperation(pending.id())).isPresent();
        assertThat(store.totalOperations()).isZero();
    }

    @Test
    void suggestValidatesComponents() throws IOException {
        write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        DocumentCopy copy = copyAt("a.pdf");

        assertThatThrownBy(() -> service.suggest(
                new SuggestionRequest(copy.id(), "safe/../danger", "a.pdf", "", 0.5, "", null)))
                .isInstanceOf(PathSecurityException.class);
        assertThat(store.totalPendingOperations()).isZero();
    }

    @Test
    void storeFailureAfterMoveRestoresFile() throws IOException {
        write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");
        DocumentStore failingStore = spy(store);
        doThrow(new DocumentStoreException("disco pieno", null))
                .when(failingStore).relocateCopy(anyString(), anyString(), eq(OrganizationStatus.ORGANIZED), any());
        OrganizationService failing = new OrganizationService(failingStore, new FileMover());

        assertThatThrownBy(() -> failing.apply(pending.id(), ConflictResolution.SKIP))
                .isInstanceOf(DocumentStoreException.class);

        assertThat(repo.resolve("a.pdf")).hasContent("uno");
        assertThat(repo.resolve("dest/b.pdf")).doesNotExist();
        assertThat(store.totalOperations()).isZero();
        assertThat(store.findPendingOperation(pending.id())).isPresent();
    }

    @Test
    void rejectRecordsHistoryAndKeepsCopy() throws IOException {
        write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        Operation op = service.reject(pending.id());

        assertThat(op.outcome()).isEqualTo(OperationOutcome.REJECTED);
        assertThat(op.finalFilePath()).isNull();
        assertThat(store.findPendingOperation(pending.id())).isEmpty();
        assertThat(copyAt("a.pdf").organizationStatus()).isEqualTo(OrganizationStatus.UNORGANIZED);
        assertThat(repo.resolve("a.pdf")).exists();
    }

    @Test
    void unknownPendingOperationIsNotFound() {
        assertThatThrownBy(() -> service.apply("inesistente", ConflictResolution.SKIP))
                .isInstanceOf(OrganizationException.class)
                .satisfies(e -> assertThat(((OrganizationException) e).getReason())
                        .isEqualTo(OrganizationException.Reason.NOT_FOUND));
    }

    @Test
    void orphanedSuggestionCannotBeApplied() throws IOException {
        Path file = write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");
        Files.delete(file);
        scanner.scan(ScanRequest.of(repoKey));

        assertThatThrownBy(() -> service.reject(pending.id()))
                .isInstanceOf(OrganizationException.class)
                .satisfies(e -> assertThat(((OrganizationException) e).getReason())
                        .isEqualTo(OrganizationException.Reason.ORPHANED));
    }

    @Test
    void ignoreAndUnmarkToggleStatusWithoutMovingFiles() throws IOException {
        write("a.pdf", "uno");
        scanner.scan(ScanRequest.of(repoKey));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");
        String copyId = pending.documentCopyId();

        assertThat(service.ignore(copyId).organizationStatus()).isEqualTo(OrganizationStatus.IGNORED);
        assertThat(store.findPendingOperation(pending.id())).isEmpty();
        assertThat(service.unmark(copyId).organizationStatus()).isEqualTo(OrganizationStatus.UNORGANIZED);
        assertThat(repo.resolve("a.pdf")).exists();
        assertThatThrownBy(() -> service.ignore("inesistente")).isInstanceOf(OrganizationException.class);
    }

    @Test
    void applyAllContinuesPastFailures() throws IOException {
        write("a.pdf", "uno");
        write("b.pdf", "due");
        write("c.pdf", "tre");
        write("occupato/x.pdf", "quattro");
        scanner.scan(ScanRequest.of(repoKey));
        suggest("a.pdf", "ok", "a.pdf");
        suggest("b.pdf", "occupato", "x.pdf");
        store.savePendingOperation(
                new SuggestionRequest(copyAt("c.pdf").id(), "../fuori", "c.pdf", "", 0.1, "", null), null);

        List<ApplyResult> results = service.applyAll(repoKey, ConflictResolution.SKIP);

        assertThat(results).extracting(ApplyResult::outcome)
                .containsExactly(ApplyOutcome.APPLIED, ApplyOutcome.CONFLICT, ApplyOutcome.FAILED);
        assertThat(repo.resolve("ok/a.pdf")).exists();
        assertThat(repo.resolve("c.pdf")).exists();
    }

    @Test
    void duplicatesAndDedupe() throws IOException {
        write("a.pdf", "uguale");
        write("copie/a.pdf", "uguale");
        write("unico.pdf", "diverso");
        scanner.scan(ScanRequest.of(repoKey));

        List<DuplicateGroup> groups = service.findDuplicates(repoKey);
        assertThat(groups).singleElement().satisfies(g -> assertThat(g.copies()).hasSize(2));
        String kept = groups.get(0).copies().get(0).filePath();
        String other = groups.get(0).copies().get(1).filePath();

        DedupeReport dryRun = service.dedupe(repoKey, true);
        assertThat(dryRun.deletedPaths()).containsExactly(other);
        assertThat(repo.resolve(other)).exists();

        DedupeReport report = service.dedupe(repoKey, false);
        assertThat(report.keptPaths()).containsExactly(kept);
        assertThat(report.deletedPaths()).containsExactly(other);
        assertThat(repo.resolve(other)).doesNotExist();
        assertThat(repo.resolve(kept)).exists();
        assertThat(service.findDuplicates(repoKey)).isEmpty();
        assertThat(store.totalDocuments()).isEqualTo(2);
    }

    @Test
    void targetConflictsGroupSharedDestinations() throws IOException {
        write("a.pdf", "uno");
        write("b.pdf", "due");
        write("c.pdf", "tre");
        scanner.scan(ScanRequest.of(repoKey));
        suggest("a.pdf", "fatture", "f.pdf");
        suggest("b.pdf", "fatture", "f.pdf");
        suggest("c.pdf", "fatture", "g.pdf");

        Map<String, List<DocumentCopy>> conflicts = service.findTargetConflicts(repoKey);

        assertThat(conflicts).containsOnlyKeys("fatture/f.pdf");
        assertThat(conflicts.get("fatture/f.pdf")).extracting(DocumentCopy::filePath)
                .containsExactly("a.pdf", "b.pdf");
    }

    @Test
    void statusSummarisesRepository() throws IOException {
        write("a.pdf", "uguale");
        write("b.pdf", "uguale");
        write("c.pdf", "altro");
        scanner.scan(ScanRequest.of(repoKey));
        service.ignore(copyAt("c.pdf").id());
        suggest("a.pdf", "x", "a.pdf");

        RepositoryStatus status = service.status(repoKey);

        assertThat(status.unorganized()).isEqualTo(2);
        assertThat(status.ignored()).isEqualTo(1);
        assertThat(status.organized()).isZero();
        assertThat(status.pendingOperations()).isEqualTo(1);
        assertThat(status.duplicateGroups()).isEqualTo(1);
        assertThat(status.totalCopies()).isEqualTo(3);
        assertThat(service.stats()).satisfies(s -> {
            assertThat(s.totalDocuments()).isEqualTo(2);
            assertThat(s.totalCopies()).isEqualTo(3);
            assertThat(s.storeType()).isEqualTo("DuckDB");
        });
    }

    @Test
    void targetHeldByStaleCopyIsAConflictUnderSkip() throws IOException {
        write("a.pdf", "uno");
        write("dest/b.pdf", "due");
        scanner.scan(ScanRequest.of(repoKey));
        Files.delete(repo.resolve("dest/b.pdf"));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.SKIP);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.CONFLICT);
        assertThat(repo.resolve("a.pdf")).hasContent("uno");
        assertThat(repo.resolve("dest/b.pdf")).doesNotExist();
        assertThat(store.findPendingOperation(pending.id())).isPresent();
        assertThat(store.totalOperations()).isZero();
    }

    @Test
    void renameSkipsNamesHeldByStaleCopies() throws IOException {
        write("a.pdf", "uno");
        write("dest/b.pdf", "due");
        scanner.scan(ScanRequest.of(repoKey));
        DocumentCopy stale = copyAt("dest/b.pdf");
        Files.delete(repo.resolve("dest/b.pdf"));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.RENAME);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(repo.resolve("dest/b_1.pdf")).hasContent("uno");
        assertThat(repo.resolve("dest/b.pdf")).doesNotExist();
        assertThat(copyAt("dest/b_1.pdf").organizationStatus()).isEqualTo(OrganizationStatus.ORGANIZED);
        assertThat(store.findCopyById(stale.id())).isPresent();
    }

    @Test
    void overwriteReplacesStaleCopyRow() throws IOException {
        write("a.pdf", "uno");
        write("dest/b.pdf", "due");
        scanner.scan(ScanRequest.of(repoKey));
        DocumentCopy moving = copyAt("a.pdf");
        DocumentCopy stale = copyAt("dest/b.pdf");
        Files.delete(repo.resolve("dest/b.pdf"));
        PendingOperation pending = suggest("a.pdf", "dest", "b.pdf");

        ApplyResult result = service.apply(pending.id(), ConflictResolution.OVERWRITE);

        assertThat(result.outcome()).isEqualTo(ApplyOutcome.APPLIED);
        assertThat(repo.resolve("dest/b.pdf")).hasContent("uno");
        assertThat(store.findCopyById(stale.id())).isEmpty();
        assertThat(copyAt("dest/b.pdf").id()).isEqualTo(moving.id());
        assertThat(store.totalCopies()).isEqualTo(1);
    }

    @Test
    void dedupeKeepsACopyThatStillExists() throws IOException {
        write("a.pdf", "uguale");
        write("copie/a.pdf", "uguale");
        scanner.scan(ScanRequest.of(repoKey));
        List<DocumentCopy> copies = service.findDuplicates(repoKey).get(0).copies();
        String missing = copies.get(0).filePath();
        String present = copies.get(1).filePath();
        Files.delete(repo.resolve(missing));

        DedupeReport report = service.dedupe(repoKey, false);

        assertThat(report.keptPaths()).containsExactly(present);
        assertThat(report.deletedPaths()).containsExactly(missing);
        assertThat(repo.resolve(present)).hasContent("uguale");
        assertThat(store.findCopy(repoKey, present)).isPresent();
    }

    private PendingOperation suggest(String filePath, String dir, String filename) {
        return service.suggest(new SuggestionRequest(copyAt(filePath).id(), dir, filename, "", 0.5, "prompt", null));
    }

    private DocumentCopy copyAt(String filePath) {
        return store.findCopy(repoKey, filePath).orElseThrow();
    }

    private Path write(String relative, String content) throws IOException {
        Path file = repo.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
