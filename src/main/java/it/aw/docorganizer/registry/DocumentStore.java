package it.aw.docorganizer.registry;

import it.aw.docorganizer.model.Document;
import it.aw.docorganizer.model.DocumentCopy;
import it.aw.docorganizer.model.DuplicateGroup;
import it.aw.docorganizer.model.Operation;
import it.aw.docorganizer.model.OperationOutcome;
import it.aw.docorganizer.model.OrganizationStatus;
import it.aw.docorganizer.model.PendingOperation;
import it.aw.docorganizer.model.SuggestionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Supplier;

/**
 * Database dei documenti su file DuckDB: documenti canonici, copie, suggerimenti
 * pendenti e storico delle operazioni.
 * <p>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso è
 * sincronizzato (DuckDBConnection non è thread-safe, e il modello è a scrittore unico).
 * Le scritture che devono essere atomiche passano da {@link #inTransaction(Supplier)}.
 * <p>
 * Vincoli: {@code content_hash} univoco, {@code (repository_path, file_path)} univoco,
 * un solo suggerimento pendente per copia. Le cascate (copia eliminata → suggerimenti e
 * storico orfani, ultimo documento senza copie → eliminato) sono esplicite in
 * {@link #deleteCopy(String)}.
 * <p>
 * Migrazione schema: se all'avvio una tabella esiste ma non ha le colonne attese,
 * le tabelle vengono ricreate e i repository vanno ri-scansionati.
 */
@Component
public class DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(DocumentStore.class);

    private static final String CREATE_DOCUMENTS = """
            CREATE TABLE IF NOT EXISTS documents (
                id            VARCHAR   PRIMARY KEY,
                content_hash  VARCHAR   NOT NULL UNIQUE,
                content       VARCHAR,
                created_at    TIMESTAMP NOT NULL,
                updated_at    TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_COPIES = """
            CREATE TABLE IF NOT EXISTS document_copies (
                id                     VARCHAR   PRIMARY KEY,
                document_id            VARCHAR   NOT NULL,
                repository_path        VARCHAR   NOT NULL,
                file_path              VARCHAR   NOT NULL,
                stored_content_hash    VARCHAR,
                stored_size            BIGINT,
                stored_mtime           BIGINT,
                organization_status    VARCHAR   NOT NULL DEFAULT 'UNORGANIZED',
                accepted_operation_id  VARCHAR,
                last_seen_at           TIMESTAMP,
                created_at             TIMESTAMP NOT NULL,
                updated_at             TIMESTAMP NOT NULL,
                UNIQUE (repository_path, file_path)
            )
            """;

    private static final String CREATE_PENDING = """
            CREATE TABLE IF NOT EXISTS pending_operations (
                id                        VARCHAR   PRIMARY KEY,
                document_copy_id          VARCHAR   UNIQUE,
                suggested_directory_path  VARCHAR   NOT NULL,
                suggested_filename        VARCHAR   NOT NULL,
                reason                    VARCHAR   NOT NULL,
                confidence                DOUBLE    NOT NULL CHECK (confidence >= 0.0 AND confidence <= 1.0),
                prompt_hash               VARCHAR   NOT NULL,
                document_content_hash     VARCHAR,
                model_name                VARCHAR,
                created_at                TIMESTAMP NOT NULL
            )
            """;

    private static final String CREATE_OPERATIONS = """
            CREATE TABLE IF NOT EXISTS operations (
                id                        VARCHAR   PRIMARY KEY,
                document_copy_id          VARCHAR,
                outcome                   VARCHAR   NOT NULL,
                original_file_path        VARCHAR   NOT NULL,
                original_repository_path  VARCHAR   NOT NULL,
                suggested_directory_path  VARCHAR   NOT NULL,
                suggested_filename        VARCHAR   NOT NULL,
                final_file_path           VARCHAR,
                reason                    VARCHAR   NOT NULL,
                prompt_hash               VARCHAR   NOT NULL,
                created_at                TIMESTAMP NOT NULL,
                decided_at                TIMESTAMP NOT NULL
            )
            """;

    private static final Map<String, Set<String>> REQUIRED_COLUMNS = Map.of(
            "documents", Set.of("id", "content_hash", "content"),
            "document_copies", Set.of("id", "document_id", "repository_path", "file_path",
                    "stored_content_hash", "stored_size", "stored_mtime", "organization_status",
                    "accepted_operation_id", "last_seen_at"),
            "pending_operations", Set.of("id", "document_copy_id", "confidence", "prompt_hash",
                    "document_content_hash", "model_name"),
            "operations", Set.of("id", "document_copy_id", "outcome", "original_file_path",
                    "original_repository_path", "final_file_path", "decided_at"));

    private static final String COPY_COLUMNS =
            "c.id, c.document_id, c.repository_path, c.file_path, c.stored_content_hash, c.stored_size, "
            + "c.stored_mtime, c.organization_status, c.accepted_operation_id, c.last_seen_at, "
            + "c.created_at, c.updated_at";

    private final String dbPath;
    private Connection conn;
    private boolean inTransaction;

    public DocumentStore(@Value("${store.db.path}") String dbPath) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public synchronized void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        migrateIfNeeded();
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_DOCUMENTS);
            stmt.execute(CREATE_COPIES);
            stmt.execute(CREATE_PENDING);
            stmt.execute(CREATE_OPERATIONS);
        }
        log.info("DocumentStore: tabelle pronte su {}", path.toAbsolutePath());
    }

    /** Rileva schema obsoleto e ricrea le tabelle se necessario. */
    private void migrateIfNeeded() throws SQLException {
        Map<String, Set<String>> existing = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT table_name, column_name FROM information_schema.columns "
                + "WHERE table_name IN ('documents', 'document_copies', 'pending_operations', 'operations')")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    existing.computeIfAbsent(rs.getString(1), k -> new HashSet<>()).add(rs.getString(2));
                }
            }
        }
        boolean needsDrop = existing.entrySet().stream()
                .anyMatch(e -> !e.getValue().containsAll(REQUIRED_COLUMNS.get(e.getKey())));
        if (needsDrop) {
            try (Statement stmt = conn.createStatement()) {
                stmt.execute("DROP TABLE IF EXISTS operations");
                stmt.execute("DROP TABLE IF EXISTS pending_operations");
                stmt.execute("DROP TABLE IF EXISTS document_copies");
                stmt.execute("DROP TABLE IF EXISTS documents");
            }
            log.warn("DocumentStore: schema obsoleto rilevato — tabelle ricreate. "
                     + "Ri-scansionare i repository.");
        }
    }

    @PreDestroy
    public synchronized void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB: {}", e.getMessage());
        }
    }

    // -------------------------------------------------------------------------
    // Transazioni
    // -------------------------------------------------------------------------

    /**
     * Esegue {@code work} in un'unica transazione: commit se termina normalmente,
     * rollback su qualsiasi eccezione (rilanciata). Le chiamate annidate partecipano
     * alla transazione esterna.
     */
    public synchronized <T> T inTransaction(Supplier<T> work) {
        if (inTransaction) {
            return work.get();
        }
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new DocumentStoreException("Impossibile avviare la transazione", e);
        }
        inTransaction = true;
        try {
            T result = work.get();
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(e);
            throw new DocumentStoreException("Errore commit transazione", e);
        } catch (RuntimeException | Error e) {
            rollback(e);
            throw e;
        } finally {
            inTransaction = false;
            try {
                conn.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("Impossibile ripristinare l'autocommit", e);
            }
        }
    }

    private void rollback(Throwable cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("Rollback fallito", e);
        }
    }

    // -------------------------------------------------------------------------
    // Documenti
    // -------------------------------------------------------------------------

    public synchronized Optional<Document> findDocumentById(String documentId) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM documents WHERE id = ?")) {
            ps.setString(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toDocument(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura documento " + documentId, e);
        }
        return Optional.empty();
    }

    public synchronized Optional<Document> findDocumentByHash(String contentHash) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM documents WHERE content_hash = ?")) {
            ps.setString(1, contentHash);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toDocument(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura documento per hash " + contentHash, e);
        }
        return Optional.empty();
    }

    public synchronized Document insertDocument(String contentHash, String content) {
        LocalDateTime now = LocalDateTime.now();
        Document document = new Document(UUID.randomUUID().toString(), contentHash, content, now, now);
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO documents (id, content_hash, content, created_at, updated_at) VALUES (?, ?, ?, ?, ?)")) {
            ps.setString(1, document.id());
            ps.setString(2, contentHash);
            setNullableString(ps, 3, content);
            ps.setTimestamp(4, Timestamp.valueOf(now));
            ps.setTimestamp(5, Timestamp.valueOf(now));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore salvataggio documento " + contentHash, e);
        }
        return findDocumentById(document.id()).orElseThrow();
    }

    /** Riempie il testo estratto di un documento esistente. */
    public synchronized Document updateDocumentContent(String documentId, String content) {
        executeUpdate("UPDATE documents SET content = ?, updated_at = ? WHERE id = ?",
                "Errore aggiornamento contenuto documento " + documentId,
                ps -> {
                    setNullableString(ps, 1, content);
                    ps.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
                    ps.setString(3, documentId);
                });
        return findDocumentById(documentId).orElseThrow();
    }

    public synchronized int totalDocuments() {
        return count("SELECT COUNT(*) FROM documents");
    }

    // -------------------------------------------------------------------------
    // Copie
    // -------------------------------------------------------------------------

    public synchronized Optional<DocumentCopy> findCopy(String repositoryPath, String filePath) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + COPY_COLUMNS + " FROM document_copies c WHERE c.repository_path = ? AND c.file_path = ?")) {
            ps.setString(1, repositoryPath);
            ps.setString(2, filePath);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toCopy(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura copia " + filePath, e);
        }
        return Optional.empty();
    }

    public synchronized Optional<DocumentCopy> findCopyById(String copyId) {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT " + COPY_COLUMNS + " FROM document_copies c WHERE c.id = ?")) {
            ps.setString(1, copyId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toCopy(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura copia " + copyId, e);
        }
        return Optional.empty();
    }

    public synchronized List<DocumentCopy> findCopiesByRepository(String repositoryPath) {
        return queryCopies(
                "SELECT " + COPY_COLUMNS + " FROM document_copies c WHERE c.repository_path = ? ORDER BY c.file_path",
                repositoryPath);
    }

    public synchronized List<DocumentCopy> findCopiesByDocument(String documentId) {
        return queryCopies(
                "SELECT " + COPY_COLUMNS + " FROM document_copies c WHERE c.document_id = ? "
                + "ORDER BY c.created_at, c.file_path",
                documentId);
    }

    public synchronized DocumentCopy insertCopy(String documentId, String repositoryPath, String filePath,
                                                String contentHash, long size, long mtime) {
        String id = UUID.randomUUID().toString();
        LocalDateTime now = LocalDateTime.now();
        executeUpdate("""
                INSERT INTO document_copies
                    (id, document_id, repository_path, file_path, stored_content_hash, stored_size, stored_mtime,
                     organization_status, last_seen_at, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                "Errore salvataggio copia " + filePath,
                ps -> {
                    ps.setString(1, id);
                    ps.setString(2, documentId);
                    ps.setString(3, repositoryPath);
                    ps.setString(4, filePath);
                    ps.setString(5, contentHash);
                    ps.setLong(6, size);
                    ps.setLong(7, mtime);
                    ps.setString(8, OrganizationStatus.UNORGANIZED.dbValue());
                    ps.setTimestamp(9, Timestamp.valueOf(now));
                    ps.setTimestamp(10, Timestamp.valueOf(now));
                    ps.setTimestamp(11, Timestamp.valueOf(now));
                });
        return findCopyById(id).orElseThrow();
    }

    /** Aggiorna solo la cache dei metadati (hash, dimensione, mtime). */
    public synchronized DocumentCopy updateCopyMetadata(String copyId, String contentHash, long size, long mtime) {
        executeUpdate("""
                UPDATE document_copies
                SET stored_content_hash = ?, stored_size = ?, stored_mtime = ?, updated_at = ?
                WHERE id = ?
                """,
                "Errore aggiornamento metadati copia " + copyId,
                ps -> {
                    ps.setString(1, contentHash);
                    ps.setLong(2, size);
                    ps.setLong(3, mtime);
                    ps.setTimestamp(4, Timestamp.valueOf(LocalDateTime.now()));
                    ps.setString(5, copyId);
                });
        return findCopyById(copyId).orElseThrow();
    }

    /** Fa puntare la copia a un altro documento (file sovrascritto sul posto). */
    public synchronized DocumentCopy repointCopy(String copyId, String documentId, String contentHash,
                                                 long size, long mtime) {
        executeUpdate("""
                UPDATE document_copies
                SET document_id = ?, stored_content_hash = ?, stored_size = ?, stored_mtime = ?, updated_at = ?
                WHERE id = ?
                """,
                "Errore aggiornamento documento della copia " + copyId,
                ps -> {
                    ps.setString(1, documentId);
                    ps.setString(2, contentHash);
                    ps.setLong(3, size);
                    ps.setLong(4, mtime);
                    ps.setTimestamp(5, Timestamp.valueOf(LocalDateTime.now()));
                    ps.setString(6, copyId);
                });
        return findCopyById(copyId).orElseThrow();
    }

    /**
     * Registra il nuovo percorso dopo uno spostamento riuscito. Se il percorso non cambia
     * (file già nella destinazione) si aggiornano solo stato e operazione accettata.
     */
    public synchronized DocumentCopy relocateCopy(String copyId, String newFilePath, OrganizationStatus status,
                                                  String acceptedOperationId) {
        DocumentCopy current = findCopyById(copyId).orElseThrow(
                () -> new NoSuchElementException("Copia inesistente: " + copyId));
        if (current.filePath().equals(newFilePath)) {
            executeUpdate("""
                    UPDATE document_copies
                    SET organization_status = ?, accepted_operation_id = ?, updated_at = ?
                    WHERE id = ?
                    """,
                    "Errore aggiornamento stato copia " + copyId,
                    ps -> {
                        ps.setString(1, status.dbValue());
                        setNullableString(ps, 2, acceptedOperationId);
                        ps.setTimestamp(3, Timestamp.valueOf(LocalDateTime.now()));
                        ps.setString(4, copyId);
                    });
            return findCopyById(copyId).orElseThrow();
        }
        executeUpdate("""
                UPDATE document_copies
                SET file_path = ?, organization_status = ?, accepted_operation_id = ?, updated_at = ?
                WHERE id = ?
                """,
                "Errore aggiornamento percorso copia " + copyId,
                ps -> {
                    ps.setString(1, newFilePath);
                    ps.setString(2, status.dbValue());
                    setNullableString(ps, 3, acceptedOperationId);
                    ps.setTimestamp(4, Timestamp.valueOf(LocalDateTime.now()));
                    ps.setString(5, copyId);
                });
        return findCopyById(copyId).orElseThrow();
    }

    public synchronized DocumentCopy updateOrganizationStatus(String copyId, OrganizationStatus status) {
        executeUpdate("UPDATE document_copies SET organization_status = ?, updated_at = ? WHERE id = ?",
                "Errore aggiornamento stato copia " + copyId,
                ps -> {
                    ps.setString(1, status.dbValue());
                    ps.setTimestamp(2, Timestamp.valueOf(LocalDateTime.now()));
                    ps.setString(3, copyId);
                });
        return findCopyById(copyId).orElseThrow();
    }

    public synchronized void touchLastSeen(String copyId, LocalDateTime seenAt) {
        executeUpdate("UPDATE document_copies SET last_seen_at = ? WHERE id = ?",
                "Errore aggiornamento last_seen_at copia " + copyId,
                ps -> {
                    ps.setTimestamp(1, Timestamp.valueOf(seenAt));
                    ps.setString(2, copyId);
                });
    }

    /**
     * Elimina una copia con le cascate esplicite: i suggerimenti e lo storico che la
     * riferiscono restano come record orfani ({@code document_copy_id = NULL}); il documento
     * viene eliminato se questa era la sua ultima copia.
     *
     * @return {@code true} se è stato eliminato anche il documento
     */
    public boolean deleteCopy(String copyId) {
        return inTransaction(() -> {
            Optional<DocumentCopy> copy = findCopyById(copyId);
            if (copy.isEmpty()) {
                return false;
            }
            executeUpdate("UPDATE pending_operations SET document_copy_id = NULL WHERE document_copy_id = ?",
                    "Errore scollegamento suggerimenti della copia " + copyId,
                    ps -> ps.setString(1, copyId));
            executeUpdate("UPDATE operations SET document_copy_id = NULL WHERE document_copy_id = ?",
                    "Errore scollegamento storico della copia " + copyId,
                    ps -> ps.setString(1, copyId));
            executeUpdate("DELETE FROM document_copies WHERE id = ?",
                    "Errore eliminazione copia " + copyId,
                    ps -> ps.setString(1, copyId));

            String documentId = copy.get().documentId();
            if (findCopiesByDocument(documentId).isEmpty()) {
                executeUpdate("DELETE FROM documents WHERE id = ?",
                        "Errore eliminazione documento " + documentId,
                        ps -> ps.setString(1, documentId));
                log.debug("Documento {} eliminato insieme alla sua ultima copia", documentId);
                return true;
            }
            return false;
        });
    }

    /**
     * Documenti con due o più copie nel repository, raggruppati per documento.
     * Le copie di ciascun gruppo sono ordinate per data di creazione.
     */
    public synchronized List<DuplicateGroup> findDuplicateGroups(String repositoryPath) {
        String sql = "SELECT " + COPY_COLUMNS + ", d.content_hash AS doc_hash "
                + "FROM document_copies c JOIN documents d ON d.id = c.document_id "
                + "WHERE c.repository_path = ? AND c.document_id IN ("
                + "    SELECT document_id FROM document_copies WHERE repository_path = ? "
                + "    GROUP BY document_id HAVING COUNT(*) > 1) "
                + "ORDER BY c.created_at, c.file_path";
        Map<String, List<DocumentCopy>> groups = new LinkedHashMap<>();
        Map<String, String> hashes = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, repositoryPath);
            ps.setString(2, repositoryPath);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    DocumentCopy copy = toCopy(rs);
                    groups.computeIfAbsent(copy.documentId(), k -> new ArrayList<>()).add(copy);
                    hashes.put(copy.documentId(), rs.getString("doc_hash"));
                }
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore ricerca duplicati in " + repositoryPath, e);
        }
        List<DuplicateGroup> result = new ArrayList<>();
        groups.forEach((documentId, copies) ->
                result.add(new DuplicateGroup(documentId, hashes.get(documentId), List.copyOf(copies))));
        return result;
    }

    public synchronized Map<OrganizationStatus, Integer> countByStatus(String repositoryPath) {
        Map<OrganizationStatus, Integer> counts = new EnumMap<>(OrganizationStatus.class);
        for (OrganizationStatus s : OrganizationStatus.values()) counts.put(s, 0);
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT organization_status, COUNT(*) FROM document_copies "
                + "WHERE repository_path = ? GROUP BY organization_status")) {
            ps.setString(1, repositoryPath);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(OrganizationStatus.fromDbValue(rs.getString(1)), rs.getInt(2));
                }
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore conteggio stati in " + repositoryPath, e);
        }
        return counts;
    }

    public synchronized int totalCopies() {
        return count("SELECT COUNT(*) FROM document_copies");
    }

    // -------------------------------------------------------------------------
    // Suggerimenti pendenti
    // -------------------------------------------------------------------------

    /**
     * Salva il suggerimento per una copia, sostituendo quello eventualmente già presente.
     *
     * @param request             suggerimento del motore esterno
     * @param documentContentHash hash del contenuto su cui è stato calcolato
     */
    public synchronized PendingOperation savePendingOperation(SuggestionRequest request, String documentContentHash) {
        String id = UUID.randomUUID().toString();
        executeUpdate("""
                INSERT INTO pending_operations
                    (id, document_copy_id, suggested_directory_path, suggested_filename, reason, confidence,
                     prompt_hash, document_content_hash, model_name, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (document_copy_id) DO UPDATE SET
                    suggested_directory_path = EXCLUDED.suggested_directory_path,
                    suggested_filename       = EXCLUDED.suggested_filename,
                    reason                   = EXCLUDED.reason,
                    confidence               = EXCLUDED.confidence,
                    prompt_hash              = EXCLUDED.prompt_hash,
                    document_content_hash    = EXCLUDED.document_content_hash,
                    model_name               = EXCLUDED.model_name,
                    created_at               = EXCLUDED.created_at
                """,
                "Errore salvataggio suggerimento per la copia " + request.documentCopyId(),
                ps -> {
                    ps.setString(1, id);
                    ps.setString(2, request.documentCopyId());
                    ps.setString(3, request.suggestedDirectoryPath());
                    ps.setString(4, request.suggestedFilename());
                    ps.setString(5, request.reason());
                    ps.setDouble(6, request.confidence());
                    ps.setString(7, request.promptHash());
                    setNullableString(ps, 8, documentContentHash);
                    setNullableString(ps, 9, request.modelName());
                    ps.setTimestamp(10, Timestamp.valueOf(LocalDateTime.now()));
                });
        return findPendingOperationForCopy(request.documentCopyId()).orElseThrow();
    }

    public synchronized Optional<PendingOperation> findPendingOperation(String pendingOperationId) {
        return queryPending("SELECT * FROM pending_operations WHERE id = ?", pendingOperationId)
                .stream().findFirst();
    }

    public synchronized Optional<PendingOperation> findPendingOperationForCopy(String copyId) {
        return queryPending("SELECT * FROM pending_operations WHERE document_copy_id = ?", copyId)
                .stream().findFirst();
    }

    /** Suggerimenti pendenti delle copie di un repository, in ordine di percorso. */
    public synchronized List<PendingOperation> findPendingOperations(String repositoryPath) {
        return queryPending("SELECT p.* FROM pending_operations p "
                + "JOIN document_copies c ON c.id = p.document_copy_id "
                + "WHERE c.repository_path = ? ORDER BY c.file_path", repositoryPath);
    }

    public synchronized void deletePendingOperation(String pendingOperationId) {
        executeUpdate("DELETE FROM pending_operations WHERE id = ?",
                "Errore eliminazione suggerimento " + pendingOperationId,
                ps -> ps.setString(1, pendingOperationId));
    }

    /** @return numero di suggerimenti eliminati */
    public synchronized int deletePendingOperationsForCopy(String copyId) {
        return executeUpdate("DELETE FROM pending_operations WHERE document_copy_id = ?",
                "Errore eliminazione suggerimenti della copia " + copyId,
                ps -> ps.setString(1, copyId));
    }

    public synchronized int totalPendingOperations() {
        return count("SELECT COUNT(*) FROM pending_operations");
    }

    // -------------------------------------------------------------------------
    // Storico operazioni
    // -------------------------------------------------------------------------

    /**
     * Registra l'esito di un suggerimento. I percorsi originali vengono copiati ora
     * dalla copia e non saranno più ricalcolati.
     */
    public synchronized Operation recordOperation(PendingOperation pending, DocumentCopy copy,
                                                  OperationOutcome outcome, String finalFilePath) {
        Operation operation = new Operation(
                UUID.randomUUID().toString(),
                copy.id(),
                outcome,
                copy.filePath(),
                copy.repositoryPath(),
                pending.suggestedDirectoryPath(),
                pending.suggestedFilename(),
                finalFilePath,
                pending.reason(),
                pending.promptHash(),
                pending.createdAt(),
                LocalDateTime.now());
        executeUpdate("""
                INSERT INTO operations
                    (id, document_copy_id, outcome, original_file_path, original_repository_path,
                     suggested_directory_path, suggested_filename, final_file_path, reason, prompt_hash,
                     created_at, decided_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                "Errore salvataggio operazione per la copia " + copy.id(),
                ps -> {
                    ps.setString(1, operation.id());
                    ps.setString(2, operation.documentCopyId());
                    ps.setString(3, outcome.dbValue());
                    ps.setString(4, operation.originalFilePath());
                    ps.setString(5, operation.originalRepositoryPath());
                    ps.setString(6, operation.suggestedDirectoryPath());
                    ps.setString(7, operation.suggestedFilename());
                    setNullableString(ps, 8, finalFilePath);
                    ps.setString(9, operation.reason());
                    ps.setString(10, operation.promptHash());
                    ps.setTimestamp(11, Timestamp.valueOf(operation.createdAt()));
                    ps.setTimestamp(12, Timestamp.valueOf(operation.decidedAt()));
                });
        return operation;
    }

    /** Storico delle operazioni di un repository, dalla più recente. */
    public synchronized List<Operation> findOperations(String repositoryPath) {
        List<Operation> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM operations WHERE original_repository_path = ? ORDER BY decided_at DESC")) {
            ps.setString(1, repositoryPath);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toOperation(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura storico operazioni", e);
        }
        return result;
    }

    /** Esempi accettati per una data richiesta, usati dal motore dei suggerimenti. */
    public synchronized List<Operation> findAcceptedOperations(String promptHash, int limit) {
        List<Operation> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT * FROM operations WHERE outcome = ? AND prompt_hash = ? ORDER BY decided_at DESC LIMIT "
                + Math.max(0, limit))) {
            ps.setString(1, OperationOutcome.ACCEPTED.dbValue());
            ps.setString(2, promptHash);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toOperation(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura operazioni accettate", e);
        }
        return result;
    }

    public synchronized int totalOperations() {
        return count("SELECT COUNT(*) FROM operations");
    }

    // -------------------------------------------------------------------------
    // Supporto JDBC
    // -------------------------------------------------------------------------

    @FunctionalInterface
    private interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private synchronized int executeUpdate(String sql, String errorMessage, StatementBinder binder) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new DocumentStoreException(errorMessage, e);
        }
    }

    private synchronized int count(String sql) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore conteggio: " + sql, e);
        }
    }

    private List<DocumentCopy> queryCopies(String sql, String param) {
        List<DocumentCopy> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toCopy(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura copie", e);
        }
        return result;
    }

    private List<PendingOperation> queryPending(String sql, String param) {
        List<PendingOperation> result = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toPending(rs));
            }
        } catch (SQLException e) {
            throw new DocumentStoreException("Errore lettura suggerimenti pendenti", e);
        }
        return result;
    }

    private static void setNullableString(PreparedStatement ps, int index, String value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        Object value = rs.getObject(column);
        return value == null ? null : ((Number) value).longValue();
    }

    private static LocalDateTime nullableTimestamp(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toLocalDateTime();
    }

    private static Document toDocument(ResultSet rs) throws SQLException {
        return new Document(
                rs.getString("id"),
                rs.getString("content_hash"),
                rs.getString("content"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                rs.getTimestamp("updated_at").toLocalDateTime()
        );
    }

    private static DocumentCopy toCopy(ResultSet rs) throws SQLException {
        return new DocumentCopy(
                rs.getString("id"),
                rs.getString("document_id"),
                rs.getString("repository_path"),
                rs.getString("file_path"),
                rs.getString("stored_content_hash"),
                nullableLong(rs, "stored_size"),
                nullableLong(rs, "stored_mtime"),
                OrganizationStatus.fromDbValue(rs.getString("organization_status")),
                rs.getString("accepted_operation_id"),
                nullableTimestamp(rs, "last_seen_at"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                rs.getTimestamp("updated_at").toLocalDateTime()
        );
    }

    private static PendingOperation toPending(ResultSet rs) throws SQLException {
        return new PendingOperation(
                rs.getString("id"),
                rs.getString("document_copy_id"),
                rs.getString("suggested_directory_path"),
                rs.getString("suggested_filename"),
                rs.getString("reason"),
                rs.getDouble("confidence"),
                rs.getString("prompt_hash"),
                rs.getString("document_content_hash"),
                rs.getString("model_name"),
                rs.getTimestamp("created_at").toLocalDateTime()
        );
    }

    private static Operation toOperation(ResultSet rs) throws SQLException {
        return new Operation(
                rs.getString("id"),
                rs.getString("document_copy_id"),
                OperationOutcome.fromDbValue(rs.getString("outcome")),
                rs.getString("original_file_path"),
                rs.getString("original_repository_path"),
                rs.getString("suggested_directory_path"),
                rs.getString("suggested_filename"),
                rs.getString("final_file_path"),
                rs.getString("reason"),
                rs.getString("prompt_hash"),
                rs.getTimestamp("created_at").toLocalDateTime(),
                rs.getTimestamp("decided_at").toLocalDateTime()
        );
    }
}
