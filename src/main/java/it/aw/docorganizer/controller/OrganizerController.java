package it.aw.docorganizer.controller;

import it.aw.docorganizer.fileops.FileOperationException;
import it.aw.docorganizer.model.*;
import it.aw.docorganizer.registry.DocumentStoreException;
import it.aw.docorganizer.security.PathSecurityException;
import it.aw.docorganizer.service.OrganizationException;
import it.aw.docorganizer.service.OrganizationService;
import it.aw.docorganizer.service.RepositoryScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Espone scansione, stato e gestione dei suggerimenti di organizzazione.
 *
 * Endpoint disponibili:
 *   POST /api/organizer/scan                                — scansiona un repository
 *   GET  /api/organizer/status?repositoryPath=               — riepilogo per stato di organizzazione
 *   GET  /api/organizer/duplicates?repositoryPath=           — gruppi di copie duplicate
 *   POST /api/organizer/dedupe?repositoryPath=&dryRun=       — elimina i duplicati
 *   GET  /api/organizer/pending-operations?repositoryPath=   — suggerimenti pendenti
 *   POST /api/organizer/pending-operations                   — registra un suggerimento
 *   GET  /api/organizer/pending-operations/conflicts         — destinazioni contese
 *   POST /api/organizer/pending-operations/{id}/apply        — applica un suggerimento
 *   POST /api/organizer/pending-operations/apply-all         — applica tutti i suggerimenti
 *   POST /api/organizer/pending-operations/{id}/reject       — rifiuta un suggerimento
 *   POST /api/organizer/copies/{id}/ignore                   — esclude una copia
 *   POST /api/organizer/copies/{id}/unmark                   — riporta una copia a UNORGANIZED
 *   GET  /api/organizer/operations?repositoryPath=           — storico delle decisioni
 *   GET  /api/organizer/stats                                — statistiche del database
 *
 * Nota: i path letterali /conflicts e /apply-all hanno priorità su /{id} in Spring MVC.
 */
@RestController
@RequestMapping("/api/organizer")
public class OrganizerController {

    private static final Logger log = LoggerFactory.getLogger(OrganizerController.class);

    private final RepositoryScanner scanner;
    private final OrganizationService organizationService;

    public OrganizerController(RepositoryScanner scanner, OrganizationService organizationService) {
        this.scanner = scanner;
        this.organizationService = organizationService;
    }

    // -------------------------------------------------------------------------
    // POST /api/organizer/scan
    // -------------------------------------------------------------------------

    /**
     * Scansiona un repository. {@code path}, {@code recursive} e {@code rescan} sono opzionali.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/organizer/scan \
     *        -H "Content-Type: application/json" \
     *        -d '{"repositoryPath":"/home/user/Documenti","recursive":true,"rescan":false}'
     */
    @PostMapping("/scan")
    public ResponseEntity<ScanSummary> scan(@RequestBody ScanRequest request) {
        return ResponseEntity.ok(scanner.scan(request));
    }

    // -------------------------------------------------------------------------
    // GET /api/organizer/status, /duplicates, /stats, /operations
    // -------------------------------------------------------------------------

    /**
     * Esempio:
     *   curl "http://localhost:8889/api/organizer/status?repositoryPath=/home/user/Documenti"
     */
    @GetMapping("/status")
    public ResponseEntity<RepositoryStatus> status(@RequestParam String repositoryPath) {
        return ResponseEntity.ok(organizationService.status(repositoryPath));
    }

    @GetMapping("/duplicates")
    public ResponseEntity<List<DuplicateGroup>> duplicates(@RequestParam String repositoryPath) {
        return ResponseEntity.ok(organizationService.findDuplicates(repositoryPath));
    }

    /**
     * Mantiene la copia più vecchia di ogni gruppo ed elimina le altre.
     * Senza {@code dryRun=false} non viene eliminato nulla.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/organizer/dedupe?repositoryPath=/home/user/Documenti&dryRun=false"
     */
    @PostMapping("/dedupe")
    public ResponseEntity<DedupeReport> dedupe(
            @RequestParam String repositoryPath,
            @RequestParam(value = "dryRun", defaultValue = "true") boolean dryRun) {
        return ResponseEntity.ok(organizationService.dedupe(repositoryPath, dryRun));
    }

    @GetMapping("/operations")
    public ResponseEntity<List<Operation>> operations(@RequestParam String repositoryPath) {
        return ResponseEntity.ok(organizationService.findOperations(repositoryPath));
    }

    @GetMapping("/stats")
    public ResponseEntity<StoreStats> stats() {
        return ResponseEntity.ok(organizationService.stats());
    }

    // -------------------------------------------------------------------------
    // Suggerimenti pendenti
    // -------------------------------------------------------------------------

    @GetMapping("/pending-operations")
    public ResponseEntity<List<PendingOperation>> pendingOperations(@RequestParam String repositoryPath) {
        return ResponseEntity.ok(organizationService.findPendingOperations(repositoryPath));
    }

    /**
     * Registra il suggerimento del motore esterno, sostituendo quello precedente della copia.
     *
     * Esempio:
     *   curl -X POST http://localhost:8889/api/organizer/pending-operations \
     *        -H "Content-Type: application/json" \
     *        -d '{"documentCopyId":"...","suggestedDirectoryPath":"fatture/2024",
     *             "suggestedFilename":"fattura_0042.pdf","reason":"fattura","confidence":0.9}'
     */
    @PostMapping("/pending-operations")
    public ResponseEntity<PendingOperation> suggest(@RequestBody SuggestionRequest request) {
        return ResponseEntity.ok(organizationService.suggest(request));
    }

    @GetMapping("/pending-operations/conflicts")
    public ResponseEntity<Map<String, List<DocumentCopy>>> conflicts(@RequestParam String repositoryPath) {
        return ResponseEntity.ok(organizationService.findTargetConflicts(repositoryPath));
    }

    /**
     * Applica un suggerimento. {@code conflict}: SKIP (default), OVERWRITE, RENAME.
     * Risponde 409 se la destinazione è occupata, 404 se il file sorgente non esiste più.
     *
     * Esempio:
     *   curl -X POST "http://localhost:8889/api/organizer/pending-operations/{id}/apply?conflict=RENAME"
     */
    @PostMapping("/pending-operations/{id}/apply")
    public ResponseEntity<ApplyResult> apply(
            @PathVariable String id,
            @RequestParam(value = "conflict", defaultValue = "SKIP") ConflictResolution conflict) {
        ApplyResult result = organizationService.apply(id, conflict);
        switch (result.outcome()) {
            case CONFLICT:
                return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
            case SOURCE_MISSING:
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
            default:
                return ResponseEntity.ok(result);
        }
    }

    @PostMapping("/pending-operations/apply-all")
    public ResponseEntity<List<ApplyResult>> applyAll(
            @RequestParam String repositoryPath,
            @RequestParam(value = "conflict", defaultValue = "SKIP") ConflictResolution conflict) {
        return ResponseEntity.ok(organizationService.applyAll(repositoryPath, conflict));
    }

    @PostMapping("/pending-operations/{id}/reject")
    public ResponseEntity<Operation> reject(@PathVariable String id) {
        return ResponseEntity.ok(organizationService.reject(id));
    }

    // -------------------------------------------------------------------------
    // Copie
    // -------------------------------------------------------------------------

    @PostMapping("/copies/{id}/ignore")
    public ResponseEntity<DocumentCopy> ignore(@PathVariable String id) {
        return ResponseEntity.ok(organizationService.ignore(id));
    }

    @PostMapping("/copies/{id}/unmark")
    public ResponseEntity<DocumentCopy> unmark(@PathVariable String id) {
        return ResponseEntity.ok(organizationService.unmark(id));
    }

    // -------------------------------------------------------------------------
    // Gestione errori
    // -------------------------------------------------------------------------

    @ExceptionHandler(PathSecurityException.class)
    public ResponseEntity<Map<String, String>> pathSecurity(PathSecurityException e) {
        log.warn("Percorso rifiutato: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(OrganizationException.class)
    public ResponseEntity<Map<String, String>> organization(OrganizationException e) {
        HttpStatus status = e.getReason() == OrganizationException.Reason.NOT_FOUND
                ? HttpStatus.NOT_FOUND
                : HttpStatus.CONFLICT;
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler({FileOperationException.class, DocumentStoreException.class})
    public ResponseEntity<Map<String, String>> internalError(RuntimeException e) {
        log.error("Errore durante l'operazione: {}", e.getMessage(), e);
        return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
