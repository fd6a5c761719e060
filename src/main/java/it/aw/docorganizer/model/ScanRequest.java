package it.aw.docorganizer.model;

/**
 * Parametri di una scansione.
 * <p>
 * {@code path} è opzionale: file o directory dentro il repository, relativo
 * alla radice oppure assoluto. Se assente si scansiona la radice.
 */
public record ScanRequest(
        String  repositoryPath,
        String  path,
        boolean recursive,
        boolean rescan
) {
    public static ScanRequest of(String repositoryPath) {
        return new ScanRequest(repositoryPath, null, true, false);
    }
}
