package it.aw.docorganizer.security;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validazione dei percorsi suggeriti dal motore esterno.
 * <p>
 * I suggerimenti non sono affidabili: la validazione avviene in due livelli.
 * <ol>
 *   <li>Controllo sintattico dei singoli componenti (nessun accesso al disco):
 *       produce un messaggio preciso per l'utente.</li>
 *   <li>Risoluzione sul file system (symlink seguiti) e verifica che il percorso
 *       finale resti dentro la radice del repository.</li>
 * </ol>
 */
public final class PathValidator {

    private static final Set<Character> INVALID_CHARS = Set.of('<', '>', ':', '"', '|', '?', '*');
    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("[/\\\\]");
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");

    private PathValidator() {}

    /**
     * Valida un singolo componente (directory o nome file) così come arriva dal suggerimento.
     *
     * @param component  stringa da validare
     * @param allowEmpty se {@code true} la stringa vuota è accettata (directory opzionale)
     * @return il componente invariato
     * @throws PathSecurityException se il componente non è accettabile
     */
    public static String validatePathComponent(String component, boolean allowEmpty) {
        if (component == null || component.isEmpty()) {
            if (allowEmpty) return component == null ? "" : component;
            throw new PathSecurityException("Il componente del percorso non può essere vuoto");
        }
        if (component.indexOf('\0') >= 0) {
            throw new PathSecurityException("Il componente del percorso non può contenere byte nulli");
        }
        if (isAbsolute(component)) {
            throw new PathSecurityException("Il componente del percorso non può essere assoluto: " + component);
        }
        // ".." in qualunque posizione, non solo come prefisso ("safe/../danger")
        for (String segment : SEGMENT_SEPARATOR.split(component)) {
            if ("..".equals(segment)) {
                throw new PathSecurityException(
                        "Il componente del percorso non può risalire alla directory padre (..): " + component);
            }
        }
        for (int i = 0; i < component.length(); i++) {
            char c = component.charAt(i);
            if (INVALID_CHARS.contains(c)) {
                throw new PathSecurityException(
                        "Il componente del percorso contiene il carattere non valido '" + c + "': " + component);
            }
        }
        return component;
    }

    /**
     * Compone e valida la destinazione {@code basePath/suggestedDir/suggestedFilename}.
     *
     * @param basePath          radice del repository, deve essere assoluta
     * @param suggestedDir      directory relativa suggerita, può essere vuota
     * @param suggestedFilename nome file suggerito, obbligatorio
     * @return il percorso risolto, garantito dentro {@code basePath}
     * @throws IllegalArgumentException se {@code basePath} non è assoluto
     * @throws PathSecurityException    se un componente non è valido o il percorso esce dalla radice
     */
    public static Path validateTargetPath(Path basePath, String suggestedDir, String suggestedFilename) {
        if (basePath == null || !basePath.isAbsolute()) {
            throw new IllegalArgumentException("Il percorso base deve essere assoluto: " + basePath);
        }
        String dir = validatePathComponent(suggestedDir, true);
        validatePathComponent(suggestedFilename, false);

        Path fullPath;
        try {
            fullPath = dir.isEmpty()
                    ? basePath.resolve(suggestedFilename)
                    : basePath.resolve(dir).resolve(suggestedFilename);
        } catch (InvalidPathException e) {
            throw new PathSecurityException("Percorso suggerito non valido: " + e.getMessage(), e);
        }

        Path resolvedFull = resolve(fullPath);
        Path resolvedBase = resolve(basePath);
        if (!resolvedFull.startsWith(resolvedBase) || resolvedFull.equals(resolvedBase)) {
            throw new PathSecurityException(
                    "Il percorso suggerito esce dal repository.\n"
                    + "  Repository: " + resolvedBase + "\n"
                    + "  Suggerito: " + resolvedFull + "\n"
                    + "  Directory: '" + dir + "'\n"
                    + "  Nome file: '" + suggestedFilename + "'");
        }
        return resolvedFull;
    }

    /**
     * Verifica che {@code path} risolto stia dentro {@code repoRoot} risolto.
     * Da usare prima di ogni modifica al file system come ulteriore difesa.
     *
     * @throws PathSecurityException se il percorso è fuori dal repository
     */
    public static void validateRepositoryPath(Path path, Path repoRoot) {
        Path resolvedPath = resolve(path);
        Path resolvedRoot = resolve(repoRoot);
        if (!resolvedPath.startsWith(resolvedRoot)) {
            throw new PathSecurityException(
                    "Il percorso è fuori dai confini del repository.\n"
                    + "  Repository: " + resolvedRoot + "\n"
                    + "  Percorso: " + resolvedPath);
        }
    }

    /**
     * Risolve un percorso seguendo i symlink anche quando la parte finale non esiste ancora:
     * il prefisso esistente più lungo passa da {@link Path#toRealPath}, i segmenti
     * rimanenti vengono riattaccati così come sono.
     *
     * @throws PathSecurityException se un prefisso esistente non è risolvibile (es. symlink pendente)
     */
    public static Path resolve(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        Path existing = absolute;
        Deque<Path> tail = new ArrayDeque<>();
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            tail.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        Path resolved;
        try {
            resolved = existing.toRealPath();
        } catch (IOException e) {
            throw new PathSecurityException("Impossibile risolvere il percorso: " + existing, e);
        }
        while (!tail.isEmpty()) {
            resolved = resolved.resolve(tail.pop());
        }
        return resolved;
    }

    private static boolean isAbsolute(String component) {
        if (component.startsWith("/") || component.startsWith("\\") || DRIVE_PREFIX.matcher(component).matches()) {
            return true;
        }
        try {
            return Path.of(component).isAbsolute();
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
