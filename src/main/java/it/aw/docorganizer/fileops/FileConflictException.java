package it.aw.docorganizer.fileops;

import java.nio.file.Path;

/**
 * La destinazione esiste già e la politica di conflitto è SKIP.
 * È un esito atteso, non un guasto: entrambi i file sono rimasti invariati.
 */
public class FileConflictException extends FileOperationException {

    private final transient Path source;
    private final transient Path target;

    public FileConflictException(Path source, Path target) {
        super("Il file di destinazione esiste già: " + target + " (sorgente: " + source + ")");
        this.source = source;
        this.target = target;
    }

    public Path getSource() {
        return source;
    }

    public Path getTarget() {
        return target;
    }
}
