package it.aw.docorganizer.fileops;

import java.nio.file.Path;

/**
 * Il file sorgente non esiste o non è un file regolare.
 */
public class SourceNotFoundException extends FileOperationException {

    private final transient Path source;

    public SourceNotFoundException(Path source) {
        super("File sorgente non trovato: " + source);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
