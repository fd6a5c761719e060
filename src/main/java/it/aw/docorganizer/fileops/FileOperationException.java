package it.aw.docorganizer.fileops;

/**
 * Errore generico durante lo spostamento di un file.
 */
public class FileOperationException extends RuntimeException {

    public FileOperationException(String message) {
        super(message);
    }

    public FileOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
