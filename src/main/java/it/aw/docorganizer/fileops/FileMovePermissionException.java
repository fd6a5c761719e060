package it.aw.docorganizer.fileops;

/**
 * Permessi insufficienti per spostare il file.
 */
public class FileMovePermissionException extends FileOperationException {

    public FileMovePermissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
