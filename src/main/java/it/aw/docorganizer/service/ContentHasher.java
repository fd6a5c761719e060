package it.aw.docorganizer.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Calcola l'hash SHA-256 dell'intero contenuto di un file, letto a blocchi
 * di dimensione fissa per limitare la memoria.
 */
@Component
public class ContentHasher {

    public static final int DEFAULT_BUFFER_SIZE = 8192;

    private final int bufferSize;

    public ContentHasher(@Value("${organizer.hash.buffer-size:8192}") int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize deve essere > 0 (ricevuto: " + bufferSize + ")");
        }
        this.bufferSize = bufferSize;
    }

    /**
     * @return digest esadecimale minuscolo (64 caratteri)
     * @throws IOException se il file non è leggibile
     */
    public String hash(Path file) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[bufferSize];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 non disponibile nella JVM", e);
        }
    }
}
