package it.aw.docorganizer.service;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Estrattore di testo predefinito.
 * <p>
 * PDF via PDFBox ({@link PDFTextStripper} su tutte le pagine, o sulle prime
 * {@code maxPages} se configurato); Office (docx, doc, pptx, ppt, xlsx, xls) e HTML
 * via Apache Tika; txt e md letti come UTF-8, con ripiego su windows-1252 se il file
 * non è UTF-8 valido.
 */
public class DocumentTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(DocumentTextExtractor.class);

    static final Set<String> PLAIN_TEXT_EXTENSIONS = Set.of(".txt", ".md");
    static final Set<String> TIKA_EXTENSIONS = Set.of(
            ".docx", ".doc", ".pptx", ".ppt", ".xlsx", ".xls", ".html", ".htm");

    private static final Charset LEGACY_CHARSET = Charset.forName("windows-1252");

    private final int maxPages;
    private final Tika tika;

    /**
     * @param maxPages numero massimo di pagine PDF da estrarre, 0 = tutte
     */
    public DocumentTextExtractor(int maxPages) {
        if (maxPages < 0) {
            throw new IllegalArgumentException("maxPages deve essere >= 0 (ricevuto: " + maxPages + ")");
        }
        this.maxPages = maxPages;
        this.tika = new Tika();
        this.tika.setMaxStringLength(-1);
    }

    @Override
    public Optional<String> extract(Path file) {
        String extension = extensionOf(file);
        try {
            if (".pdf".equals(extension)) {
                return Optional.of(extractPdf(file));
            }
            if (PLAIN_TEXT_EXTENSIONS.contains(extension)) {
                return Optional.of(decodeText(Files.readAllBytes(file)));
            }
            if (TIKA_EXTENSIONS.contains(extension)) {
                return Optional.of(extractWithTika(file));
            }
            log.warn("Estrazione non supportata per il formato '{}': {}", extension, file);
            return Optional.empty();
        } catch (IOException | TikaException | RuntimeException e) {
            log.warn("Estrazione fallita per {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private String extractPdf(Path file) throws IOException {
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            int totalPages = doc.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            if (maxPages > 0 && totalPages > maxPages) {
                stripper.setEndPage(maxPages);
            }
            String text = stripper.getText(doc);
            log.debug("DocumentTextExtractor: {} pagine, {} caratteri estratti da {}",
                    totalPages, text.length(), file.getFileName());
            return text;
        }
    }

    private String extractWithTika(Path file) throws IOException, TikaException {
        String text = tika.parseToString(file).strip();
        log.debug("DocumentTextExtractor: {} caratteri estratti con Tika da {}", text.length(), file.getFileName());
        return text;
    }

    /** UTF-8 (senza BOM) se valido, altrimenti windows-1252. */
    static String decodeText(byte[] bytes) {
        int offset = bytes.length >= 3
                && bytes[0] == (byte) 0xEF && bytes[1] == (byte) 0xBB && bytes[2] == (byte) 0xBF ? 3 : 0;
        ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(buffer)
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("Testo non UTF-8, decodifica windows-1252");
            return new String(bytes, LEGACY_CHARSET);
        }
    }

    static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
