package it.aw.docorganizer.config;

import it.aw.docorganizer.service.DocumentTextExtractor;
import it.aw.docorganizer.service.TextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configura i servizi esterni dell'organizzatore.
 *
 * TextExtractor: PDFBox per i PDF, Apache Tika per Office e HTML, lettura diretta
 *                per txt/md. Creato una sola volta e iniettato nella pipeline di elaborazione.
 */
@Configuration
public class OrganizerConfig {

    private static final Logger log = LoggerFactory.getLogger(OrganizerConfig.class);

    @Value("${organizer.extraction.max-pdf-pages:0}")
    private int maxPdfPages;

    @Bean
    public TextExtractor textExtractor() {
        log.info("Inizializzazione TextExtractor: PDFBox + Tika (max pagine PDF: {})",
                maxPdfPages > 0 ? maxPdfPages : "tutte");
        return new DocumentTextExtractor(maxPdfPages);
    }
}
