package it.aw.docorganizer.service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Estrazione del testo da un file. Servizio esterno al nucleo: viene costruito
 * dal chiamante e iniettato nella pipeline.
 * <p>
 * Le implementazioni non devono sollevare eccezioni: un fallimento è un
 * {@link Optional#empty()}, che la pipeline registra come contenuto {@code null}.
 */
public interface TextExtractor {

    Optional<String> extract(Path file);
}
