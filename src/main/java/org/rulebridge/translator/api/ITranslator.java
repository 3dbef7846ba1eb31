package org.rulebridge.translator.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for the SVRF-to-PXL deck translator.
 */
public interface ITranslator {

    /**
     * Translates the given SVRF source text.
     *
     * @param source The complete source deck.
     * @param sourceName A name for the deck, used for diagnostics and the provenance comment.
     * @return A {@link TranslationArtifact} holding the IR, the generated text and statistics.
     * @throws TranslationException if the deck contains a fatal error, such as a malformed numeric literal.
     */
    TranslationArtifact translate(String source, String sourceName) throws TranslationException;

    /**
     * Translates a deck read from a file.
     * @param deckPath The path to the SVRF deck.
     * @return The translation artifact.
     * @throws TranslationException if the deck contains a fatal error.
     * @throws IOException if the file cannot be read.
     */
    default TranslationArtifact translate(Path deckPath) throws TranslationException, IOException {
        return translate(Files.readString(deckPath, StandardCharsets.UTF_8), deckPath.getFileName().toString());
    }
}
