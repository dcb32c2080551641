package de.mirkosertic.pwstrength.dictionary;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads word lists from UTF-8 text files with one word per line.
 *
 * <p>Lines are trimmed and lowercased, blank lines are skipped. With a word limit, reading stops once
 * that many words have been collected. Byte sequences that are not valid UTF-8 are replaced with
 * U+FFFD, so a single stray byte does not discard the whole list.</p>
 */
public class FileWordListProvider implements WordListProvider {

    private static final Logger logger = LoggerFactory.getLogger(FileWordListProvider.class);

    private final @Nullable Integer maxWords;

    /**
     * Provider without a word limit.
     */
    public FileWordListProvider() {
        this.maxWords = null;
    }

    /**
     * @param maxWords maximum number of words per dictionary, or {@code null} for no limit
     * @throws IllegalArgumentException if {@code maxWords} is not positive
     */
    public FileWordListProvider(final @Nullable Integer maxWords) {
        if (maxWords != null && maxWords <= 0) {
            throw new IllegalArgumentException("The dictionary length limit must be a positive value, got " + maxWords);
        }
        this.maxWords = maxWords;
    }

    public @Nullable Integer getMaxWords() {
        return maxWords;
    }

    @Override
    public List<String> readWords(final DictionarySource source) throws IOException {
        final List<String> words = new ArrayList<>();
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        try (final BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(source.location()), decoder))) {
            String line;
            while ((maxWords == null || words.size() < maxWords) && (line = reader.readLine()) != null) {
                final String word = line.trim();
                if (!word.isEmpty()) {
                    words.add(word.toLowerCase(Locale.ROOT));
                }
            }
        }
        logger.debug("Read {} words for dictionary '{}' from {}", words.size(), source.name(), source.location());
        return words;
    }
}
