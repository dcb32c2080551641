package de.mirkosertic.pwstrength.dictionary;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the words of a dictionary in decreasing frequency order.
 */
@FunctionalInterface
public interface WordListProvider {

    /**
     * @return lowercase words, most frequent first; duplicates are allowed
     * @throws IOException if the source is missing or unreadable
     */
    List<String> readWords(DictionarySource source) throws IOException;
}
