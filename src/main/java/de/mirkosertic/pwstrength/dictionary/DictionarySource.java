package de.mirkosertic.pwstrength.dictionary;

import java.nio.file.Path;

/**
 * A named word list stored as a plain text file, one word per line, most frequent word first.
 *
 * @param name     dictionary name reported on matches
 * @param location file system path of the word list
 */
public record DictionarySource(String name, Path location) {

    /**
     * Source named after the file name of {@code location}.
     */
    public static DictionarySource of(final Path location) {
        final Path fileName = location.getFileName();
        return new DictionarySource(fileName != null ? fileName.toString() : location.toString(), location);
    }
}
