package ai.wordle.dictionary;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams candidate words from a newline-delimited word list.
 *
 * <p>Lines are read lazily in file order. Trailing whitespace (including a stray {@code \r})
 * is stripped and blank lines are skipped. Nothing else is normalised: a capitalised proper
 * noun is passed on as-is and simply fails the constraint test.
 */
public final class DictionarySource {
    private static final Logger log = LoggerFactory.getLogger(DictionarySource.class);

    private DictionarySource() {
    }

    /**
     * Opens the word list at {@code path}.
     *
     * <p>The returned stream holds the file open; close it, preferably with
     * try-with-resources.
     *
     * @throws UncheckedIOException if the file cannot be opened, or later if reading fails
     */
    public static Stream<String> open(Path path) {
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read dictionary " + path, e);
        }
        if (log.isDebugEnabled()) {
            log.debug("Reading dictionary {}", path);
        }
        return lines(reader).onClose(() -> {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot close dictionary " + path, e);
            }
        });
    }

    /**
     * Streams words from an already open reader. The caller owns the reader.
     */
    public static Stream<String> lines(BufferedReader reader) {
        return reader.lines()
                .map(String::stripTrailing)
                .filter(line -> !line.isEmpty());
    }
}
