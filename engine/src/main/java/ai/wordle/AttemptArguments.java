package ai.wordle;

import ai.wordle.game.Attempt;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns positional command-line arguments into {@link Attempt}s.
 *
 * <p>Arguments come in pairs, guess first: {@code irate xx..o crone .x..o}. Spring-style
 * options ({@code --name=value}) are configuration, not attempts, and are skipped.
 */
public final class AttemptArguments {
    static final String USAGE =
            "usage: wordle-filter [--min=N] [--max=N] [--limit=N] [--sort=true] [--dictionary=PATH]"
                    + " [GUESS FEEDBACK]...   (feedback: . eliminated, x wrong position, o correct)";

    private AttemptArguments() {
    }

    /**
     * Parses every guess/feedback pair.
     *
     * @throws IllegalArgumentException if the positional arguments do not pair up
     * @throws ai.wordle.game.InvalidAttemptException if a pair is malformed
     */
    public static List<Attempt> parse(String... args) {
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            if (arg == null || arg.startsWith("--")) {
                continue;
            }
            positional.add(arg);
        }
        if (positional.size() % 2 != 0) {
            throw new IllegalArgumentException("Expected guess/feedback pairs but got " + positional.size()
                    + " arguments " + positional + "\n" + USAGE);
        }
        List<Attempt> attempts = new ArrayList<>(positional.size() / 2);
        for (int i = 0; i < positional.size(); i += 2) {
            attempts.add(Attempt.parse(positional.get(i), positional.get(i + 1)));
        }
        return Collections.unmodifiableList(attempts);
    }
}
