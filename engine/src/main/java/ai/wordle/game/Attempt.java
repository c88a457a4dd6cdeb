package ai.wordle.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One guess together with the game's per-character feedback.
 *
 * <p>The record is immutable. It performs no alphabet checks of its own; it only derives the
 * three kinds of signal the constraint engine folds:
 * <ul>
 *   <li>{@link #excluded()} — positions marked {@link Marker#ELIMINATED}</li>
 *   <li>{@link #misplaced()} — positions marked {@link Marker#WRONG_POSITION}</li>
 *   <li>{@link #confirmed()} — positions marked {@link Marker#CORRECT_POSITION}</li>
 * </ul>
 *
 * <p><b>Supported input shape</b> (see {@link #parse(String, String)}): a guess such as
 * {@code irate} and a feedback string of the same length such as {@code xx..o}.
 *
 * @param guess    the guessed word
 * @param feedback one marker per character of {@code guess}
 */
public record Attempt(String guess, List<Marker> feedback) {

    public Attempt {
        Objects.requireNonNull(guess, "guess");
        Objects.requireNonNull(feedback, "feedback");
        if (feedback.size() != guess.length()) {
            throw new InvalidAttemptException("Guess '" + guess + "' has " + guess.length()
                    + " characters but " + feedback.size() + " feedback markers");
        }
        feedback = List.copyOf(feedback);
    }

    /**
     * Parses a guess and its feedback string, e.g. {@code ("irate", "xx..o")}.
     *
     * <p>Both strings are trimmed and lower-cased so {@code IRATE XX..O} is accepted too.
     *
     * @throws InvalidAttemptException if the lengths differ or a feedback character is not one
     *                                 of {@code . x o}
     */
    public static Attempt parse(String guess, String feedback) {
        if (guess == null || feedback == null) {
            throw new InvalidAttemptException("Guess and feedback are both required");
        }
        String normalisedGuess = guess.trim().toLowerCase(Locale.ROOT);
        String normalisedFeedback = feedback.trim().toLowerCase(Locale.ROOT);
        if (normalisedGuess.isEmpty()) {
            throw new InvalidAttemptException("Guess must not be blank");
        }
        if (normalisedGuess.length() != normalisedFeedback.length()) {
            throw new InvalidAttemptException("Length mismatch in pair (" + guess + ", " + feedback + "): guess has "
                    + normalisedGuess.length() + " characters, feedback has " + normalisedFeedback.length());
        }
        List<Marker> markers = new ArrayList<>(normalisedFeedback.length());
        for (int i = 0; i < normalisedFeedback.length(); i++) {
            char c = normalisedFeedback.charAt(i);
            Marker marker = Marker.fromSymbol(c);
            if (marker == null) {
                throw new InvalidAttemptException("Unknown feedback marker '" + c + "' at position " + i
                        + " in pair (" + guess + ", " + feedback + "); expected one of . x o");
            }
            markers.add(marker);
        }
        return new Attempt(normalisedGuess, markers);
    }

    /**
     * Characters the game reported as absent from the solution.
     */
    public List<LetterPosition> excluded() {
        return positionsMarked(Marker.ELIMINATED);
    }

    /**
     * Characters present in the solution but not at the guessed position.
     */
    public List<LetterPosition> misplaced() {
        return positionsMarked(Marker.WRONG_POSITION);
    }

    /**
     * Characters confirmed at their guessed position.
     */
    public List<LetterPosition> confirmed() {
        return positionsMarked(Marker.CORRECT_POSITION);
    }

    private List<LetterPosition> positionsMarked(Marker wanted) {
        List<LetterPosition> result = new ArrayList<>();
        for (int i = 0; i < feedback.size(); i++) {
            if (feedback.get(i) == wanted) {
                result.add(new LetterPosition(i, guess.charAt(i)));
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Returns the feedback markers rendered back to their command-line characters.
     */
    public String feedbackString() {
        StringBuilder sb = new StringBuilder(feedback.size());
        for (Marker marker : feedback) {
            sb.append(marker.getSymbol());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return guess + " " + feedbackString();
    }
}
