package ai.wordle.constraint;

import ai.wordle.game.Letter;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Accumulated knowledge about a single letter of the alphabet.
 * <p>
 * A letter is in exactly one of three states as far as the solution is concerned:
 * <ul>
 *   <li><b>unknown</b> — nothing has been learnt yet</li>
 *   <li><b>excluded</b> — the letter provably does not occur</li>
 *   <li><b>present</b> — the letter occurs, with some positions confirmed and/or some
 *       positions rejected</li>
 * </ul>
 * Excluded and present are mutually exclusive; {@link ConstraintEngine} refuses to mix them.
 * <p>
 * Mutators are package-private so only the engine can change an entry. The position views
 * returned to callers are unmodifiable.
 */
public final class LetterConstraint {
    private final Letter letter;
    private boolean excluded;
    /** 0-based indices where this letter is known to sit. */
    private final SortedSet<Integer> confirmedPositions = new TreeSet<>();
    /** 0-based indices where this letter is known NOT to sit, although it is present. */
    private final SortedSet<Integer> rejectedPositions = new TreeSet<>();

    LetterConstraint(Letter letter) {
        this.letter = Objects.requireNonNull(letter, "letter");
    }

    public Letter getLetter() {
        return letter;
    }

    public double getFrequency() {
        return letter.getFrequency();
    }

    public boolean isExcluded() {
        return excluded;
    }

    public SortedSet<Integer> getConfirmedPositions() {
        return Collections.unmodifiableSortedSet(confirmedPositions);
    }

    public SortedSet<Integer> getRejectedPositions() {
        return Collections.unmodifiableSortedSet(rejectedPositions);
    }

    /**
     * Whether this letter is known to occur somewhere in the solution.
     */
    public boolean isPresent() {
        return !confirmedPositions.isEmpty() || !rejectedPositions.isEmpty();
    }

    public boolean isConfirmedAt(int index) {
        return confirmedPositions.contains(index);
    }

    public boolean isRejectedAt(int index) {
        return rejectedPositions.contains(index);
    }

    void markExcluded() {
        excluded = true;
    }

    void confirmAt(int index) {
        confirmedPositions.add(index);
    }

    void rejectAt(int index) {
        rejectedPositions.add(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LetterConstraint)) return false;
        LetterConstraint that = (LetterConstraint) o;
        return letter == that.letter
                && excluded == that.excluded
                && confirmedPositions.equals(that.confirmedPositions)
                && rejectedPositions.equals(that.rejectedPositions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(letter, excluded, confirmedPositions, rejectedPositions);
    }

    @Override
    public String toString() {
        return "LetterConstraint(" + letter
                + (excluded ? " excluded" : "")
                + " confirmed=" + confirmedPositions
                + " rejected=" + rejectedPositions + ")";
    }
}
