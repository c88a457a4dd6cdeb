package ai.wordle.constraint;

import ai.wordle.game.Letter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One {@link LetterConstraint} per letter of the alphabet, created up front and keyed by
 * {@link Letter}.
 */
public final class ConstraintTable {
    private final Map<Letter, LetterConstraint> entries = new EnumMap<>(Letter.class);

    ConstraintTable() {
        for (Letter letter : Letter.values()) {
            entries.put(letter, new LetterConstraint(letter));
        }
    }

    /**
     * Returns the entry for a letter; never null.
     */
    public LetterConstraint get(Letter letter) {
        return entries.get(letter);
    }

    /**
     * Returns the entry for a character, or {@code null} if it is outside the alphabet.
     */
    public LetterConstraint get(char c) {
        Letter letter = Letter.fromChar(c);
        return letter == null ? null : entries.get(letter);
    }

    /**
     * All entries in alphabetical order.
     */
    public Collection<LetterConstraint> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    /**
     * Returns the letter confirmed at {@code index} other than {@code self}, if any.
     *
     * @param index position to inspect
     * @param self  the letter occupying the position in the candidate; ignored in the search
     * @return a different letter locked to that position, or {@code null}
     */
    public Letter lockedByOther(int index, Letter self) {
        for (LetterConstraint entry : entries.values()) {
            if (entry.getLetter() != self && entry.isConfirmedAt(index)) {
                return entry.getLetter();
            }
        }
        return null;
    }

    /**
     * Letters known to occur somewhere in the solution, alphabetically.
     */
    public List<Letter> presentLetters() {
        List<Letter> present = new ArrayList<>();
        for (LetterConstraint entry : entries.values()) {
            if (entry.isPresent()) {
                present.add(entry.getLetter());
            }
        }
        return present;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstraintTable)) return false;
        return entries.equals(((ConstraintTable) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }
}
