package ai.wordle.constraint;

import ai.wordle.game.Attempt;
import ai.wordle.game.InvalidAttemptException;
import ai.wordle.game.Letter;
import ai.wordle.game.LetterPosition;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds guess/feedback attempts into a {@link ConstraintTable} and tests candidate words
 * against it.
 *
 * <p>The engine owns its table. Folding mutates it; {@link #test(String)} only reads it, so
 * once folding is finished the engine may be shared by concurrent filter tasks.
 *
 * <p><b>Folding rules</b>, applied per attempt in input order:
 * <ol>
 *     <li>every eliminated character marks its letter excluded;</li>
 *     <li>every confirmed character adds its index to the letter's confirmed positions;</li>
 *     <li>every misplaced character adds its index to the letter's rejected positions.</li>
 * </ol>
 * Exclusions go first, so a letter that is both eliminated and confirmed within one attempt
 * (for example {@code aabb / o.x.}) is a contradiction. Position sets deduplicate, which makes
 * folding the same attempt twice a no-op.
 *
 * <p><b>Known limitation:</b> a present letter is satisfied by a single occurrence. A letter
 * confirmed at two positions does not force a candidate to repeat it, although the locked
 * positions usually do.
 */
public class ConstraintEngine {
    private static final Logger log = LoggerFactory.getLogger(ConstraintEngine.class);

    private final ConstraintTable table = new ConstraintTable();
    private final int minLength;
    private final int maxLength;
    /** Number of attempts folded so far, used to number attempts in error messages. */
    private int foldedRecords;

    /**
     * @param minLength minimum accepted word length (at least 1)
     * @param maxLength maximum accepted word length (at least {@code minLength})
     */
    public ConstraintEngine(int minLength, int maxLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException("min length must be at least 1, was " + minLength);
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException(
                    "max length " + maxLength + " is smaller than min length " + minLength);
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public ConstraintTable getTable() {
        return table;
    }

    /**
     * Folds attempts into the constraint table.
     *
     * <p>All attempts are validated against the alphabet before the table is touched, so an
     * invalid attempt leaves the engine unchanged. A contradiction stops folding part-way; the
     * engine must be discarded after one.
     *
     * @throws InvalidAttemptException if a guess contains a character outside the alphabet
     * @throws ContradictionException  if a letter is asserted both absent and present
     */
    public void fold(List<Attempt> attempts) {
        for (int i = 0; i < attempts.size(); i++) {
            validate(foldedRecords + i + 1, attempts.get(i));
        }
        for (Attempt attempt : attempts) {
            foldedRecords++;
            foldOne(foldedRecords, attempt);
        }
    }

    private void validate(int recordNumber, Attempt attempt) {
        String guess = attempt.guess();
        for (int i = 0; i < guess.length(); i++) {
            char c = guess.charAt(i);
            if (!Letter.isLetter(c)) {
                throw new InvalidAttemptException("Unsupported character '" + c + "' at position " + i
                        + " of attempt " + recordNumber + " (" + attempt + ")");
            }
        }
    }

    private void foldOne(int recordNumber, Attempt attempt) {
        String guess = attempt.guess();

        for (LetterPosition excluded : attempt.excluded()) {
            LetterConstraint entry = table.get(excluded.letter());
            if (entry.isPresent()) {
                throw new ContradictionException(recordNumber, guess, excluded.letter(),
                        "is eliminated but earlier attempts placed it at " + describePositions(entry));
            }
            entry.markExcluded();
        }

        for (LetterPosition confirmed : attempt.confirmed()) {
            LetterConstraint entry = table.get(confirmed.letter());
            if (entry.isExcluded()) {
                throw new ContradictionException(recordNumber, guess, confirmed.letter(),
                        "is confirmed at position " + confirmed.index() + " but was eliminated");
            }
            entry.confirmAt(confirmed.index());
        }

        for (LetterPosition misplaced : attempt.misplaced()) {
            LetterConstraint entry = table.get(misplaced.letter());
            if (entry.isExcluded()) {
                throw new ContradictionException(recordNumber, guess, misplaced.letter(),
                        "is misplaced at position " + misplaced.index() + " but was eliminated");
            }
            entry.rejectAt(misplaced.index());
        }

        if (log.isDebugEnabled()) {
            log.debug("Folded attempt {}: {} (excluded={}, confirmed={}, misplaced={})",
                    recordNumber, attempt, attempt.excluded(), attempt.confirmed(), attempt.misplaced());
        }
    }

    private static String describePositions(LetterConstraint entry) {
        return "confirmed " + entry.getConfirmedPositions() + ", rejected " + entry.getRejectedPositions();
    }

    /**
     * Letters known to occur in the solution: at least one confirmed or rejected position.
     * Read from the table on every call, so it always agrees with {@link #getTable()}.
     *
     * @return an unmodifiable set, alphabetically ordered
     */
    public Set<Letter> mandatoryLetters() {
        Set<Letter> letters = EnumSet.noneOf(Letter.class);
        letters.addAll(table.presentLetters());
        return Collections.unmodifiableSet(letters);
    }

    /**
     * Tests whether a word is consistent with every folded attempt.
     *
     * @param word candidate word; {@code null} is rejected
     * @return {@code true} if the word is still a possible solution
     */
    public boolean test(String word) {
        if (word == null || word.length() < minLength || word.length() > maxLength) {
            return false;
        }
        Set<Letter> pending = EnumSet.noneOf(Letter.class);
        pending.addAll(table.presentLetters());

        for (int i = 0; i < word.length(); i++) {
            LetterConstraint entry = table.get(word.charAt(i));
            if (entry == null || entry.isExcluded() || entry.isRejectedAt(i)) {
                return false;
            }
            if (table.lockedByOther(i, entry.getLetter()) != null) {
                return false;
            }
            pending.remove(entry.getLetter());
        }
        return pending.isEmpty();
    }
}
