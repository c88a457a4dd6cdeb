package ai.wordle.constraint;

/**
 * Thrown when the feedback contradicts itself: a letter reported as absent is also reported
 * as present (confirmed or misplaced), either within one attempt or across attempts.
 * <p>
 * Filtering after such input would silently return wrong candidates, so folding stops here.
 */
public class ContradictionException extends IllegalStateException {
    private final int recordNumber;
    private final String guess;
    private final char letter;

    /**
     * @param recordNumber 1-based number of the attempt that exposed the contradiction
     * @param guess        the guess of that attempt
     * @param letter       the contradicted letter
     * @param detail       what was asserted about the letter
     */
    public ContradictionException(int recordNumber, String guess, char letter, String detail) {
        super("Contradictory feedback in attempt " + recordNumber + " (" + guess + "): letter '"
                + letter + "' " + detail);
        this.recordNumber = recordNumber;
        this.guess = guess;
        this.letter = letter;
    }

    public int recordNumber() {
        return recordNumber;
    }

    public String guess() {
        return guess;
    }

    public char letter() {
        return letter;
    }
}
