package ai.wordle.game;

/**
 * A character observed at a 0-based position of a guess.
 *
 * @param index  position within the guess
 * @param letter the character at that position, as typed
 */
public record LetterPosition(int index, char letter) {
    public LetterPosition {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
    }

    @Override
    public String toString() {
        return letter + "@" + index;
    }
}
