package ai.wordle.game;

/**
 * Per-character outcome reported by the game for one position of a guess.
 */
public enum Marker {
    /** The letter does not occur in the solution ({@code .}). */
    ELIMINATED('.'),
    /** The letter occurs in the solution, but not at this position ({@code x}). */
    WRONG_POSITION('x'),
    /** The letter is at this exact position in the solution ({@code o}). */
    CORRECT_POSITION('o');

    private final char symbol;

    Marker(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the character used for this marker on the command line.
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Resolves a feedback character to its marker.
     *
     * @param c the feedback character
     * @return the marker, or {@code null} if {@code c} is not one of {@code . x o}
     */
    public static Marker fromSymbol(char c) {
        for (Marker marker : values()) {
            if (marker.symbol == c) {
                return marker;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
