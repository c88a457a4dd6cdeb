package ai.wordle.game;

/**
 * Enumeration of the 26 letters a guess or candidate word may contain.
 * <p>
 * Each letter carries a static relative-frequency weight (percentage of occurrences in a
 * general English corpus). The weights are only used by the ranking heuristic, so they are
 * deliberately approximate and never change at runtime.
 * <p>
 * Lookup from a character is case-sensitive: only lowercase {@code a}..{@code z} are part
 * of the alphabet. Callers that accept user input normalise it first.
 */
public enum Letter {
    A('a', 8.167),
    B('b', 1.492),
    C('c', 2.782),
    D('d', 4.253),
    E('e', 12.702),
    F('f', 2.228),
    G('g', 2.015),
    H('h', 6.094),
    I('i', 6.966),
    J('j', 0.153),
    K('k', 0.772),
    L('l', 4.025),
    M('m', 2.406),
    N('n', 6.749),
    O('o', 7.507),
    P('p', 1.929),
    Q('q', 0.095),
    R('r', 5.987),
    S('s', 6.327),
    T('t', 9.056),
    U('u', 2.758),
    V('v', 0.978),
    W('w', 2.360),
    X('x', 0.150),
    Y('y', 1.974),
    Z('z', 0.074);

    private static final Letter[] VALUES = values();

    /** The lowercase character this letter stands for. */
    private final char symbol;
    /** Relative frequency weight used by the ranker. */
    private final double frequency;

    Letter(char symbol, double frequency) {
        this.symbol = symbol;
        this.frequency = frequency;
    }

    /**
     * Returns the lowercase character of this letter.
     *
     * @return the character, e.g. {@code 'e'}
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Returns the static frequency weight of this letter.
     *
     * @return the weight; larger means more common
     */
    public double getFrequency() {
        return frequency;
    }

    /**
     * Resolves a character to its letter.
     *
     * @param c the character to look up
     * @return the matching letter, or {@code null} if {@code c} is not in the alphabet
     */
    public static Letter fromChar(char c) {
        if (c < 'a' || c > 'z') {
            return null;
        }
        return VALUES[c - 'a'];
    }

    /**
     * Checks whether a character belongs to the supported alphabet.
     */
    public static boolean isLetter(char c) {
        return fromChar(c) != null;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
