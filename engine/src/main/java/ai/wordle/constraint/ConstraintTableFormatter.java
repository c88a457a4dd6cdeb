package ai.wordle.constraint;

import java.util.Collection;
import java.util.Iterator;

/**
 * Renders a {@link ConstraintTable} as a diagnostic dump, one line per letter in alphabetical
 * order:
 * <pre>
 * a  excluded  confirmed -        rejected -
 * e  present   confirmed 4        rejected -
 * i  present   confirmed -        rejected 0
 * </pre>
 * Letters nothing is known about are shown as {@code unknown}.
 */
public class ConstraintTableFormatter {
    /** Width of the confirmed-positions column. */
    private static final int POSITIONS_WIDTH = 8;

    private final ConstraintTable table;

    public ConstraintTableFormatter(ConstraintTable table) {
        this.table = table;
    }

    /**
     * Renders every letter, each line terminated by {@code '\n'}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (LetterConstraint entry : table.entries()) {
            sb.append(renderLine(entry)).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders a single entry without a trailing newline.
     */
    public String renderLine(LetterConstraint entry) {
        StringBuilder sb = new StringBuilder();
        sb.append(entry.getLetter()).append("  ");
        sb.append(pad(state(entry), 10));
        sb.append("confirmed ").append(pad(positions(entry.getConfirmedPositions()), POSITIONS_WIDTH + 1));
        sb.append("rejected ").append(positions(entry.getRejectedPositions()));
        return sb.toString();
    }

    private static String state(LetterConstraint entry) {
        if (entry.isExcluded()) {
            return "excluded";
        }
        return entry.isPresent() ? "present" : "unknown";
    }

    private static String positions(Collection<Integer> positions) {
        if (positions.isEmpty()) {
            return "-";
        }
        StringBuilder sb = new StringBuilder();
        Iterator<Integer> it = positions.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append(',');
            }
        }
        return sb.toString();
    }

    private static String pad(String value, int width) {
        StringBuilder sb = new StringBuilder(value);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
