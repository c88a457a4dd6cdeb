package ai.wordle.rank;

import ai.wordle.game.Letter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Orders candidates by a letter-frequency heuristic.
 *
 * <p>A word scores the sum of the {@link Letter#getFrequency() frequency weights} of its
 * distinct letters, so words that try many common letters rank first. Repeated letters count
 * once; characters outside the alphabet count nothing.
 *
 * <p>This is a cheap approximation, not an information-theoretic best-guess search. Ties keep
 * the order in which the words were supplied (first-seen-first), which makes the output
 * deterministic.
 */
public class CandidateRanker {

    /**
     * Scores a single word.
     */
    public double score(String word) {
        Set<Letter> distinct = EnumSet.noneOf(Letter.class);
        for (int i = 0; i < word.length(); i++) {
            Letter letter = Letter.fromChar(word.charAt(i));
            if (letter != null) {
                distinct.add(letter);
            }
        }
        double total = 0.0;
        for (Letter letter : distinct) {
            total += letter.getFrequency();
        }
        return total;
    }

    /**
     * Returns the words sorted by descending score.
     *
     * @param words candidates in their original order; not modified
     * @return a new list; equal scores keep their original relative order
     */
    public List<String> rank(Collection<String> words) {
        List<Scored> scored = new ArrayList<>(words.size());
        for (String word : words) {
            scored.add(new Scored(word, score(word)));
        }
        // List.sort is a stable merge sort.
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());
        List<String> ranked = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            ranked.add(s.word());
        }
        return ranked;
    }

    private record Scored(String word, double score) {
    }
}
