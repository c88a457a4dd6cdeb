package ai.wordle;

import ai.wordle.constraint.ConstraintEngine;
import ai.wordle.game.Attempt;
import ai.wordle.rank.CandidateRanker;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes the constraint engine, the candidate stream and the ranker.
 *
 * <p>The search runs in two clearly separated phases so callers can show the folded
 * constraints before any dictionary I/O happens:
 * <ol>
 *     <li>{@link #fold(List)} builds a {@link ConstraintEngine} from the attempts.</li>
 *     <li>{@link #filter(ConstraintEngine, Stream)} scans the candidates in source order,
 *         optionally ranks the survivors, and applies the output cap.</li>
 * </ol>
 *
 * <p>The cap emits exactly {@code limit} words. Without ranking the scan stops as soon as the
 * cap is reached; with ranking every candidate has to be seen first.
 */
public class CandidateSearch {
    private static final Logger log = LoggerFactory.getLogger(CandidateSearch.class);

    private final int minLength;
    private final int maxLength;
    private final boolean sort;
    /** Maximum number of results; zero means unlimited. */
    private final int limit;
    private final CandidateRanker ranker;

    public CandidateSearch(int minLength, int maxLength, boolean sort, int limit) {
        this(minLength, maxLength, sort, limit, new CandidateRanker());
    }

    public CandidateSearch(int minLength, int maxLength, boolean sort, int limit, CandidateRanker ranker) {
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.sort = sort;
        this.limit = limit;
        this.ranker = ranker;
    }

    /**
     * Creates an engine for the configured length window and folds the attempts into it.
     */
    public ConstraintEngine fold(List<Attempt> attempts) {
        ConstraintEngine engine = new ConstraintEngine(minLength, maxLength);
        engine.fold(attempts);
        return engine;
    }

    /**
     * Filters candidates through a folded engine.
     *
     * @param engine     engine returned by {@link #fold(List)}
     * @param candidates words in source order; consumed but not closed
     */
    public SearchResult filter(ConstraintEngine engine, Stream<String> candidates) {
        List<String> accepted = new ArrayList<>();
        int scanned = 0;
        boolean stopEarly = !sort && limit > 0;

        Iterator<String> it = candidates.iterator();
        while (it.hasNext()) {
            String word = it.next();
            scanned++;
            if (engine.test(word)) {
                accepted.add(word);
                if (stopEarly && accepted.size() >= limit) {
                    break;
                }
            }
        }
        int acceptedCount = accepted.size();

        List<String> ordered = sort ? ranker.rank(accepted) : accepted;
        if (limit > 0 && ordered.size() > limit) {
            ordered = ordered.subList(0, limit);
        }

        if (log.isDebugEnabled()) {
            log.debug("Scanned {} candidates, {} accepted, {} emitted (sort={}, limit={})",
                    scanned, acceptedCount, ordered.size(), sort, limit);
        }
        return new SearchResult(ordered, scanned, acceptedCount);
    }

    /**
     * Convenience for {@link #fold(List)} followed by {@link #filter(ConstraintEngine, Stream)}.
     */
    public SearchResult search(List<Attempt> attempts, Stream<String> candidates) {
        return filter(fold(attempts), candidates);
    }

    /**
     * Outcome of one search.
     *
     * @param words    emitted words, in output order
     * @param scanned  number of candidates read from the source
     * @param accepted number of scanned candidates that passed the constraint test
     */
    public record SearchResult(List<String> words, int scanned, int accepted) {
        public SearchResult {
            words = List.copyOf(words);
        }
    }
}
