package ai.wordle;

import ai.wordle.config.FilterProperties;
import ai.wordle.constraint.ConstraintEngine;
import ai.wordle.constraint.ConstraintTableFormatter;
import ai.wordle.dictionary.DictionarySource;
import ai.wordle.game.Attempt;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WordleFilter implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(WordleFilter.class);

    private final FilterProperties properties;

    public WordleFilter(FilterProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(WordleFilter.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // Exceptions escape on purpose: Spring Boot reports them and exits with a failure status.
        execute(System.out, args);
    }

    /**
     * Filter run used by the CLI runner and by tests.
     *
     * <p>Phases, in order:
     * <ol>
     *     <li>Validate configuration and parse every attempt pair.</li>
     *     <li>Fold the attempts; a contradiction aborts before anything is printed.</li>
     *     <li>Print the constraint table.</li>
     *     <li>Stream the dictionary through the engine and print the surviving words.</li>
     * </ol>
     *
     * @param out  where the table and words are printed
     * @param args positional guess/feedback pairs; {@code --} options are ignored here
     * @return the search result, for harnesses that want to inspect it
     */
    public CandidateSearch.SearchResult execute(PrintStream out, String... args) {
        properties.validate();
        List<Attempt> attempts = AttemptArguments.parse(args);

        CandidateSearch search = new CandidateSearch(
                properties.getMin(), properties.getMax(), properties.isSort(), properties.getLimit());
        ConstraintEngine engine = search.fold(attempts);

        out.print(new ConstraintTableFormatter(engine.getTable()).render());
        out.println();

        CandidateSearch.SearchResult result;
        try (Stream<String> words = DictionarySource.open(Path.of(properties.getDictionary()))) {
            result = search.filter(engine, words);
        }
        for (String word : result.words()) {
            out.println(word);
        }
        out.flush();

        if (log.isInfoEnabled()) {
            log.info("{} attempt(s), length {}..{}: {} of {} candidates match, {} printed",
                    attempts.size(), engine.getMinLength(), engine.getMaxLength(),
                    result.accepted(), result.scanned(), result.words().size());
        }
        return result;
    }
}
