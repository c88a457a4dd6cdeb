package ai.wordle.constraint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wordle.game.Attempt;
import ai.wordle.game.InvalidAttemptException;
import ai.wordle.game.Letter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConstraintEngine")
class ConstraintEngineTest {

    private static ConstraintEngine folded(String... pairs) {
        List<Attempt> attempts = new ArrayList<>();
        for (int i = 0; i < pairs.length; i += 2) {
            attempts.add(Attempt.parse(pairs[i], pairs[i + 1]));
        }
        ConstraintEngine engine = new ConstraintEngine(5, 5);
        engine.fold(attempts);
        return engine;
    }

    private static List<String> accepted(ConstraintEngine engine, String... words) {
        List<String> result = new ArrayList<>();
        for (String word : words) {
            if (engine.test(word)) {
                result.add(word);
            }
        }
        return result;
    }

    @Nested
    @DisplayName("Folding")
    class FoldingTests {

        @Test
        void foldsEachSignalIntoTheTable() {
            ConstraintTable table = folded("irate", "xx..o").getTable();

            assertTrue(table.get(Letter.A).isExcluded());
            assertTrue(table.get(Letter.T).isExcluded());
            assertEquals(Set.of(0), table.get(Letter.I).getRejectedPositions());
            assertEquals(Set.of(1), table.get(Letter.R).getRejectedPositions());
            assertEquals(Set.of(4), table.get(Letter.E).getConfirmedPositions());
            assertFalse(table.get(Letter.E).isExcluded());
            assertFalse(table.get(Letter.Z).isPresent());
        }

        @Test
        void mandatoryLettersAreThoseKnownPresent() {
            ConstraintEngine engine = folded("irate", "xx..o");
            assertEquals(EnumSet.of(Letter.E, Letter.I, Letter.R), engine.mandatoryLetters());
        }

        @Test
        void foldingTheSameAttemptTwiceIsIdempotent() {
            Attempt attempt = Attempt.parse("irate", "xx..o");
            ConstraintEngine once = new ConstraintEngine(5, 5);
            once.fold(List.of(attempt));
            ConstraintEngine twice = new ConstraintEngine(5, 5);
            twice.fold(List.of(attempt, attempt));
            twice.fold(List.of(attempt));

            assertEquals(once.getTable(), twice.getTable());
            assertEquals(once.mandatoryLetters(), twice.mandatoryLetters());
        }

        @Test
        void accumulatesAcrossAttempts() {
            ConstraintTable table = folded("irate", "xx..o", "crime", ".oo.o").getTable();

            assertEquals(Set.of(1), table.get(Letter.R).getConfirmedPositions());
            assertEquals(Set.of(1), table.get(Letter.R).getRejectedPositions());
            assertEquals(Set.of(2), table.get(Letter.I).getConfirmedPositions());
            assertTrue(table.get(Letter.C).isExcluded());
            assertTrue(table.get(Letter.M).isExcluded());
        }

        @Test
        void positionViewsAreReadOnly() {
            ConstraintTable table = folded("irate", "xx..o").getTable();
            assertThrows(UnsupportedOperationException.class,
                    () -> table.get(Letter.E).getConfirmedPositions().add(0));
        }
    }

    @Nested
    @DisplayName("Validation and contradictions")
    class ErrorTests {

        @Test
        void eliminatedAndConfirmedInOneAttemptIsAContradiction() {
            ConstraintEngine engine = new ConstraintEngine(4, 4);
            ContradictionException e = assertThrows(ContradictionException.class,
                    () -> engine.fold(List.of(Attempt.parse("aabb", "o.x."))));

            assertEquals('a', e.letter());
            assertEquals(1, e.recordNumber());
            assertEquals("aabb", e.guess());
        }

        @Test
        void eliminatingALetterPlacedEarlierIsAContradiction() {
            ConstraintEngine engine = new ConstraintEngine(5, 5);
            ContradictionException e = assertThrows(ContradictionException.class,
                    () -> engine.fold(List.of(Attempt.parse("crane", "..o.."), Attempt.parse("gravy", "....."))));

            assertEquals('a', e.letter());
            assertEquals(2, e.recordNumber());
        }

        @Test
        void placingALetterEliminatedEarlierIsAContradiction() {
            ConstraintEngine engine = new ConstraintEngine(5, 5);
            ContradictionException e = assertThrows(ContradictionException.class,
                    () -> engine.fold(List.of(Attempt.parse("gravy", "....."), Attempt.parse("crane", "..o.."))));

            assertEquals('a', e.letter());
            assertEquals(2, e.recordNumber());
        }

        @Test
        void misplacedAfterEliminationIsAContradiction() {
            ConstraintEngine engine = new ConstraintEngine(5, 5);
            assertThrows(ContradictionException.class,
                    () -> engine.fold(List.of(Attempt.parse("stale", "....."), Attempt.parse("beast", "..x.."))));
        }

        @Test
        void mandatoryLettersFollowTheTableAfterAContradiction() {
            ConstraintEngine engine = folded("crane", "..o..");
            assertThrows(ContradictionException.class,
                    () -> engine.fold(List.of(Attempt.parse("spite", "x...."), Attempt.parse("gravy", "....."))));

            // spite was folded before gravy failed, so s is already known present.
            assertEquals(EnumSet.of(Letter.A, Letter.S), engine.mandatoryLetters());
            assertEquals(engine.getTable().presentLetters(), List.copyOf(engine.mandatoryLetters()));
        }

        @Test
        void unsupportedCharacterFailsBeforeAnyFolding() {
            ConstraintEngine engine = new ConstraintEngine(5, 5);
            List<Attempt> attempts = List.of(Attempt.parse("irate", "xx..o"), Attempt.parse("ir4te", "....."));

            InvalidAttemptException e = assertThrows(InvalidAttemptException.class, () -> engine.fold(attempts));

            assertTrue(e.getMessage().contains("attempt 2"), e.getMessage());
            assertEquals(new ConstraintEngine(5, 5).getTable(), engine.getTable());
        }

        @Test
        void rejectsInvalidLengthWindow() {
            assertThrows(IllegalArgumentException.class, () -> new ConstraintEngine(0, 5));
            assertThrows(IllegalArgumentException.class, () -> new ConstraintEngine(6, 5));
        }
    }

    @Nested
    @DisplayName("Candidate test")
    class CandidateTests {

        @Test
        void irateScenarioKeepsOnlyConsistentWords() {
            ConstraintEngine engine = folded("irate", "xx..o");
            // crate and plate contain eliminated letters; spire keeps i and r off their rejected spots.
            assertEquals(List.of("spire"), accepted(engine, "spire", "crate", "plate"));
        }

        @Test
        void allCorrectGuessOnlyAcceptsItself() {
            ConstraintEngine engine = folded("crane", "ooooo");
            assertEquals(List.of("crane"), accepted(engine, "crank", "crane", "crone", "brane", "nacre"));
        }

        @Test
        void noAttemptsAcceptsEveryWordInTheWindow() {
            ConstraintEngine engine = new ConstraintEngine(5, 5);
            engine.fold(List.of());
            assertEquals(List.of("about", "zebra"), accepted(engine, "about", "abc", "abcdef", "zebra"));
        }

        @Test
        void lengthWindowIsInclusive() {
            ConstraintEngine engine = new ConstraintEngine(4, 6);
            assertEquals(4, engine.getMinLength());
            assertEquals(6, engine.getMaxLength());
            assertFalse(engine.test("cat"));
            assertTrue(engine.test("cats"));
            assertTrue(engine.test("catsup"));
            assertFalse(engine.test("catsups"));
            assertFalse(engine.test(null));
        }

        @Test
        void rejectsCharactersWithoutAnEntry() {
            ConstraintEngine engine = new ConstraintEngine(5, 5);
            assertFalse(engine.test("crêpe"));
            assertFalse(engine.test("Crane"));
            assertFalse(engine.test("o'neil".substring(0, 5)));
        }

        @Test
        void misplacedLetterMustAppearElsewhere() {
            ConstraintEngine engine = folded("stale", "x....");
            assertEquals(List.of("bossy"), accepted(engine, "sorry", "bossy", "hippo", "frost"));
        }

        @Test
        void confirmedSlotIsLockedAgainstOtherLetters() {
            ConstraintEngine engine = folded("crane", "..o..");
            assertEquals(List.of("flask"), accepted(engine, "plant", "flask", "aloft"));
        }

        @Test
        void presenceCheckDoesNotEnforceRepeatCount() {
            // Both e's are misplaced, which in the game means two e's; one e still passes.
            ConstraintEngine engine = folded("exert", "x.x..");
            assertTrue(engine.test("bodes"));
            assertFalse(engine.test("queen"));
        }

        @Test
        void testDoesNotChangeEngineState() {
            ConstraintEngine engine = folded("irate", "xx..o");
            Set<Letter> before = EnumSet.copyOf(engine.mandatoryLetters());
            engine.test("spire");
            engine.test("crate");
            assertEquals(before, engine.mandatoryLetters());
            assertTrue(engine.test("spire"));
        }
    }
}
