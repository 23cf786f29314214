package search;

import automaton.Automaton;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MatcherTest {

    private static final Automaton CLASSIC = Automaton.build(List.of("he", "she", "his", "hers"), new long[]{1, 2, 3, 4});

    @Test
    void recoversMatchesEmbeddedInLongerOnes() {
        List<Match> matches = new Matcher(CLASSIC).matches("ushers");

        assertEquals(List.of(
                new Match(3, 1, 2),   // she
                new Match(3, 0, 1),   // he, ends at the same position
                new Match(5, 3, 4)),  // hers
                matches);
    }

    @Test
    void overlappingOccurrencesAreAllReported() {
        Automaton automaton = Automaton.build(List.of("a", "aa", "aaa"), new long[]{1, 2, 3});

        List<Match> matches = new Matcher(automaton).matches("aaaa");

        assertEquals(4 + 3 + 2, matches.size());
        assertEquals(16, matches.stream().mapToLong(Match::weight).sum());
        // at the last position "aaa", "aa" and "a" all end
        assertEquals(List.of(2, 1, 0), matches.stream().filter(m -> m.position() == 3).map(Match::geneIndex).toList());
    }

    @Test
    void unknownSymbolsReturnCursorToRoot() {
        Matcher matcher = new Matcher(CLASSIC);

        matcher.step('s');
        matcher.step('h');
        assertTrue(matcher.cursor() != Automaton.ROOT);
        assertEquals(Automaton.ROOT, matcher.step('z'));
        assertEquals(2, matcher.position());
        assertTrue(matcher.matches("xyz").isEmpty());
    }

    @Test
    void mismatchFallsBackAlongFailureLinks() {
        Matcher matcher = new Matcher(CLASSIC);
        for (char c : "shi".toCharArray()) {
            matcher.step(c);
        }
        // "shi" is not a path; the cursor falls back to "hi"
        assertEquals(CLASSIC.walk("hi".codePoints().toArray()), matcher.cursor());
        matcher.step('s');
        List<Integer> genes = new ArrayList<>();
        matcher.emit((pos, gene, weight) -> genes.add(gene));
        assertEquals(List.of(2), genes);
    }

    @Test
    void scanStartsFromAFreshCursor() {
        Matcher matcher = new Matcher(CLASSIC);
        matcher.matches("sh");

        // a leftover "sh" cursor would turn this "e" into a "she" match
        assertTrue(matcher.matches("e").isEmpty());

        matcher.reset();
        assertEquals(Automaton.ROOT, matcher.cursor());
        assertEquals(-1, matcher.position());
    }

    @Test
    void scanCountsEmittedMatches() {
        Matcher matcher = new Matcher(CLASSIC);
        long[] weight = {0};

        long emitted = matcher.scan("shers", (pos, gene, w) -> weight[0] += w);

        assertEquals(3, emitted);
        assertEquals(7, weight[0]);
    }

    @Test
    void supplementaryCodePointsAreSingleSymbols() {
        Automaton automaton = Automaton.build(List.of("😀", "😀😀"), new long[]{1, 10});

        List<Match> matches = new Matcher(automaton).matches("a😀😀");

        assertEquals(List.of(new Match(1, 0, 1), new Match(2, 1, 10), new Match(2, 0, 1)), matches);
    }

    @Test
    void scansSymbolArrays() {
        Automaton automaton = Automaton.build(List.of(new Gene(new int[]{1000, 2000}, 0, 5)));
        long[] total = {0};

        new Matcher(automaton).scan(new int[]{1000, 2000, 1000, 2000, 7}, (pos, gene, w) -> total[0] += w);

        assertEquals(10, total[0]);
    }

    @Test
    void emptyAutomatonNeverMatches() {
        Automaton empty = Automaton.build(List.of(), new long[0]);

        assertTrue(new Matcher(empty).matches("anything").isEmpty());
    }
}
