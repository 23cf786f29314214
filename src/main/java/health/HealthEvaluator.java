package health;

import automaton.Automaton;
import search.HealthSum;
import search.Matcher;

import java.util.Objects;

/**
 * Scores strands against a shared automaton: the health of a strand is the sum of the weights of
 * all occurrences of genes whose index lies in the query range.
 *
 * <p>An evaluator reuses one {@link Matcher}, so it belongs to a single thread. Partial sums may
 * leave the 64-bit range; only a final health that does not fit throws {@link ArithmeticException}.
 */
public final class HealthEvaluator {

    private final Automaton automaton;
    private final Matcher matcher;
    private final RangeSum sum = new RangeSum();

    public HealthEvaluator(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
        this.matcher = new Matcher(automaton);
    }

    public static long evaluate(Automaton automaton, int start, int end, String text) {
        return new HealthEvaluator(automaton).evaluate(start, end, text);
    }

    public static long evaluate(Automaton automaton, Query query) {
        return new HealthEvaluator(automaton).evaluate(query);
    }

    public long evaluate(Query query) {
        Objects.requireNonNull(query, "query");
        return evaluate(query.start(), query.end(), query.text());
    }

    public long evaluate(int start, int end, CharSequence text) {
        Objects.requireNonNull(text, "text");
        checkRange(start, end, automaton.geneCount());
        sum.reset(start, end);
        matcher.scan(text, sum);
        return sum.total.value();
    }

    public static void checkRange(int start, int end, int geneCount) {
        if (start > end || start < 0 || end >= geneCount) {
            throw new InvalidRangeException(start, end, geneCount);
        }
    }

    public Automaton automaton() {
        return automaton;
    }

    private static final class RangeSum implements Matcher.MatchSink {
        private int start;
        private int end;
        private final HealthSum total = new HealthSum();

        void reset(int start, int end) {
            this.start = start;
            this.end = end;
            total.reset();
        }

        @Override
        public void accept(int position, int geneIndex, long weight) {
            if (geneIndex >= start && geneIndex <= end) {
                total.add(weight);
            }
        }
    }
}
