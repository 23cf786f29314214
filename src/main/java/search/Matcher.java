package search;

import automaton.Automaton;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static automaton.Automaton.NO_STATE;
import static automaton.Automaton.ROOT;

/**
 * Streams a text through an {@link Automaton} and reports, at every position, every gene
 * occurrence ending there, overlapping and nested ones included.
 *
 * <p>A matcher owns a single cursor and is not thread-safe. The automaton it reads is never
 * modified, so concurrent searches just use one matcher each.
 */
public final class Matcher {

    /** Receives matches in text order. */
    @FunctionalInterface
    public interface MatchSink {
        void accept(int position, int geneIndex, long weight);
    }

    private final Automaton automaton;
    private int cursor = ROOT;
    private int position = -1;

    public Matcher(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton");
    }

    public void reset() {
        cursor = ROOT;
        position = -1;
    }

    public int cursor() {
        return cursor;
    }

    // Offset of the last consumed symbol, -1 before the first step.
    public int position() {
        return position;
    }

    /**
     * Consumes one symbol. Falls back along failure links until a state with a transition on the
     * symbol is found; if even the root has none the cursor stays at the root.
     *
     * @return the new cursor state
     */
    public int step(int symbol) {
        int state = cursor;
        int next = automaton.transition(state, symbol);
        while (next == NO_STATE && state != ROOT) {
            state = automaton.failure(state);
            next = automaton.transition(state, symbol);
        }
        cursor = next == NO_STATE ? ROOT : next;
        position++;
        return cursor;
    }

    /**
     * Reports every gene ending at the current position: the outputs of the cursor and of every
     * state on its failure chain down to the root.
     *
     * @return number of matches reported
     */
    public int emit(MatchSink sink) {
        int emitted = 0;
        int state = automaton.outputCount(cursor) > 0 ? cursor : automaton.outputLink(cursor);
        while (state != NO_STATE) {
            int n = automaton.outputCount(state);
            for (int i = 0; i < n; i++) {
                sink.accept(position, automaton.outputGene(state, i), automaton.outputWeight(state, i));
            }
            emitted += n;
            state = automaton.outputLink(state);
        }
        return emitted;
    }

    /** Scans {@code text} code point by code point from a fresh cursor. */
    public long scan(CharSequence text, MatchSink sink) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(sink, "sink");
        reset();
        long emitted = 0;
        for (int i = 0; i < text.length(); ) {
            int symbol = Character.codePointAt(text, i);
            i += Character.charCount(symbol);
            step(symbol);
            emitted += emit(sink);
        }
        return emitted;
    }

    public long scan(int[] symbols, MatchSink sink) {
        Objects.requireNonNull(symbols, "symbols");
        Objects.requireNonNull(sink, "sink");
        reset();
        long emitted = 0;
        for (int symbol : symbols) {
            step(symbol);
            emitted += emit(sink);
        }
        return emitted;
    }

    public List<Match> matches(CharSequence text) {
        List<Match> out = new ArrayList<>();
        scan(text, (pos, gene, weight) -> out.add(new Match(pos, gene, weight)));
        return out;
    }
}
