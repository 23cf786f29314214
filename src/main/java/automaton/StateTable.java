package automaton;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Growable node storage for an automaton under construction. State 0 is the root. Transitions are
 * keyed by symbol (a Unicode code point), so the table works for any alphabet; each state gets its
 * own primitive map to avoid boxing on the lookup path.
 *
 * <p>The table is only mutated by {@link AutomatonBuilder} and {@link FailureLinker}. Once
 * {@link AutomatonBuilder#build()} has run it is frozen into an {@link Automaton} and must not be
 * touched again.
 */
public final class StateTable {

    public static final int ROOT = 0;
    // Returned for a missing transition; also the default return value of every edge map.
    public static final int NO_STATE = -1;

    private final ObjectArrayList<Int2IntOpenHashMap> transitions;
    private final IntArrayList failure;
    private final IntArrayList depth;
    // Most states are not terminal, so output lists are allocated on first use.
    private final ObjectArrayList<List<GeneOutput>> outputs;

    public StateTable(int expectedStates) {
        int capacity = Math.max(1, expectedStates);
        this.transitions = new ObjectArrayList<>(capacity);
        this.failure = new IntArrayList(capacity);
        this.depth = new IntArrayList(capacity);
        this.outputs = new ObjectArrayList<>(capacity);
        newState(0);
    }

    // Allocates a state with no edges, no outputs and the root as provisional failure.
    int newState(int stateDepth) {
        Int2IntOpenHashMap edges = new Int2IntOpenHashMap(2);
        edges.defaultReturnValue(NO_STATE);
        transitions.add(edges);
        failure.add(ROOT);
        depth.add(stateDepth);
        outputs.add(null);
        return transitions.size() - 1;
    }

    public int size() {
        return transitions.size();
    }

    public int transition(int state, int symbol) {
        return transitions.get(state).get(symbol);
    }

    void addTransition(int state, int symbol, int child) {
        transitions.get(state).put(symbol, child);
    }

    Int2IntOpenHashMap edges(int state) {
        return transitions.get(state);
    }

    public int failure(int state) {
        return failure.getInt(state);
    }

    void setFailure(int state, int target) {
        failure.set(state, target);
    }

    public int depth(int state) {
        return depth.getInt(state);
    }

    void addOutput(int state, GeneOutput output) {
        List<GeneOutput> list = outputs.get(state);
        if (list == null) {
            list = new ArrayList<>(1);
            outputs.set(state, list);
        }
        list.add(output);
    }

    public List<GeneOutput> outputs(int state) {
        List<GeneOutput> list = outputs.get(state);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }
}
