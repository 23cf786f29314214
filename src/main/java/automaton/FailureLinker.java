package automaton;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntMaps;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

import java.util.Arrays;

import static automaton.StateTable.NO_STATE;
import static automaton.StateTable.ROOT;

/**
 * Breadth-first pass that assigns every state its failure state: the state spelling the longest
 * proper suffix of its own path that is also a path from the root.
 *
 * <p>A child's failure is derived from its parent's, so parents have to be resolved first. The FIFO
 * queue of state ids visits the trie level by level, which guarantees that.
 *
 * <p>Alongside the failure links the pass fills the output links: for each state, the nearest
 * state strictly further down its failure chain whose output set is non-empty ({@link
 * StateTable#NO_STATE} if there is none). Following output links visits exactly the non-empty
 * output sets of the failure chain, in the same order.
 */
public final class FailureLinker {

    private FailureLinker() {
    }

    /**
     * Links the table in place.
     *
     * @return the output link of every state, indexed by state id
     */
    public static int[] link(StateTable table) {
        int[] outputLink = new int[table.size()];
        Arrays.fill(outputLink, NO_STATE);

        IntArrayFIFOQueue queue = new IntArrayFIFOQueue(table.size());
        for (Int2IntMap.Entry edge : Int2IntMaps.fastIterable(table.edges(ROOT))) {
            int child = edge.getIntValue();
            table.setFailure(child, ROOT);
            queue.enqueue(child);
        }

        while (!queue.isEmpty()) {
            int state = queue.dequeueInt();
            for (Int2IntMap.Entry edge : Int2IntMaps.fastIterable(table.edges(state))) {
                int symbol = edge.getIntKey();
                int child = edge.getIntValue();

                int fallback = table.failure(state);
                while (fallback != ROOT && table.transition(fallback, symbol) == NO_STATE) {
                    fallback = table.failure(fallback);
                }
                int target = table.transition(fallback, symbol);
                int childFailure = target == NO_STATE ? ROOT : target;

                table.setFailure(child, childFailure);
                // childFailure is shallower than child, so its own output link is already final.
                outputLink[child] = table.outputs(childFailure).isEmpty()
                        ? outputLink[childFailure]
                        : childFailure;
                queue.enqueue(child);
            }
        }
        return outputLink;
    }
}
