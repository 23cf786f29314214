package automaton;

// One entry of a state's output set: a gene that ends exactly at that state.
public record GeneOutput(int geneIndex, long weight) {
}
