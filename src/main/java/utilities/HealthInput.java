package utilities;

import health.Query;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

// Parsed contents of a health input file: genes with their weights, and the strands to score.
public record HealthInput(List<String> genes, long[] weights, List<Query> queries) {

    public HealthInput {
        genes = List.copyOf(genes);
        weights = weights.clone();
        queries = List.copyOf(queries);
    }

    @Override
    public long[] weights() {
        return weights.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HealthInput other)) {
            return false;
        }
        return genes.equals(other.genes) && Arrays.equals(weights, other.weights) && queries.equals(other.queries);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(genes, queries) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "HealthInput{genes=" + genes.size() + ", strands=" + queries.size() + "}";
    }
}
