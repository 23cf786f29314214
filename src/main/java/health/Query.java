package health;

import java.util.Objects;

// A strand to score and the inclusive gene index range that counts toward its health.
public record Query(int start, int end, String text) {

    public Query {
        Objects.requireNonNull(text, "text");
    }
}
