package health;

// Immutable settings for a BatchRunner.
public final class HealthConfiguration {

    public static final int DEFAULT_CHUNK_SIZE = 1024;

    private final int parallelism;
    private final int chunkSize;
    private final boolean verify;
    private final boolean collectPerQuery;

    private HealthConfiguration(Builder builder) {
        this.parallelism = builder.parallelism;
        this.chunkSize = builder.chunkSize;
        this.verify = builder.verify;
        this.collectPerQuery = builder.collectPerQuery;
        validate();
    }

    public static Builder builder() { return new Builder(); }

    public static HealthConfiguration defaults() { return builder().build(); }

    private void validate() {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
    }

    public int parallelism() { return parallelism; }
    public int chunkSize() { return chunkSize; }
    public boolean verify() { return verify; }
    public boolean collectPerQuery() { return collectPerQuery; }

    @Override
    public String toString() {
        return "HealthConfiguration{parallelism=" + parallelism + ", chunkSize=" + chunkSize
                + ", verify=" + verify + ", collectPerQuery=" + collectPerQuery + "}";
    }

    public static final class Builder {
        private int parallelism = 1;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private boolean verify;
        private boolean collectPerQuery;

        private Builder() {
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        // Cross-check every strand with the brute-force scanner.
        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder collectPerQuery(boolean collectPerQuery) {
            this.collectPerQuery = collectPerQuery;
            return this;
        }

        public HealthConfiguration build() {
            return new HealthConfiguration(this);
        }
    }
}
