package com.eainde.vocab.extraction;

/**
 * Tuning knobs for {@link CandidateExtractor}.
 *
 * <pre>
 * ExtractionOptions options = ExtractionOptions.builder()
 *         .topK(40)
 *         .minFreq(1)
 *         .allowPhrases(true)
 *         .maxNgramLen(3)
 *         .build();
 * </pre>
 */
public final class ExtractionOptions {

    public static final int DEFAULT_TOP_K = 80;
    public static final int DEFAULT_MIN_FREQ = 2;
    public static final int DEFAULT_MAX_NGRAM_LEN = 3;

    private final int topK;
    private final int minFreq;
    private final boolean allowPhrases;
    private final int maxNgramLen;

    private ExtractionOptions(Builder builder) {
        this.topK = builder.topK;
        this.minFreq = builder.minFreq;
        this.allowPhrases = builder.allowPhrases;
        this.maxNgramLen = builder.maxNgramLen;

        if (topK < 0) throw new IllegalArgumentException("topK must be >= 0, was " + topK);
        if (minFreq < 1) throw new IllegalArgumentException("minFreq must be >= 1, was " + minFreq);
    }

    public static ExtractionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int topK() { return topK; }
    public int minFreq() { return minFreq; }
    public boolean allowPhrases() { return allowPhrases; }

    /**
     * @return the configured n-gram length, never below 2
     */
    public int maxNgramLen() { return Math.max(2, maxNgramLen); }

    @Override
    public String toString() {
        return "ExtractionOptions[topK=" + topK + ", minFreq=" + minFreq
                + ", allowPhrases=" + allowPhrases + ", maxNgramLen=" + maxNgramLen + "]";
    }

    public static final class Builder {
        private int topK = DEFAULT_TOP_K;
        private int minFreq = DEFAULT_MIN_FREQ;
        private boolean allowPhrases = true;
        private int maxNgramLen = DEFAULT_MAX_NGRAM_LEN;

        private Builder() {
        }

        public Builder topK(int topK) {
            this.topK = topK;
            return this;
        }

        public Builder minFreq(int minFreq) {
            this.minFreq = minFreq;
            return this;
        }

        public Builder allowPhrases(boolean allowPhrases) {
            this.allowPhrases = allowPhrases;
            return this;
        }

        public Builder maxNgramLen(int maxNgramLen) {
            this.maxNgramLen = maxNgramLen;
            return this;
        }

        public ExtractionOptions build() {
            return new ExtractionOptions(this);
        }
    }
}
