package dev.juridica.rag.index;

/**
 * How a backend applies its native threshold to the raw score.
 */
public enum ScoreComparator {

    /** Raw score is a distance; lower is better. */
    MAX_DISTANCE {
        @Override
        public boolean accepts(double rawScore, double threshold) {
            return rawScore <= threshold;
        }
    },

    /** Raw score is a similarity; higher is better. */
    MIN_SIMILARITY {
        @Override
        public boolean accepts(double rawScore, double threshold) {
            return rawScore >= threshold;
        }
    };

    public abstract boolean accepts(double rawScore, double threshold);
}
