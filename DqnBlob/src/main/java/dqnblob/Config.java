package dqnblob;

import java.util.Properties;

public class Config {
    // Network parameters
    public final int hiddenDim;

    // Replay Buffer parameters
    public final int bufferSize;
    public final int batchSize;

    // Training parameters
    public final double gamma;      // Discount factor
    public final double lr;         // Learning rate
    public final int targetUpdateEvery; // Episodes between hard target-network syncs

    // Epsilon-greedy parameters
    public final double epsilonStart;
    public final double epsilonEnd;
    public final double epsilonDecay;

    // Training loop parameters
    public final int numEpisodes;
    public final int logEvery;

    // Other
    public final long randomSeed;

    private Config(Builder b) {
        this.hiddenDim = b.hiddenDim;
        this.bufferSize = b.bufferSize;
        this.batchSize = b.batchSize;
        this.gamma = b.gamma;
        this.lr = b.lr;
        this.targetUpdateEvery = b.targetUpdateEvery;
        this.epsilonStart = b.epsilonStart;
        this.epsilonEnd = b.epsilonEnd;
        this.epsilonDecay = b.epsilonDecay;
        this.numEpisodes = b.numEpisodes;
        this.logEvery = b.logEvery;
        this.randomSeed = b.randomSeed != null ? b.randomSeed : System.currentTimeMillis();
    }

    public static Config defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // Defaults overlaid with any dqn.* keys, e.g. dqn.seed=42
    public static Config fromProperties(Properties props) {
        return new Builder().apply(props).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .hiddenDim(hiddenDim)
                .bufferSize(bufferSize)
                .batchSize(batchSize)
                .gamma(gamma)
                .lr(lr)
                .targetUpdateEvery(targetUpdateEvery)
                .epsilonStart(epsilonStart)
                .epsilonEnd(epsilonEnd)
                .epsilonDecay(epsilonDecay)
                .numEpisodes(numEpisodes)
                .logEvery(logEvery)
                .randomSeed(randomSeed);
    }

    @Override
    public String toString() {
        return String.format("Config(hiddenDim=%d, bufferSize=%d, batchSize=%d, gamma=%.3f, lr=%.1e, "
                        + "targetUpdateEvery=%d, epsilon=%.2f->%.3f x%.4f, episodes=%d, seed=%d)",
                hiddenDim, bufferSize, batchSize, gamma, lr, targetUpdateEvery,
                epsilonStart, epsilonEnd, epsilonDecay, numEpisodes, randomSeed);
    }

    public static class Builder {
        private int hiddenDim = 128;
        private int bufferSize = 50000;
        private int batchSize = 64;
        private double gamma = 0.99;
        private double lr = 1e-3;
        private int targetUpdateEvery = 10;
        private double epsilonStart = 1.0;
        private double epsilonEnd = 0.01;
        private double epsilonDecay = 0.995;
        private int numEpisodes = 800;
        private int logEvery = 50;
        private Long randomSeed;

        public Builder hiddenDim(int hiddenDim) {
            this.hiddenDim = hiddenDim;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder gamma(double gamma) {
            this.gamma = gamma;
            return this;
        }

        public Builder lr(double lr) {
            this.lr = lr;
            return this;
        }

        public Builder targetUpdateEvery(int targetUpdateEvery) {
            this.targetUpdateEvery = targetUpdateEvery;
            return this;
        }

        public Builder epsilonStart(double epsilonStart) {
            this.epsilonStart = epsilonStart;
            return this;
        }

        public Builder epsilonEnd(double epsilonEnd) {
            this.epsilonEnd = epsilonEnd;
            return this;
        }

        public Builder epsilonDecay(double epsilonDecay) {
            this.epsilonDecay = epsilonDecay;
            return this;
        }

        public Builder numEpisodes(int numEpisodes) {
            this.numEpisodes = numEpisodes;
            return this;
        }

        public Builder logEvery(int logEvery) {
            this.logEvery = logEvery;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        public Builder apply(Properties props) {
            hiddenDim = intProp(props, "dqn.hiddenDim", hiddenDim);
            bufferSize = intProp(props, "dqn.bufferSize", bufferSize);
            batchSize = intProp(props, "dqn.batchSize", batchSize);
            gamma = doubleProp(props, "dqn.gamma", gamma);
            lr = doubleProp(props, "dqn.lr", lr);
            targetUpdateEvery = intProp(props, "dqn.targetUpdateEvery", targetUpdateEvery);
            epsilonStart = doubleProp(props, "dqn.epsilonStart", epsilonStart);
            epsilonEnd = doubleProp(props, "dqn.epsilonEnd", epsilonEnd);
            epsilonDecay = doubleProp(props, "dqn.epsilonDecay", epsilonDecay);
            numEpisodes = intProp(props, "dqn.numEpisodes", numEpisodes);
            logEvery = intProp(props, "dqn.logEvery", logEvery);
            String seed = props.getProperty("dqn.seed");
            if (seed != null && !seed.trim().isEmpty()) {
                randomSeed = Long.parseLong(seed.trim());
            }
            return this;
        }

        public Config build() {
            if (hiddenDim <= 0) {
                throw new IllegalArgumentException("hiddenDim must be positive, got " + hiddenDim);
            }
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
            }
            if (bufferSize < batchSize) {
                throw new IllegalArgumentException("bufferSize " + bufferSize + " cannot hold a batch of " + batchSize);
            }
            if (gamma < 0 || gamma > 1) {
                throw new IllegalArgumentException("gamma must be in [0, 1], got " + gamma);
            }
            if (!(lr > 0)) {
                throw new IllegalArgumentException("lr must be positive, got " + lr);
            }
            if (targetUpdateEvery <= 0) {
                throw new IllegalArgumentException("targetUpdateEvery must be positive, got " + targetUpdateEvery);
            }
            if (epsilonEnd < 0 || epsilonEnd > epsilonStart || epsilonStart > 1) {
                throw new IllegalArgumentException("epsilon bounds must satisfy 0 <= end <= start <= 1, got "
                        + epsilonStart + " / " + epsilonEnd);
            }
            if (!(epsilonDecay > 0) || epsilonDecay > 1) {
                throw new IllegalArgumentException("epsilonDecay must be in (0, 1], got " + epsilonDecay);
            }
            if (numEpisodes < 0) {
                throw new IllegalArgumentException("numEpisodes must not be negative, got " + numEpisodes);
            }
            if (logEvery <= 0) {
                throw new IllegalArgumentException("logEvery must be positive, got " + logEvery);
            }
            return new Config(this);
        }

        private static double doubleProp(Properties props, String key, double fallback) {
            String value = props.getProperty(key);
            return value == null ? fallback : Double.parseDouble(value.trim());
        }

        private static int intProp(Properties props, String key, int fallback) {
            String value = props.getProperty(key);
            return value == null ? fallback : Integer.parseInt(value.trim());
        }
    }
}
