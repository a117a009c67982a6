package dqnblob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

// Two blobs, one pellet pool. Blob 1 is resolved first each tick and wins contested pellets.
// Observation: x, y, heading, mass, opponent distance and bearing, food distance and bearing
public class CompeteEnv extends BlobWorld {
    private static final Logger log = LoggerFactory.getLogger(CompeteEnv.class);

    public static final int STATE_SIZE = 8;
    static final int MAX_SPAWN_ATTEMPTS = 10_000;

    private final Blob blob1 = new Blob();
    private final Blob blob2 = new Blob();

    public CompeteEnv(EnvConfig config, long seed) {
        this(config, new Random(seed));
    }

    public CompeteEnv(EnvConfig config) {
        this(config, new Random());
    }

    private CompeteEnv(EnvConfig config, Random random) {
        super(config, random);
        double spawnSide = config.mapSize - 2 * config.agentSpawnInset;
        if (spawnSide <= 0) {
            throw new IllegalArgumentException("agentSpawnInset " + config.agentSpawnInset
                    + " leaves no spawn region on a map of size " + config.mapSize);
        }
        if (Math.sqrt(2) * spawnSide <= minSpawnSeparation()) {
            throw new IllegalArgumentException("Spawn region of side " + spawnSide
                    + " cannot place two blobs more than " + minSpawnSeparation() + " apart");
        }
        log.info("Initialized CompeteEnv (State Size: {}, Action Size: {}, Max Steps: {})",
                STATE_SIZE, Action.COUNT, config.maxSteps);
        log.debug("{}", config);
    }

    @Override
    public int stateSize() {
        return STATE_SIZE;
    }

    private double minSpawnSeparation() {
        return config.mapSize / 3;
    }

    public double[][] reset(long seed) {
        reseed(seed);
        return reset();
    }

    public double[][] reset() {
        double low = config.agentSpawnInset;
        double high = config.mapSize - config.agentSpawnInset;

        blob1.place(uniform(low, high), uniform(low, high), randomHeading(), config.initialMass);
        double x2 = uniform(low, high);
        double y2 = uniform(low, high);
        int attempts = 1;
        while (Geometry.distance(blob1.getX(), blob1.getY(), x2, y2) <= minSpawnSeparation()) {
            if (attempts++ >= MAX_SPAWN_ATTEMPTS) {
                throw new IllegalStateException("Could not place blob 2 more than " + minSpawnSeparation()
                        + " away from blob 1 after " + MAX_SPAWN_ATTEMPTS + " attempts");
            }
            x2 = uniform(low, high);
            y2 = uniform(low, high);
        }
        blob2.place(x2, y2, randomHeading(), config.initialMass);

        spawnAllPellets();
        stepsTaken = 0;
        return new double[][]{observe(blob1, blob2), observe(blob2, blob1)};
    }

    public StepResult step(int action1, int action2) {
        return step(Action.fromIndex(action1), Action.fromIndex(action2));
    }

    public StepResult step(Action action1, Action action2) {
        if (action1 == null || action2 == null) {
            throw new IllegalArgumentException("actions must not be null");
        }
        stepsTaken++;

        advance(blob1, action1);
        advance(blob2, action2);

        blob1.decay(config.massDecayRate);
        blob2.decay(config.massDecayRate);

        double[] rewards = {config.survivalReward, config.survivalReward};

        int[] collected = collectPellets(blob1, blob2);
        rewards[0] += collected[0] * config.pickupReward;
        rewards[1] += collected[1] * config.pickupReward;

        stealMass();
        replenishPellets();

        boolean blob1Dead = blob1.isStarved(config.minMass);
        boolean blob2Dead = blob2.isStarved(config.minMass);
        boolean terminated = blob1Dead || blob2Dead;
        boolean truncated = timeLimitReached();

        int winner = EpisodeOutcome.DRAW;
        if (blob2Dead && !blob1Dead) {
            winner = 1;
        } else if (blob1Dead && !blob2Dead) {
            winner = 2;
        }

        double[][] nextStates = {observe(blob1, blob2), observe(blob2, blob1)};
        return new StepResult(nextStates, rewards, terminated, truncated, new EpisodeOutcome(winner, blob1, blob2));
    }

    // Overlapping blobs: the heavier one drains massStealRate from the lighter one
    private void stealMass() {
        if (config.massStealRate <= 0 || blob1.distanceTo(blob2) >= 2 * config.agentRadius) {
            return;
        }
        if (blob1.getMass() > blob2.getMass()) {
            blob1.transferMass(config.massStealRate);
            blob2.transferMass(-config.massStealRate);
        } else if (blob2.getMass() > blob1.getMass()) {
            blob2.transferMass(config.massStealRate);
            blob1.transferMass(-config.massStealRate);
        }
    }

    private double[] observe(Blob self, Blob other) {
        double maxDistance = config.maxDistance();
        double distanceToOther = self.distanceTo(other) / maxDistance;
        double bearingToOther = Geometry.relativeBearing(self.getX(), self.getY(), self.getAngle(), other.getX(), other.getY());

        double distanceToFood = 1.0;
        double bearingToFood = 0.0;
        Pellet nearest = nearestPellet(self);
        if (nearest != null) {
            distanceToFood = nearest.distanceTo(self) / maxDistance;
            bearingToFood = Geometry.relativeBearing(self.getX(), self.getY(), self.getAngle(), nearest.getX(), nearest.getY());
        }

        return new double[]{
                self.getX() / config.mapSize,
                self.getY() / config.mapSize,
                self.getAngle(),
                normalizedMass(self),
                distanceToOther,
                bearingToOther,
                distanceToFood,
                bearingToFood
        };
    }

    public Blob getBlob1() {
        return blob1;
    }

    public Blob getBlob2() {
        return blob2;
    }

    void placeBlobs(double x1, double y1, double angle1, double mass1,
                    double x2, double y2, double angle2, double mass2) {
        blob1.place(x1, y1, angle1, mass1);
        blob2.place(x2, y2, angle2, mass2);
    }

    // Result of one tick, per-blob arrays indexed 0 for blob 1 and 1 for blob 2
    public static class StepResult {
        public final double[][] nextStates;
        public final double[] rewards;
        public final boolean terminated;
        public final boolean truncated;
        public final EpisodeOutcome outcome;

        public StepResult(double[][] nextStates, double[] rewards, boolean terminated, boolean truncated, EpisodeOutcome outcome) {
            this.nextStates = nextStates;
            this.rewards = rewards;
            this.terminated = terminated;
            this.truncated = truncated;
            this.outcome = outcome;
        }

        public boolean isDone() {
            return terminated || truncated;
        }
    }
}
