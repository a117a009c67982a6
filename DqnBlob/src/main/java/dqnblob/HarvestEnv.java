package dqnblob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

// Solo harvesting. Observation: x, y, heading, food bearing, food distance, mass
public class HarvestEnv extends BlobWorld {
    private static final Logger log = LoggerFactory.getLogger(HarvestEnv.class);

    public static final int STATE_SIZE = 6;

    private final Blob blob = new Blob();
    // Nearest-pellet distance at the end of the previous tick, for distance shaping
    private double prevDistanceToFood;

    public HarvestEnv(EnvConfig config, long seed) {
        this(config, new Random(seed));
    }

    public HarvestEnv(EnvConfig config) {
        this(config, new Random());
    }

    private HarvestEnv(EnvConfig config, Random random) {
        super(config, random);
        log.info("Initialized HarvestEnv (State Size: {}, Action Size: {}, Max Steps: {})",
                STATE_SIZE, Action.COUNT, config.maxSteps);
        log.debug("{}", config);
    }

    @Override
    public int stateSize() {
        return STATE_SIZE;
    }

    public double[] reset(long seed) {
        reseed(seed);
        return reset();
    }

    public double[] reset() {
        double centre = config.mapSize / 2;
        blob.place(centre, centre, randomHeading(), config.initialMass);
        spawnAllPellets();
        stepsTaken = 0;
        prevDistanceToFood = distanceToNearestPellet();
        return observe();
    }

    public StepResult step(int action) {
        return step(Action.fromIndex(action));
    }

    public StepResult step(Action action) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        stepsTaken++;

        advance(blob, action);
        blob.decay(config.massDecayRate);

        double reward = config.survivalReward;
        double currentDistance = distanceToNearestPellet();
        if (config.distanceShaping && !pellets.isEmpty()) {
            reward += (prevDistanceToFood - currentDistance) * config.shapingScale;
        }
        prevDistanceToFood = currentDistance;

        int collected = collectPellets(blob)[0];
        reward += collected * config.pickupReward;
        replenishPellets();
        if (collected > 0 && !pellets.isEmpty()) {
            // The pellet being approached is gone; measure progress against the new nearest one
            prevDistanceToFood = distanceToNearestPellet();
        }

        boolean terminated = blob.isStarved(config.minMass);
        boolean truncated = timeLimitReached();

        return new StepResult(observe(), reward, terminated, truncated,
                new EpisodeOutcome(EpisodeOutcome.DRAW, blob));
    }

    private double distanceToNearestPellet() {
        Pellet nearest = nearestPellet(blob);
        return nearest == null ? 0.0 : nearest.distanceTo(blob);
    }

    private double[] observe() {
        Pellet nearest = nearestPellet(blob);
        // With no pellets the blob treats its own position as the target
        double foodX = nearest == null ? blob.getX() : nearest.getX();
        double foodY = nearest == null ? blob.getY() : nearest.getY();
        double distance = Geometry.distance(blob.getX(), blob.getY(), foodX, foodY);
        double bearing = Geometry.relativeBearing(blob.getX(), blob.getY(), blob.getAngle(), foodX, foodY);

        return new double[]{
                blob.getX() / config.mapSize,
                blob.getY() / config.mapSize,
                blob.getAngle(),
                bearing,
                distance / config.maxDistance(),
                normalizedMass(blob)
        };
    }

    public Blob getBlob() {
        return blob;
    }

    public int getFoodsCollected() {
        return blob.getPickups();
    }

    void placeBlob(double x, double y, double angle, double mass) {
        blob.place(x, y, angle, mass);
        prevDistanceToFood = distanceToNearestPellet();
    }

    // Result of one tick
    public static class StepResult {
        public final double[] nextState;
        public final double reward;
        public final boolean terminated;
        public final boolean truncated;
        public final EpisodeOutcome outcome;

        public StepResult(double[] nextState, double reward, boolean terminated, boolean truncated, EpisodeOutcome outcome) {
            this.nextState = nextState;
            this.reward = reward;
            this.terminated = terminated;
            this.truncated = truncated;
            this.outcome = outcome;
        }

        public boolean isDone() {
            return terminated || truncated;
        }
    }
}
