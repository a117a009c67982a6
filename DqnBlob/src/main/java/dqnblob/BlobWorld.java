package dqnblob;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

// Map, pellet pool, step counter and random source shared by both worlds
public abstract class BlobWorld {
    protected final EnvConfig config;
    protected final Random random;
    protected final List<Pellet> pellets;
    protected int stepsTaken;

    protected BlobWorld(EnvConfig config, Random random) {
        this.config = config;
        this.random = random;
        this.pellets = new ArrayList<>(config.pelletCount);
    }

    // Floats per observation
    public abstract int stateSize();

    public int actionSize() {
        return Action.COUNT;
    }

    public int getSurvivalTime() {
        return stepsTaken;
    }

    public EnvConfig getConfig() {
        return config;
    }

    public List<Pellet> getPellets() {
        return Collections.unmodifiableList(pellets);
    }

    protected void reseed(long seed) {
        random.setSeed(seed);
    }

    protected double uniform(double low, double high) {
        return low + random.nextDouble() * (high - low);
    }

    protected double randomHeading() {
        return uniform(-Math.PI, Math.PI);
    }

    protected Pellet spawnPellet() {
        double low = config.pelletInset;
        double high = config.mapSize - config.pelletInset;
        return new Pellet(uniform(low, high), uniform(low, high));
    }

    protected void spawnAllPellets() {
        pellets.clear();
        replenishPellets();
    }

    protected void replenishPellets() {
        while (pellets.size() < config.pelletCount) {
            pellets.add(spawnPellet());
        }
    }

    protected Pellet nearestPellet(Blob blob) {
        Pellet nearest = null;
        double best = Double.POSITIVE_INFINITY;
        for (Pellet pellet : pellets) {
            double d = pellet.distanceTo(blob);
            if (d < best) {
                best = d;
                nearest = pellet;
            }
        }
        return nearest;
    }

    // Each pellet goes to the first blob in range, in argument order. Collected pellets are not yet replaced
    protected int[] collectPellets(Blob... blobs) {
        int[] collected = new int[blobs.length];
        double range = config.pickupRange();
        List<Pellet> remaining = new ArrayList<>(pellets.size());
        for (Pellet pellet : pellets) {
            boolean eaten = false;
            for (int i = 0; i < blobs.length && !eaten; i++) {
                if (pellet.distanceTo(blobs[i]) < range) {
                    blobs[i].eat(config.foodMassGain);
                    collected[i]++;
                    eaten = true;
                }
            }
            if (!eaten) {
                remaining.add(pellet);
            }
        }
        pellets.clear();
        pellets.addAll(remaining);
        return collected;
    }

    protected void advance(Blob blob, Action action) {
        blob.steer(action, config.turnRate);
        blob.moveForward(config.movementSpeed, config.mapSize);
    }

    protected double normalizedMass(Blob blob) {
        return blob.getMass() / config.massNormalization;
    }

    protected boolean timeLimitReached() {
        return stepsTaken >= config.maxSteps;
    }

    // Test hooks for pinning the world into a known layout

    void placePellets(List<Pellet> layout) {
        pellets.clear();
        pellets.addAll(layout);
    }
}
