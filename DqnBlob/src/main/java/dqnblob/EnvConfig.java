package dqnblob;

import java.util.Properties;

// Physics and reward knobs of a blob world
public class EnvConfig {
    // World
    public final double mapSize;
    public final double pelletInset;
    public final double agentSpawnInset;
    public final int pelletCount;
    public final double agentRadius;
    public final double pelletRadius;
    public final int maxSteps;

    // Blob physics
    public final double initialMass;
    public final double massDecayRate;
    public final double minMass;
    public final double movementSpeed;
    public final double turnRate;
    public final double foodMassGain;
    public final double massStealRate;

    // Rewards
    public final double pickupReward;
    public final double survivalReward;
    public final boolean distanceShaping;
    public final double shapingScale;

    // Observation normalisation
    public final double massNormalization;

    private EnvConfig(Builder b) {
        this.mapSize = b.mapSize;
        this.pelletInset = b.pelletInset;
        this.agentSpawnInset = b.agentSpawnInset;
        this.pelletCount = b.pelletCount;
        this.agentRadius = b.agentRadius;
        this.pelletRadius = b.pelletRadius;
        this.maxSteps = b.maxSteps;
        this.initialMass = b.initialMass;
        this.massDecayRate = b.massDecayRate;
        this.minMass = b.minMass;
        this.movementSpeed = b.movementSpeed;
        this.turnRate = b.turnRate;
        this.foodMassGain = b.foodMassGain;
        this.massStealRate = b.massStealRate;
        this.pickupReward = b.pickupReward;
        this.survivalReward = b.survivalReward;
        this.distanceShaping = b.distanceShaping;
        this.shapingScale = b.shapingScale;
        this.massNormalization = b.massNormalization;
    }

    public static EnvConfig harvest() {
        return new Builder().build();
    }

    public static EnvConfig compete() {
        return new Builder()
                .massDecayRate(0.05)
                .foodMassGain(1.5)
                .pelletCount(10)
                .pickupReward(5.0)
                .distanceShaping(false)
                .massStealRate(0.15)
                .maxSteps(2000)
                .build();
    }

    // Largest distance two points on the map can be apart, used to normalise distances
    public double maxDistance() {
        return Math.sqrt(2) * mapSize;
    }

    public double pickupRange() {
        return agentRadius + pelletRadius;
    }

    // One pellet per grid cell one diameter wide
    public long pelletCapacity() {
        long perSide = (long) Math.floor((mapSize - 2 * pelletInset) / (2 * pelletRadius));
        return perSide * perSide;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        return String.format("EnvConfig(mapSize=%.1f, initialMass=%.2f, decay=%.3f, minMass=%.2f, speed=%.2f, "
                        + "turnRate=%.3f, foodGain=%.2f, pellets=%d, agentRadius=%.2f, steal=%.3f, "
                        + "shaping=%b, maxSteps=%d)",
                mapSize, initialMass, massDecayRate, minMass, movementSpeed, turnRate, foodMassGain,
                pelletCount, agentRadius, massStealRate, distanceShaping, maxSteps);
    }

    public static class Builder {
        private double mapSize = 100.0;
        private double pelletInset = 5.0;
        private double agentSpawnInset = 10.0;
        private int pelletCount = 8;
        private double agentRadius = 2.5;
        private double pelletRadius = 1.0;
        private int maxSteps = 1000;
        private double initialMass = 5.0;
        private double massDecayRate = 0.08;
        private double minMass = 0.5;
        private double movementSpeed = 1.2;
        private double turnRate = 0.12;
        private double foodMassGain = 2.0;
        private double massStealRate = 0.0;
        private double pickupReward = 10.0;
        private double survivalReward = 0.01;
        private boolean distanceShaping = true;
        private double shapingScale = 0.02;
        private double massNormalization = 10.0;

        public Builder() {
        }

        Builder(EnvConfig c) {
            this.mapSize = c.mapSize;
            this.pelletInset = c.pelletInset;
            this.agentSpawnInset = c.agentSpawnInset;
            this.pelletCount = c.pelletCount;
            this.agentRadius = c.agentRadius;
            this.pelletRadius = c.pelletRadius;
            this.maxSteps = c.maxSteps;
            this.initialMass = c.initialMass;
            this.massDecayRate = c.massDecayRate;
            this.minMass = c.minMass;
            this.movementSpeed = c.movementSpeed;
            this.turnRate = c.turnRate;
            this.foodMassGain = c.foodMassGain;
            this.massStealRate = c.massStealRate;
            this.pickupReward = c.pickupReward;
            this.survivalReward = c.survivalReward;
            this.distanceShaping = c.distanceShaping;
            this.shapingScale = c.shapingScale;
            this.massNormalization = c.massNormalization;
        }

        public Builder mapSize(double mapSize) {
            this.mapSize = mapSize;
            return this;
        }

        public Builder pelletInset(double pelletInset) {
            this.pelletInset = pelletInset;
            return this;
        }

        public Builder agentSpawnInset(double agentSpawnInset) {
            this.agentSpawnInset = agentSpawnInset;
            return this;
        }

        public Builder pelletCount(int pelletCount) {
            this.pelletCount = pelletCount;
            return this;
        }

        public Builder agentRadius(double agentRadius) {
            this.agentRadius = agentRadius;
            return this;
        }

        public Builder pelletRadius(double pelletRadius) {
            this.pelletRadius = pelletRadius;
            return this;
        }

        public Builder maxSteps(int maxSteps) {
            this.maxSteps = maxSteps;
            return this;
        }

        public Builder initialMass(double initialMass) {
            this.initialMass = initialMass;
            return this;
        }

        public Builder massDecayRate(double massDecayRate) {
            this.massDecayRate = massDecayRate;
            return this;
        }

        public Builder minMass(double minMass) {
            this.minMass = minMass;
            return this;
        }

        public Builder movementSpeed(double movementSpeed) {
            this.movementSpeed = movementSpeed;
            return this;
        }

        public Builder turnRate(double turnRate) {
            this.turnRate = turnRate;
            return this;
        }

        public Builder foodMassGain(double foodMassGain) {
            this.foodMassGain = foodMassGain;
            return this;
        }

        public Builder massStealRate(double massStealRate) {
            this.massStealRate = massStealRate;
            return this;
        }

        public Builder pickupReward(double pickupReward) {
            this.pickupReward = pickupReward;
            return this;
        }

        public Builder survivalReward(double survivalReward) {
            this.survivalReward = survivalReward;
            return this;
        }

        public Builder distanceShaping(boolean distanceShaping) {
            this.distanceShaping = distanceShaping;
            return this;
        }

        public Builder shapingScale(double shapingScale) {
            this.shapingScale = shapingScale;
            return this;
        }

        public Builder massNormalization(double massNormalization) {
            this.massNormalization = massNormalization;
            return this;
        }

        // Overlays env.* keys, e.g. env.mapSize=120
        public Builder apply(Properties props) {
            mapSize = doubleProp(props, "env.mapSize", mapSize);
            pelletInset = doubleProp(props, "env.pelletInset", pelletInset);
            agentSpawnInset = doubleProp(props, "env.agentSpawnInset", agentSpawnInset);
            pelletCount = intProp(props, "env.pelletCount", pelletCount);
            agentRadius = doubleProp(props, "env.agentRadius", agentRadius);
            pelletRadius = doubleProp(props, "env.pelletRadius", pelletRadius);
            maxSteps = intProp(props, "env.maxSteps", maxSteps);
            initialMass = doubleProp(props, "env.initialMass", initialMass);
            massDecayRate = doubleProp(props, "env.massDecayRate", massDecayRate);
            minMass = doubleProp(props, "env.minMass", minMass);
            movementSpeed = doubleProp(props, "env.movementSpeed", movementSpeed);
            turnRate = doubleProp(props, "env.turnRate", turnRate);
            foodMassGain = doubleProp(props, "env.foodMassGain", foodMassGain);
            massStealRate = doubleProp(props, "env.massStealRate", massStealRate);
            pickupReward = doubleProp(props, "env.pickupReward", pickupReward);
            survivalReward = doubleProp(props, "env.survivalReward", survivalReward);
            shapingScale = doubleProp(props, "env.shapingScale", shapingScale);
            massNormalization = doubleProp(props, "env.massNormalization", massNormalization);
            String shaping = props.getProperty("env.distanceShaping");
            if (shaping != null) {
                distanceShaping = Boolean.parseBoolean(shaping.trim());
            }
            return this;
        }

        public EnvConfig build() {
            if (!(mapSize > 0)) {
                throw new IllegalArgumentException("mapSize must be positive, got " + mapSize);
            }
            if (pelletInset < 0 || mapSize - 2 * pelletInset <= 0) {
                throw new IllegalArgumentException("pelletInset " + pelletInset + " leaves no spawn region on a map of size " + mapSize);
            }
            if (!(agentRadius > 0) || !(pelletRadius > 0)) {
                throw new IllegalArgumentException("agentRadius and pelletRadius must be positive");
            }
            if (pelletCount < 0) {
                throw new IllegalArgumentException("pelletCount must not be negative, got " + pelletCount);
            }
            if (maxSteps <= 0) {
                throw new IllegalArgumentException("maxSteps must be positive, got " + maxSteps);
            }
            if (massDecayRate < 0) {
                throw new IllegalArgumentException("massDecayRate must not be negative, got " + massDecayRate);
            }
            if (massStealRate < 0) {
                throw new IllegalArgumentException("massStealRate must not be negative, got " + massStealRate);
            }
            if (!(massNormalization > 0)) {
                throw new IllegalArgumentException("massNormalization must be positive, got " + massNormalization);
            }
            EnvConfig config = new EnvConfig(this);
            if (pelletCount > config.pelletCapacity()) {
                throw new IllegalArgumentException("pelletCount " + pelletCount + " exceeds the "
                        + config.pelletCapacity() + " pellets the spawn region can hold without overlap");
            }
            return config;
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
