package dqnblob;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.Properties;

class ConfigTest {

    @Test
    void testDefaults() {
        Config config = Config.defaults();
        assertEquals(128, config.hiddenDim);
        assertEquals(50000, config.bufferSize);
        assertEquals(64, config.batchSize);
        assertEquals(0.99, config.gamma, 0.0);
        assertEquals(1e-3, config.lr, 0.0);
        assertEquals(10, config.targetUpdateEvery);
        assertEquals(1.0, config.epsilonStart, 0.0);
        assertEquals(0.01, config.epsilonEnd, 0.0);
        assertEquals(0.995, config.epsilonDecay, 0.0);
        assertEquals(800, config.numEpisodes);
    }

    @Test
    void testPropertiesOverride() {
        Properties props = new Properties();
        props.setProperty("dqn.batchSize", "32");
        props.setProperty("dqn.gamma", "0.95");
        props.setProperty("dqn.seed", " 42 ");
        props.setProperty("unrelated.key", "ignored");

        Config config = Config.fromProperties(props);
        assertEquals(32, config.batchSize);
        assertEquals(0.95, config.gamma, 0.0);
        assertEquals(42L, config.randomSeed);
        assertEquals(128, config.hiddenDim);
    }

    @Test
    void testToBuilderKeepsEverything() {
        Config config = Config.builder().hiddenDim(32).randomSeed(7L).build();
        Config copy = config.toBuilder().build();
        assertEquals(32, copy.hiddenDim);
        assertEquals(7L, copy.randomSeed);
        assertEquals(config.toString(), copy.toString());
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> Config.builder().hiddenDim(0).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().gamma(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().bufferSize(10).batchSize(64).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().epsilonStart(0.1).epsilonEnd(0.5).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().epsilonDecay(0.0).build());
        assertThrows(IllegalArgumentException.class, () -> Config.builder().targetUpdateEvery(0).build());

        Properties props = new Properties();
        props.setProperty("dqn.batchSize", "lots");
        assertThrows(IllegalArgumentException.class, () -> Config.fromProperties(props));
    }

    @Test
    void testHarvestAndCompetePresets() {
        EnvConfig harvest = EnvConfig.harvest();
        assertEquals(100.0, harvest.mapSize, 0.0);
        assertEquals(8, harvest.pelletCount);
        assertEquals(0.08, harvest.massDecayRate, 0.0);
        assertEquals(2.0, harvest.foodMassGain, 0.0);
        assertEquals(10.0, harvest.pickupReward, 0.0);
        assertEquals(0.0, harvest.massStealRate, 0.0);
        assertEquals(1000, harvest.maxSteps);
        assertTrue(harvest.distanceShaping);

        EnvConfig compete = EnvConfig.compete();
        assertEquals(0.05, compete.massDecayRate, 0.0);
        assertEquals(1.5, compete.foodMassGain, 0.0);
        assertEquals(10, compete.pelletCount);
        assertEquals(5.0, compete.pickupReward, 0.0);
        assertEquals(0.15, compete.massStealRate, 0.0);
        assertEquals(2000, compete.maxSteps);
        assertFalse(compete.distanceShaping);
    }

    @Test
    void testDerivedGeometry() {
        EnvConfig config = EnvConfig.harvest();
        assertEquals(Math.sqrt(2) * 100.0, config.maxDistance(), 1e-12);
        assertEquals(3.5, config.pickupRange(), 0.0);
        // 90 units of spawn side fit 45 pellets of diameter 2 per row
        assertEquals(45L * 45L, config.pelletCapacity());
    }

    @Test
    void testEnvPropertiesOverlay() {
        Properties props = new Properties();
        props.setProperty("env.mapSize", "120");
        props.setProperty("env.distanceShaping", "false");
        props.setProperty("dqn.batchSize", "16");

        EnvConfig config = EnvConfig.compete().toBuilder().apply(props).build();
        assertEquals(120.0, config.mapSize, 0.0);
        assertFalse(config.distanceShaping);
        assertEquals(0.15, config.massStealRate, 0.0);
    }

    @Test
    void testInvalidEnvConfigRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EnvConfig.Builder().mapSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> new EnvConfig.Builder().pelletInset(50).build());
        assertThrows(IllegalArgumentException.class, () -> new EnvConfig.Builder().pelletCount(-1).build());
        assertThrows(IllegalArgumentException.class, () -> new EnvConfig.Builder().pelletCount(5000).build());
        assertThrows(IllegalArgumentException.class, () -> new EnvConfig.Builder().maxSteps(0).build());
    }
}
