package dqnblob;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Random;

class HarvestEnvTest {

    private HarvestEnv env;

    @BeforeEach
    void setUp() {
        env = new HarvestEnv(EnvConfig.harvest(), 1234L);
    }

    @Test
    void testResetPlacesBlobAtCentreWithFullPellets() {
        double[] obs = env.reset();
        assertEquals(HarvestEnv.STATE_SIZE, obs.length);
        assertEquals(50.0, env.getBlob().getX(), 0.0);
        assertEquals(50.0, env.getBlob().getY(), 0.0);
        assertEquals(5.0, env.getBlob().getMass(), 0.0);
        assertEquals(8, env.getPellets().size());
        assertEquals(0, env.getSurvivalTime());
        assertEquals(0.5, obs[5], 1e-12);
        for (Pellet p : env.getPellets()) {
            assertTrue(p.getX() >= 5 && p.getX() < 95);
            assertTrue(p.getY() >= 5 && p.getY() < 95);
        }
    }

    @Test
    void testStarvationAtExactTick() {
        HarvestEnv starving = new HarvestEnv(EnvConfig.harvest().toBuilder().pelletCount(0).build(), 7L);
        starving.reset();
        double previousMass = starving.getBlob().getMass();
        HarvestEnv.StepResult result = null;
        for (int tick = 1; tick <= 57; tick++) {
            result = starving.step(tick % 2);
            double mass = starving.getBlob().getMass();
            assertTrue(mass < previousMass, "mass must fall every tick without food");
            previousMass = mass;
            if (tick < 57) {
                assertFalse(result.terminated, "terminated early at tick " + tick);
            }
        }
        assertTrue(result.terminated);
        assertFalse(result.truncated);
        assertEquals(57, starving.getSurvivalTime());
        assertEquals(EpisodeOutcome.DRAW, result.outcome.getWinner());
    }

    @Test
    void testStarvationFloorIsInclusive() {
        // 5.0 - 45 * 0.1 lands on the 0.5 floor, not below it
        HarvestEnv starving = new HarvestEnv(EnvConfig.harvest().toBuilder()
                .pelletCount(0).massDecayRate(0.1).build(), 7L);
        starving.reset();
        HarvestEnv.StepResult result;
        do {
            result = starving.step(Action.LEFT);
        } while (!result.isDone());

        assertTrue(result.terminated);
        assertEquals(45, starving.getSurvivalTime());
        assertEquals(0.5, starving.getBlob().getMass(), 1e-9);
    }

    @Test
    void testTwoPelletsCollectedOnOneTick() {
        env.reset();
        env.placePellets(java.util.Arrays.asList(new Pellet(51.5, 50.5), new Pellet(52.0, 49.0)));
        env.placeBlob(50, 50, 0.0, 5.0);

        HarvestEnv.StepResult result = env.step(Action.LEFT);

        assertTrue(result.reward > 19.9, "expected two pickup rewards: " + result.reward);
        assertEquals(5.0 - 0.08 + 2 * 2.0, env.getBlob().getMass(), 1e-12);
        assertEquals(2, env.getFoodsCollected());
        assertEquals(2, result.outcome.getPickups(1));
        assertEquals(8, env.getPellets().size());
    }

    @Test
    void testInvariantsHoldOverManyTicks() {
        Random actions = new Random(99);
        env.reset();
        for (int i = 0; i < 3000; i++) {
            HarvestEnv.StepResult result = env.step(actions.nextInt(2));
            double[] obs = result.nextState;
            Blob blob = env.getBlob();
            assertTrue(blob.getX() >= 0 && blob.getX() < 100, "x out of range: " + blob.getX());
            assertTrue(blob.getY() >= 0 && blob.getY() < 100, "y out of range: " + blob.getY());
            assertTrue(obs[0] >= 0 && obs[0] < 1);
            assertTrue(obs[1] >= 0 && obs[1] < 1);
            assertTrue(obs[2] >= -Math.PI && obs[2] <= Math.PI);
            assertTrue(obs[3] >= -Math.PI && obs[3] <= Math.PI);
            assertTrue(obs[4] >= 0 && obs[4] <= 1);
            assertEquals(8, env.getPellets().size(), "pellet pool must be full after every tick");
            if (result.isDone()) {
                env.reset();
            }
        }
    }

    @Test
    void testCrossingEdgeReentersOppositeSide() {
        HarvestEnv empty = new HarvestEnv(EnvConfig.harvest().toBuilder().pelletCount(0).build(), 3L);
        empty.reset();
        empty.placeBlob(99.5, 50.0, 0.0, 5.0);
        empty.step(Action.RIGHT);
        double x = empty.getBlob().getX();
        assertTrue(x >= 0 && x < 1.0, "expected to wrap to the left edge, got " + x);

        empty.placeBlob(50.0, 0.3, -Math.PI / 2, 5.0);
        empty.step(Action.LEFT);
        double y = empty.getBlob().getY();
        assertTrue(y > 98.0 && y < 100.0, "expected to wrap to the top edge, got " + y);
    }

    @Test
    void testSteeringDirection() {
        env.reset();
        env.placeBlob(50, 50, 0.0, 5.0);
        env.step(Action.LEFT);
        assertEquals(0.12, env.getBlob().getAngle(), 1e-12);
        env.step(Action.RIGHT);
        env.step(Action.RIGHT);
        assertEquals(-0.12, env.getBlob().getAngle(), 1e-12);
    }

    @Test
    void testPickupGrantsRewardAndMassAndRespawns() {
        env.reset();
        env.placePellets(Collections.singletonList(new Pellet(51.2, 50.1)));
        env.placeBlob(50, 50, 0.0, 5.0);

        HarvestEnv.StepResult result = env.step(Action.LEFT);

        assertTrue(result.reward > 9.9, "pickup reward missing: " + result.reward);
        assertEquals(5.0 - 0.08 + 2.0, env.getBlob().getMass(), 1e-12);
        assertEquals(1, env.getFoodsCollected());
        assertEquals(1, result.outcome.getPickups(1));
        assertEquals(8, env.getPellets().size());
    }

    @Test
    void testDistanceShapingRewardsApproach() {
        HarvestEnv single = new HarvestEnv(EnvConfig.harvest().toBuilder().pelletCount(1).build(), 5L);
        single.reset();
        single.placePellets(Collections.singletonList(new Pellet(70, 50)));
        single.placeBlob(50, 50, 0.0, 5.0);

        double toward = single.step(Action.LEFT).reward;
        assertTrue(toward > 0.01, "approaching food should add to the survival reward");

        single.placeBlob(50, 50, Math.PI, 5.0);
        double away = single.step(Action.LEFT).reward;
        assertTrue(away < 0.01, "moving away should cut into the survival reward");
    }

    @Test
    void testNoShapingWhenDisabled() {
        HarvestEnv flat = new HarvestEnv(EnvConfig.harvest().toBuilder().pelletCount(1).distanceShaping(false).build(), 5L);
        flat.reset();
        flat.placePellets(Collections.singletonList(new Pellet(70, 50)));
        flat.placeBlob(50, 50, 0.0, 5.0);
        assertEquals(0.01, flat.step(Action.LEFT).reward, 1e-12);
    }

    @Test
    void testTruncatesAtStepCeiling() {
        HarvestEnv shortEnv = new HarvestEnv(EnvConfig.harvest().toBuilder().maxSteps(10).build(), 11L);
        shortEnv.reset();
        HarvestEnv.StepResult result = null;
        for (int i = 0; i < 10; i++) {
            result = shortEnv.step(0);
        }
        assertTrue(result.truncated);
        assertTrue(result.isDone());
    }

    @Test
    void testInvalidActionRejected() {
        env.reset();
        assertThrows(InvalidActionException.class, () -> env.step(2));
        assertThrows(InvalidActionException.class, () -> env.step(-1));
        assertEquals(0, env.getSurvivalTime());
    }

    @Test
    void testDegenerateConfigFailsFast() {
        assertThrows(IllegalArgumentException.class, () -> EnvConfig.harvest().toBuilder().pelletCount(3000).build());
        assertThrows(IllegalArgumentException.class, () -> EnvConfig.harvest().toBuilder().mapSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> EnvConfig.harvest().toBuilder().mapSize(10).build());
        assertThrows(IllegalArgumentException.class, () -> EnvConfig.harvest().toBuilder().pelletCount(-1).build());
    }

    @Test
    void testSameSeedSameTrajectory() {
        HarvestEnv a = new HarvestEnv(EnvConfig.harvest(), 2024L);
        HarvestEnv b = new HarvestEnv(EnvConfig.harvest(), 2024L);
        assertArrayEquals(a.reset(), b.reset(), 0.0);
        for (int i = 0; i < 200; i++) {
            HarvestEnv.StepResult ra = a.step(i % 3 == 0 ? 1 : 0);
            HarvestEnv.StepResult rb = b.step(i % 3 == 0 ? 1 : 0);
            assertArrayEquals(ra.nextState, rb.nextState, 0.0);
            assertEquals(ra.reward, rb.reward, 0.0);
            if (ra.isDone()) {
                break;
            }
        }
    }

    @Test
    void testResetWithSeedIsReproducible() {
        double[] first = env.reset(77L);
        env.step(0);
        env.step(1);
        double[] second = env.reset(77L);
        assertArrayEquals(first, second, 0.0);
    }
}
