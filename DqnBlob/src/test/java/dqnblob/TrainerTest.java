package dqnblob;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

class TrainerTest {

    private static Config smallConfig(int episodes, int targetUpdateEvery) {
        return Config.builder()
                .hiddenDim(16)
                .bufferSize(10000)
                .batchSize(8)
                .numEpisodes(episodes)
                .logEvery(1)
                .targetUpdateEvery(targetUpdateEvery)
                .randomSeed(123L)
                .build();
    }

    private static double rewardSum(DQNAgent agent) {
        double sum = 0.0;
        for (Experience e : agent.getReplayBuffer().contents()) {
            sum += e.reward;
        }
        return sum;
    }

    @Test
    void testHarvestTrainingBookkeeping() {
        EnvConfig envConfig = EnvConfig.harvest().toBuilder().maxSteps(50).build();
        HarvestTrainer trainer = new HarvestTrainer(smallConfig(3, 10), envConfig);

        List<EpisodeStats> history = trainer.train();

        assertEquals(3, history.size());
        int totalTicks = 0;
        for (int i = 0; i < history.size(); i++) {
            EpisodeStats stats = history.get(i);
            assertEquals(i, stats.episode);
            assertTrue(stats.length > 0 && stats.length <= 50);
            assertTrue(Double.isFinite(stats.averageLoss));
            totalTicks += stats.length;
        }
        assertEquals(totalTicks, trainer.getAgent().getReplayBuffer().size());
        assertEquals(0.995 * 0.995 * 0.995, trainer.getAgent().getEpsilon(), 1e-12);
        assertEquals(history.get(2).epsilon, trainer.getAgent().getEpsilon(), 0.0);
        assertEquals(history.get(2).reward, rewardSumOfLast(trainer.getAgent(), history.get(2).length), 1e-9);
    }

    private static double rewardSumOfLast(DQNAgent agent, int count) {
        List<Experience> contents = agent.getReplayBuffer().contents();
        double sum = 0.0;
        for (Experience e : contents.subList(contents.size() - count, contents.size())) {
            sum += e.reward;
        }
        return sum;
    }

    @Test
    void testTargetSyncCadence() {
        EnvConfig envConfig = EnvConfig.harvest().toBuilder().maxSteps(30).build();
        HarvestTrainer trainer = new HarvestTrainer(smallConfig(2, 2), envConfig);
        DQNAgent agent = trainer.getAgent();

        trainer.runEpisode(0);
        assertArrayEquals(agent.getQNetwork().params().toDoubleVector(),
                agent.getTargetNetwork().params().toDoubleVector(), 0.0);

        trainer.runEpisode(1);
        assertFalse(Arrays.equals(agent.getQNetwork().params().toDoubleVector(),
                agent.getTargetNetwork().params().toDoubleVector()));
    }

    @Test
    void testHarvestEvaluationLeavesAgentUntouched() {
        EnvConfig envConfig = EnvConfig.harvest().toBuilder().maxSteps(40).build();
        HarvestTrainer trainer = new HarvestTrainer(smallConfig(1, 10), envConfig);
        trainer.train();
        DQNAgent agent = trainer.getAgent();
        int bufferSize = agent.getReplayBuffer().size();
        double epsilon = agent.getEpsilon();
        double[] params = agent.getQNetwork().params().toDoubleVector();

        List<EpisodeStats> results = trainer.evaluate(2);

        assertEquals(2, results.size());
        assertEquals(bufferSize, agent.getReplayBuffer().size());
        assertEquals(epsilon, agent.getEpsilon(), 0.0);
        assertArrayEquals(params, agent.getQNetwork().params().toDoubleVector(), 0.0);
    }

    @Test
    void testCompeteAgentsLearnFromTheirOwnTransitions() {
        EnvConfig envConfig = EnvConfig.compete().toBuilder().maxSteps(40).build();
        CompeteTrainer trainer = new CompeteTrainer(smallConfig(1, 10), envConfig);

        CompeteEpisodeStats stats = trainer.train().get(0);

        DQNAgent agent1 = trainer.getAgent1();
        DQNAgent agent2 = trainer.getAgent2();
        assertNotSame(agent1.getReplayBuffer(), agent2.getReplayBuffer());
        assertEquals(stats.length, agent1.getReplayBuffer().size());
        assertEquals(stats.length, agent2.getReplayBuffer().size());
        assertEquals(stats.rewards[0], rewardSum(agent1), 1e-9);
        assertEquals(stats.rewards[1], rewardSum(agent2), 1e-9);
        assertTrue(stats.winner >= 0 && stats.winner <= 2);
        assertEquals(0.995, agent1.getEpsilon(), 1e-12);
        assertEquals(0.995, agent2.getEpsilon(), 1e-12);
        assertFalse(Arrays.equals(agent1.getQNetwork().params().toDoubleVector(),
                agent2.getQNetwork().params().toDoubleVector()));
    }

    @Test
    void testCompeteEvaluationDoesNotStore() {
        EnvConfig envConfig = EnvConfig.compete().toBuilder().maxSteps(30).build();
        CompeteTrainer trainer = new CompeteTrainer(smallConfig(1, 10), envConfig);
        trainer.train();
        int stored = trainer.getAgent1().getReplayBuffer().size();

        List<CompeteEpisodeStats> results = trainer.evaluate(2);

        assertEquals(2, results.size());
        assertEquals(stored, trainer.getAgent1().getReplayBuffer().size());
        assertEquals(stored, trainer.getAgent2().getReplayBuffer().size());
    }

    @Test
    void testSharedAgentRejected() {
        Config config = smallConfig(1, 10);
        DQNAgent shared = new DQNAgent(config, CompeteEnv.STATE_SIZE, Action.COUNT);
        CompeteEnv env = new CompeteEnv(EnvConfig.compete(), 1L);
        assertThrows(IllegalArgumentException.class, () -> new CompeteTrainer(config, env, shared, shared));
    }
}
