package dqnblob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

// Two independent agents; neither sees the other's transitions or weights
public class CompeteTrainer {
    private static final Logger log = LoggerFactory.getLogger(CompeteTrainer.class);

    // Keeps the second agent's networks and random streams apart from the first's
    static final long AGENT2_SEED_OFFSET = 1000;

    private final Config config;
    private final CompeteEnv env;
    private final DQNAgent agent1;
    private final DQNAgent agent2;

    public CompeteTrainer(Config config, EnvConfig envConfig) {
        this(config, new CompeteEnv(envConfig, config.randomSeed + 4),
                new DQNAgent(config, CompeteEnv.STATE_SIZE, Action.COUNT),
                new DQNAgent(config.toBuilder().randomSeed(config.randomSeed + AGENT2_SEED_OFFSET).build(),
                        CompeteEnv.STATE_SIZE, Action.COUNT));
    }

    public CompeteTrainer(Config config, CompeteEnv env, DQNAgent agent1, DQNAgent agent2) {
        if (agent1 == agent2) {
            throw new IllegalArgumentException("Competing agents must be distinct instances");
        }
        this.config = config;
        this.env = env;
        this.agent1 = agent1;
        this.agent2 = agent2;
    }

    public List<CompeteEpisodeStats> train() {
        EnvConfig envConfig = env.getConfig();
        log.info("Starting Competitive Blob DQN training: {} episodes", config.numEpisodes);
        log.info("Initial mass: {}, Decay rate: {}, Mass steal rate: {}, Food pellets: {}",
                envConfig.initialMass, envConfig.massDecayRate, envConfig.massStealRate, envConfig.pelletCount);

        long startTime = System.currentTimeMillis();
        List<CompeteEpisodeStats> history = new ArrayList<>(config.numEpisodes);
        ScoreWindow lengths = new ScoreWindow(config.logEvery);
        ScoreWindow blob1Wins = new ScoreWindow(config.logEvery);
        ScoreWindow blob2Wins = new ScoreWindow(config.logEvery);

        for (int episode = 0; episode < config.numEpisodes; episode++) {
            CompeteEpisodeStats stats = runEpisode(episode);
            history.add(stats);
            lengths.add(stats.length);
            blob1Wins.add(stats.winner == 1 ? 1.0 : 0.0);
            blob2Wins.add(stats.winner == 2 ? 1.0 : 0.0);
            log.debug("{}", stats);

            if ((episode + 1) % config.logEvery == 0) {
                log.info(String.format("Episode %d/%d | Avg Length: %.1f | Blob1 WR: %.2f | Blob2 WR: %.2f | Epsilon: %.3f",
                        episode + 1, config.numEpisodes, lengths.average(), blob1Wins.average(), blob2Wins.average(),
                        agent1.getEpsilon()));
            }
        }

        log.info(String.format("Training completed in %.2f seconds. Last %d episodes: avg length %.1f, blob1 WR %.2f, blob2 WR %.2f",
                (System.currentTimeMillis() - startTime) / 1000.0, lengths.size(), lengths.average(),
                blob1Wins.average(), blob2Wins.average()));
        return history;
    }

    public CompeteEpisodeStats runEpisode(int episode) {
        double[][] states = env.reset();
        double[] episodeRewards = new double[2];
        boolean done = false;
        CompeteEnv.StepResult result = null;

        while (!done) {
            // Agent 1 acts first, matching the order the environment applies actions in
            int action1 = agent1.selectAction(states[0]);
            int action2 = agent2.selectAction(states[1]);

            result = env.step(action1, action2);
            done = result.isDone();

            agent1.storeExperience(states[0], action1, result.rewards[0], result.nextStates[0], done);
            agent2.storeExperience(states[1], action2, result.rewards[1], result.nextStates[1], done);

            agent1.train(config.batchSize);
            agent2.train(config.batchSize);

            states = result.nextStates;
            episodeRewards[0] += result.rewards[0];
            episodeRewards[1] += result.rewards[1];
        }

        if (episode % config.targetUpdateEvery == 0) {
            agent1.updateTargetNetwork();
            agent2.updateTargetNetwork();
        }
        agent1.decayEpsilon();
        agent2.decayEpsilon();

        return new CompeteEpisodeStats(episode, env.getSurvivalTime(), episodeRewards, result.outcome, agent1.getEpsilon());
    }

    // Greedy, no storing or learning
    public List<CompeteEpisodeStats> evaluate(int episodes) {
        List<CompeteEpisodeStats> results = new ArrayList<>(episodes);
        for (int episode = 0; episode < episodes; episode++) {
            double[][] states = env.reset();
            double[] episodeRewards = new double[2];
            CompeteEnv.StepResult result;
            do {
                result = env.step(agent1.selectAction(states[0], false), agent2.selectAction(states[1], false));
                states = result.nextStates;
                episodeRewards[0] += result.rewards[0];
                episodeRewards[1] += result.rewards[1];
            } while (!result.isDone());
            results.add(new CompeteEpisodeStats(episode, env.getSurvivalTime(), episodeRewards, result.outcome, agent1.getEpsilon()));
        }
        return results;
    }

    public DQNAgent getAgent1() {
        return agent1;
    }

    public DQNAgent getAgent2() {
        return agent2;
    }

    public CompeteEnv getEnv() {
        return env;
    }
}
