package dqnblob;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

public class HarvestTrainer {
    private static final Logger log = LoggerFactory.getLogger(HarvestTrainer.class);

    private final Config config;
    private final HarvestEnv env;
    private final DQNAgent agent;

    public HarvestTrainer(Config config, EnvConfig envConfig) {
        this(config, new HarvestEnv(envConfig, config.randomSeed + 4),
                new DQNAgent(config, HarvestEnv.STATE_SIZE, Action.COUNT));
    }

    public HarvestTrainer(Config config, HarvestEnv env, DQNAgent agent) {
        this.config = config;
        this.env = env;
        this.agent = agent;
    }

    public List<EpisodeStats> train() {
        EnvConfig envConfig = env.getConfig();
        log.info("Starting Blob Harvest DQN training: {} episodes", config.numEpisodes);
        log.info("Initial mass: {}, Decay rate: {}, Agent radius: {}",
                envConfig.initialMass, envConfig.massDecayRate, envConfig.agentRadius);
        log.info("Expected survival without food: ~{} steps",
                (int) Math.ceil((envConfig.initialMass - envConfig.minMass) / Math.max(envConfig.massDecayRate, 1e-12)));

        long startTime = System.currentTimeMillis();
        List<EpisodeStats> history = new ArrayList<>(config.numEpisodes);
        ScoreWindow lengths = new ScoreWindow(config.logEvery);
        ScoreWindow rewards = new ScoreWindow(config.logEvery);
        ScoreWindow foods = new ScoreWindow(config.logEvery);

        for (int episode = 0; episode < config.numEpisodes; episode++) {
            EpisodeStats stats = runEpisode(episode);
            history.add(stats);
            lengths.add(stats.length);
            rewards.add(stats.reward);
            foods.add(stats.pickups);
            log.debug("{}", stats);

            if ((episode + 1) % config.logEvery == 0) {
                log.info(String.format("Episode %d/%d | Avg Length: %.1f | Avg Reward: %.2f | Avg Foods: %.1f | Epsilon: %.3f",
                        episode + 1, config.numEpisodes, lengths.average(), rewards.average(), foods.average(), agent.getEpsilon()));
            }
        }

        log.info(String.format("Training completed in %.2f seconds. Last %d episodes: avg length %.1f, avg foods %.1f",
                (System.currentTimeMillis() - startTime) / 1000.0, lengths.size(), lengths.average(), foods.average()));
        return history;
    }

    public EpisodeStats runEpisode(int episode) {
        double[] state = env.reset();
        double episodeReward = 0.0;
        double lossSum = 0.0;
        int lossCount = 0;
        boolean done = false;

        while (!done) {
            int action = agent.selectAction(state);
            HarvestEnv.StepResult result = env.step(action);
            done = result.isDone();

            agent.storeExperience(state, action, result.reward, result.nextState, done);
            OptionalDouble loss = agent.train(config.batchSize);
            if (loss.isPresent()) {
                lossSum += loss.getAsDouble();
                lossCount++;
            }

            state = result.nextState;
            episodeReward += result.reward;
        }

        if (episode % config.targetUpdateEvery == 0) {
            agent.updateTargetNetwork();
        }
        agent.decayEpsilon();

        return new EpisodeStats(episode, env.getSurvivalTime(), episodeReward, env.getFoodsCollected(),
                lossCount > 0 ? lossSum / lossCount : 0.0, agent.getEpsilon());
    }

    // Greedy, no storing or learning
    public List<EpisodeStats> evaluate(int episodes) {
        List<EpisodeStats> results = new ArrayList<>(episodes);
        for (int episode = 0; episode < episodes; episode++) {
            double[] state = env.reset();
            double episodeReward = 0.0;
            boolean done = false;
            while (!done) {
                HarvestEnv.StepResult result = env.step(agent.selectAction(state, false));
                done = result.isDone();
                state = result.nextState;
                episodeReward += result.reward;
            }
            results.add(new EpisodeStats(episode, env.getSurvivalTime(), episodeReward, env.getFoodsCollected(), 0.0, agent.getEpsilon()));
        }
        return results;
    }

    public DQNAgent getAgent() {
        return agent;
    }

    public HarvestEnv getEnv() {
        return env;
    }
}
