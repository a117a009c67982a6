package dqnblob;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.OptionalDouble;
import java.util.Random;

public class DQNAgent {
    private static final Logger log = LoggerFactory.getLogger(DQNAgent.class);

    private final Config config;
    private final int stateSize;
    private final int actionSize;
    private QNetwork qNetworkLocal;
    private TargetNetwork qNetworkTarget;
    private final ReplayBuffer replayBuffer;
    private double epsilon;
    private final Random random;

    public DQNAgent(Config config, int stateSize, int actionSize) {
        this.config = config;
        this.stateSize = stateSize;
        this.actionSize = actionSize;
        this.random = new Random(config.randomSeed);
        this.epsilon = config.epsilonStart;

        this.qNetworkLocal = new QNetwork(stateSize, actionSize, config.hiddenDim, config.lr, config.randomSeed + 1);
        // Target starts as an exact copy of the local network
        this.qNetworkTarget = qNetworkLocal.snapshot();

        this.replayBuffer = new ReplayBuffer(config.bufferSize, config.randomSeed + 3);

        log.info("Initialized DQNAgent (State Size: {}, Action Size: {}, Hidden: {}, Seed: {})",
                stateSize, actionSize, config.hiddenDim, config.randomSeed);
    }

    public int selectAction(double[] state) {
        return selectAction(state, true);
    }

    public int selectAction(double[] state, boolean useEpsilon) {
        if (useEpsilon && random.nextDouble() < this.epsilon) {
            // Exploration
            return random.nextInt(actionSize);
        }
        // Exploitation
        INDArray actionValues = qNetworkLocal.output(Nd4j.create(new double[][]{state}));
        return Nd4j.argMax(actionValues, 1).getInt(0);
    }

    public void storeExperience(double[] state, int action, double reward, double[] nextState, boolean done) {
        this.replayBuffer.add(new Experience(state, action, reward, nextState, done));
    }

    /**
     * One gradient step on a random batch from the replay buffer.
     *
     * @return the MSE between the live estimates for the taken actions and their
     *         Bellman targets, or empty if the buffer holds fewer than
     *         {@code batchSize} transitions, in which case nothing is changed
     */
    public OptionalDouble train(int batchSize) {
        if (replayBuffer.size() < batchSize) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(learn(replayBuffer.sample(batchSize)));
    }

    private double learn(ExperienceBatch batch) {
        int n = batch.size();
        INDArray statesTensor = batch.statesTensor();

        // Q_targets = r + gamma * max_a' Q_target(s', a') * (1 - done)
        INDArray qTargetNext = qNetworkTarget.output(batch.nextStatesTensor());
        INDArray maxQTargetNext = Nd4j.max(qTargetNext, 1).reshape(n, 1);
        INDArray qTargets = bellmanTargets(batch.rewardsColumn(), maxQTargetNext, batch.donesColumn(), config.gamma);

        // Fit towards the current predictions with only the taken action's entry replaced,
        // so the error on every other action is zero
        INDArray qExpectedAll = qNetworkLocal.output(statesTensor);
        INDArray qTargetsForFit = qExpectedAll.dup();

        double squaredError = 0.0;
        for (int i = 0; i < n; i++) {
            int action = batch.actions[i];
            double targetValue = qTargets.getDouble(i, 0);
            double diff = qExpectedAll.getDouble(i, action) - targetValue;
            squaredError += diff * diff;
            qTargetsForFit.putScalar(i, action, targetValue);
        }

        qNetworkLocal.fit(statesTensor, qTargetsForFit);
        return squaredError / n;
    }

    // Column of r + gamma * maxNext * (1 - done); done zeroes the bootstrap term
    static INDArray bellmanTargets(INDArray rewards, INDArray maxNext, INDArray dones, double gamma) {
        return rewards.add(maxNext.mul(gamma).mul(dones.rsub(1.0)));
    }

    // Replace the target with an exact copy of the live network
    public void updateTargetNetwork() {
        this.qNetworkTarget = qNetworkLocal.snapshot();
        log.debug("Target network synchronized");
    }

    public void decayEpsilon() {
        this.epsilon = Math.max(config.epsilonEnd, config.epsilonDecay * this.epsilon);
    }

    // --- Model Saving/Loading (using DL4J utilities) ---
    public void saveModel(String filePath) throws IOException {
        qNetworkLocal.save(new File(filePath));
        log.info("Model saved to {}", filePath);
    }

    // A missing or differently shaped model throws and leaves the agent untouched
    public void loadModel(String filePath) throws IOException {
        this.qNetworkLocal = QNetwork.restore(new File(filePath), stateSize, actionSize, config.hiddenDim);
        updateTargetNetwork();
        log.info("Model loaded from {}", filePath);
    }

    public ParameterSnapshot exportParameters() {
        return qNetworkLocal.exportParameters();
    }

    public void importParameters(ParameterSnapshot snapshot) throws SnapshotException {
        qNetworkLocal.importParameters(snapshot);
        updateTargetNetwork();
    }

    public double getEpsilon() {
        return epsilon;
    }

    public ReplayBuffer getReplayBuffer() {
        return replayBuffer;
    }

    public QNetwork getQNetwork() {
        return qNetworkLocal;
    }

    public TargetNetwork getTargetNetwork() {
        return qNetworkTarget;
    }

    public int getStateSize() {
        return stateSize;
    }

    public int getActionSize() {
        return actionSize;
    }
}
