package dqnblob;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.util.List;

// Sampled transitions grouped column-wise
public class ExperienceBatch {
    public final double[][] states;
    public final int[] actions;
    public final double[] rewards;
    public final double[][] nextStates;
    public final double[] dones;

    ExperienceBatch(List<Experience> experiences) {
        int n = experiences.size();
        this.states = new double[n][];
        this.actions = new int[n];
        this.rewards = new double[n];
        this.nextStates = new double[n][];
        this.dones = new double[n];

        for (int i = 0; i < n; i++) {
            Experience exp = experiences.get(i);
            states[i] = exp.state;
            actions[i] = exp.action;
            rewards[i] = exp.reward;
            nextStates[i] = exp.nextState;
            dones[i] = exp.done ? 1.0 : 0.0;
        }
    }

    public int size() {
        return actions.length;
    }

    public INDArray statesTensor() {
        return Nd4j.create(states);
    }

    public INDArray nextStatesTensor() {
        return Nd4j.create(nextStates);
    }

    public INDArray rewardsColumn() {
        return Nd4j.create(rewards).reshape(size(), 1);
    }

    public INDArray donesColumn() {
        return Nd4j.create(dones).reshape(size(), 1);
    }
}
