package dqnblob;

// One transition, owned by the replay buffer it was added to
public class Experience {
    public final double[] state;
    public final int action;
    public final double reward;
    public final double[] nextState;
    public final boolean done;

    public Experience(double[] state, int action, double reward, double[] nextState, boolean done) {
        // Arrays are copied
        this.state = state.clone();
        this.action = action;
        this.reward = reward;
        this.nextState = nextState.clone();
        this.done = done;
    }

    @Override
    public String toString() {
        return String.format("Experience(action=%d, reward=%.4f, done=%b)", action, reward, done);
    }
}
