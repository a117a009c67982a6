package dqnblob;

public final class EpisodeStats {
    public final int episode;
    public final int length;
    public final double reward;
    public final int pickups;
    public final double averageLoss; // 0 when no training step ran
    public final double epsilon;

    public EpisodeStats(int episode, int length, double reward, int pickups, double averageLoss, double epsilon) {
        this.episode = episode;
        this.length = length;
        this.reward = reward;
        this.pickups = pickups;
        this.averageLoss = averageLoss;
        this.epsilon = epsilon;
    }

    @Override
    public String toString() {
        return String.format("Episode %d: length=%d reward=%.2f pickups=%d loss=%.4f epsilon=%.3f",
                episode, length, reward, pickups, averageLoss, epsilon);
    }
}
