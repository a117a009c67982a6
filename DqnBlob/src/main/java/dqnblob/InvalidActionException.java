package dqnblob;

public class InvalidActionException extends IllegalArgumentException {
    private final int action;

    public InvalidActionException(int action) {
        super("Invalid action " + action + " for action_size " + Action.COUNT);
        this.action = action;
    }

    public int getAction() {
        return action;
    }
}
