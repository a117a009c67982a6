package dqnblob;

// The two steering commands. There is no no-op: a blob always moves forward.
public enum Action {
    LEFT(0),
    RIGHT(1);

    public static final int COUNT = 2;

    private final int index;

    Action(int index) {
        this.index = index;
    }

    public int index() {
        return index;
    }

    public static Action fromIndex(int index) {
        if (index == 0) {
            return LEFT;
        } else if (index == 1) {
            return RIGHT;
        }
        throw new InvalidActionException(index);
    }
}
