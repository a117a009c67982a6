package dqnblob;

import java.io.IOException;

public class SnapshotException extends IOException {

    public SnapshotException(String message) {
        super(message);
    }

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
