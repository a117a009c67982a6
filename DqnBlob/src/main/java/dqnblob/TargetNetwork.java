package dqnblob;

import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.nd4j.linalg.api.ndarray.INDArray;

// Frozen copy of the live network; no training methods
public final class TargetNetwork {
    private final MultiLayerNetwork model;

    // Takes ownership of a private deep copy
    TargetNetwork(MultiLayerNetwork model) {
        this.model = model;
    }

    // Q-values for a batch of observations
    public INDArray output(INDArray states) {
        return model.output(states, false);
    }

    // Copy of the flattened parameter vector
    public INDArray params() {
        return model.params().dup();
    }

    public ParameterSnapshot exportParameters() {
        return QNetwork.exportParameters(model);
    }
}
