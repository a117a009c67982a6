package dqnblob;

// Greedy policy over exported weights with plain arrays
public class SnapshotPolicy {
    private final LayerParameters[] layers;

    public SnapshotPolicy(ParameterSnapshot snapshot) throws SnapshotException {
        this.layers = new LayerParameters[QNetworkBuilder.LAYER_NAMES.length];
        for (int i = 0; i < layers.length; i++) {
            layers[i] = snapshot.layer(QNetworkBuilder.LAYER_NAMES[i]);
            if (i > 0 && layers[i].inputs() != layers[i - 1].outputs()) {
                throw new SnapshotException("Layer " + QNetworkBuilder.LAYER_NAMES[i] + " takes " + layers[i].inputs()
                        + " inputs but the previous layer produces " + layers[i - 1].outputs());
            }
        }
    }

    public double[] forward(double[] state) {
        if (state.length != layers[0].inputs()) {
            throw new IllegalArgumentException("Expected " + layers[0].inputs() + " inputs, got " + state.length);
        }
        double[] x = state;
        for (int i = 0; i < layers.length; i++) {
            x = dense(layers[i], x, i < layers.length - 1);
        }
        return x;
    }

    public int selectAction(double[] state) {
        double[] q = forward(state);
        int best = 0;
        for (int a = 1; a < q.length; a++) {
            if (q[a] > q[best]) {
                best = a;
            }
        }
        return best;
    }

    private static double[] dense(LayerParameters layer, double[] input, boolean relu) {
        double[] out = new double[layer.outputs()];
        for (int o = 0; o < out.length; o++) {
            double sum = layer.bias(o);
            for (int i = 0; i < input.length; i++) {
                sum += layer.weight(o, i) * input[i];
            }
            out[o] = relu ? Math.max(0.0, sum) : sum;
        }
        return out;
    }
}
