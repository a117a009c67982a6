package dqnblob;

import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.params.DefaultParamInitializer;
import org.deeplearning4j.util.ModelSerializer;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

public class QNetwork {
    private final MultiLayerNetwork model;
    private final int stateSize;
    private final int actionSize;
    private final int hiddenDim;

    public QNetwork(int stateSize, int actionSize, int hiddenDim, double learningRate, long seed) {
        this(QNetworkBuilder.buildQNetwork(stateSize, actionSize, hiddenDim, learningRate, seed), stateSize, actionSize, hiddenDim);
    }

    private QNetwork(MultiLayerNetwork model, int stateSize, int actionSize, int hiddenDim) {
        this.model = model;
        this.stateSize = stateSize;
        this.actionSize = actionSize;
        this.hiddenDim = hiddenDim;
    }

    /**
     * Restores a network written by {@link #save(File)}.
     *
     * @throws SnapshotException if the stored network does not have the expected layer sizes
     */
    public static QNetwork restore(File file, int stateSize, int actionSize, int hiddenDim) throws IOException {
        if (!file.isFile()) {
            throw new FileNotFoundException("No model at " + file.getAbsolutePath());
        }
        MultiLayerNetwork model;
        try {
            model = ModelSerializer.restoreMultiLayerNetwork(file, true);
        } catch (RuntimeException e) {
            throw new SnapshotException("Could not read model from " + file, e);
        }
        checkArchitecture(model, stateSize, actionSize, hiddenDim);
        return new QNetwork(model, stateSize, actionSize, hiddenDim);
    }

    public void save(File file) throws IOException {
        ModelSerializer.writeModel(model, file, true); // keep the Adam state too
    }

    // Q-values for a single observation
    public double[] predict(double[] state) {
        return output(Nd4j.create(new double[][]{state})).toDoubleVector();
    }

    // Q-values for a batch, one row per observation (inference mode)
    public INDArray output(INDArray states) {
        return model.output(states, false);
    }

    // One optimisation step towards the given targets under MSE
    public void fit(INDArray states, INDArray targets) {
        model.fit(states, targets);
    }

    public TargetNetwork snapshot() {
        return new TargetNetwork(model.clone());
    }

    // Copy of the flattened parameter vector
    public INDArray params() {
        return model.params().dup();
    }

    public ParameterSnapshot exportParameters() {
        return exportParameters(model);
    }

    // Checks every layer's shape before writing anything
    public void importParameters(ParameterSnapshot snapshot) throws SnapshotException {
        int[][] shapes = layerShapes();
        INDArray[] weights = new INDArray[shapes.length];
        INDArray[] biases = new INDArray[shapes.length];
        for (int i = 0; i < shapes.length; i++) {
            String name = QNetworkBuilder.LAYER_NAMES[i];
            LayerParameters layer = snapshot.layer(name);
            int in = shapes[i][0];
            int out = shapes[i][1];
            if (layer.inputs() != in || layer.outputs() != out) {
                throw new SnapshotException(String.format("Layer %s is %dx%d (out x in) in the snapshot, network expects %dx%d",
                        name, layer.outputs(), layer.inputs(), out, in));
            }
            weights[i] = Nd4j.create(layer.getWeight()).transpose().dup();
            biases[i] = Nd4j.create(layer.getBias()).reshape(1, out);
        }
        for (int i = 0; i < shapes.length; i++) {
            model.setParam(i + "_" + DefaultParamInitializer.WEIGHT_KEY, weights[i]);
            model.setParam(i + "_" + DefaultParamInitializer.BIAS_KEY, biases[i]);
        }
    }

    // {in, out} per layer
    private int[][] layerShapes() {
        return new int[][]{{stateSize, hiddenDim}, {hiddenDim, hiddenDim}, {hiddenDim, actionSize}};
    }

    static ParameterSnapshot exportParameters(MultiLayerNetwork model) {
        Map<String, LayerParameters> layers = new LinkedHashMap<>();
        for (int i = 0; i < QNetworkBuilder.LAYER_NAMES.length; i++) {
            INDArray w = model.getParam(i + "_" + DefaultParamInitializer.WEIGHT_KEY); // [in, out]
            INDArray b = model.getParam(i + "_" + DefaultParamInitializer.BIAS_KEY);
            layers.put(QNetworkBuilder.LAYER_NAMES[i], new LayerParameters(w.transpose().toDoubleMatrix(), b.toDoubleVector()));
        }
        return new ParameterSnapshot(layers);
    }

    static void checkArchitecture(MultiLayerNetwork model, int stateSize, int actionSize, int hiddenDim) throws SnapshotException {
        if (model.getnLayers() != QNetworkBuilder.LAYER_NAMES.length) {
            throw new SnapshotException("Expected " + QNetworkBuilder.LAYER_NAMES.length + " layers, model has " + model.getnLayers());
        }
        long[][] expected = {{stateSize, hiddenDim}, {hiddenDim, hiddenDim}, {hiddenDim, actionSize}};
        for (int i = 0; i < expected.length; i++) {
            long[] shape = model.getParam(i + "_" + DefaultParamInitializer.WEIGHT_KEY).shape();
            if (!Arrays.equals(shape, expected[i])) {
                throw new SnapshotException("Layer " + QNetworkBuilder.LAYER_NAMES[i] + " has weight shape "
                        + Arrays.toString(shape) + ", expected " + Arrays.toString(expected[i]));
            }
        }
    }

    public int getStateSize() {
        return stateSize;
    }

    public int getActionSize() {
        return actionSize;
    }

    public int getHiddenDim() {
        return hiddenDim;
    }
}
