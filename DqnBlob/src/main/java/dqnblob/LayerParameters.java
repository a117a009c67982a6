package dqnblob;

// weight[out][in], bias[out]; DL4J holds the transpose
public final class LayerParameters {
    private final double[][] weight;
    private final double[] bias;

    public LayerParameters(double[][] weight, double[] bias) {
        if (weight.length != bias.length) {
            throw new IllegalArgumentException("weight has " + weight.length + " rows but bias has " + bias.length + " entries");
        }
        int in = weight.length == 0 ? 0 : weight[0].length;
        this.weight = new double[weight.length][];
        for (int i = 0; i < weight.length; i++) {
            if (weight[i].length != in) {
                throw new IllegalArgumentException("weight row " + i + " has " + weight[i].length + " columns, expected " + in);
            }
            this.weight[i] = weight[i].clone();
        }
        this.bias = bias.clone();
    }

    public int inputs() {
        return weight.length == 0 ? 0 : weight[0].length;
    }

    public int outputs() {
        return bias.length;
    }

    public double weight(int out, int in) {
        return weight[out][in];
    }

    public double bias(int out) {
        return bias[out];
    }

    public double[][] getWeight() {
        double[][] copy = new double[weight.length][];
        for (int i = 0; i < weight.length; i++) {
            copy[i] = weight[i].clone();
        }
        return copy;
    }

    public double[] getBias() {
        return bias.clone();
    }
}
