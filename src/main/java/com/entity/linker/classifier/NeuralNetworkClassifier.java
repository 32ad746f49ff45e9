package com.entity.linker.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Feed-forward network trained with mini-batch Adam on binary cross-entropy.
 * ReLU hidden layers use He initialization; the sigmoid output unit uses Xavier.
 * With no hidden layers this is the single-layer perceptron.
 */
public class NeuralNetworkClassifier extends AbstractClassifier {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double ADAM_EPSILON = 1e-8;

    private final ClassifierType type;
    private final List<Integer> hiddenLayers;

    private NeuralNetworkClassifier(ClassifierType type, List<Integer> hiddenLayers, ClassifierOptions options) {
        super(options);
        this.type = type;
        this.hiddenLayers = List.copyOf(hiddenLayers);
    }

    public static NeuralNetworkClassifier singleLayer(ClassifierOptions options) {
        return new NeuralNetworkClassifier(ClassifierType.SINGLE_LAYER_PERCEPTRON, List.of(), options);
    }

    public static NeuralNetworkClassifier multiLayer(ClassifierOptions options) {
        ClassifierOptions resolved = options != null ? options : ClassifierOptions.defaults();
        return new NeuralNetworkClassifier(ClassifierType.MULTI_LAYER_PERCEPTRON, resolved.getHiddenLayers(), resolved);
    }

    @Override
    public ClassifierType type() {
        return type;
    }

    public List<Integer> getHiddenLayers() {
        return hiddenLayers;
    }

    @Override
    protected ModelParameters train(TrainingData data) {
        Random random = random();
        List<Integer> widths = new ArrayList<>();
        widths.add(data.featureCount());
        widths.addAll(hiddenLayers);
        widths.add(1);

        int layerCount = widths.size() - 1;
        double[][][] w = new double[layerCount][][];
        double[][] b = new double[layerCount][];
        for (int l = 0; l < layerCount; l++) {
            int in = widths.get(l);
            int out = widths.get(l + 1);
            boolean output = l == layerCount - 1;
            double std = Math.sqrt((output ? 1.0 : 2.0) / in);
            w[l] = new double[out][in];
            b[l] = new double[out];
            for (int o = 0; o < out; o++) {
                for (int i = 0; i < in; i++) {
                    w[l][o][i] = random.nextGaussian() * std;
                }
            }
        }

        Adam adam = new Adam(w, b, options.getLearningRate());
        int[] order = Pegasos.identity(data.size());
        int batchSize = Math.min(options.getBatchSize(), data.size());

        for (int epoch = 0; epoch < options.getEpochs(); epoch++) {
            Pegasos.shuffle(order, random);
            for (int start = 0; start < order.length; start += batchSize) {
                int end = Math.min(order.length, start + batchSize);
                double[][][] gw = zerosLike(w);
                double[][] gb = zerosLike(b);
                for (int k = start; k < end; k++) {
                    int index = order[k];
                    backpropagate(w, b, data.inputs()[index], data.labels()[index], gw, gb);
                }
                double scale = 1.0 / (end - start);
                adam.step(w, b, gw, gb, scale);
            }
        }

        List<NeuralNetworkParameters.DenseLayer> layers = new ArrayList<>(layerCount);
        for (int l = 0; l < layerCount; l++) {
            layers.add(new NeuralNetworkParameters.DenseLayer(w[l], b[l]));
        }
        return new NeuralNetworkParameters(layers);
    }

    /**
     * Adds the gradient of the cross-entropy loss for one example to {@code gw} and {@code gb}.
     */
    private static void backpropagate(double[][][] w, double[][] b, double[] input, int label,
                                      double[][][] gw, double[][] gb) {
        int layerCount = w.length;
        double[][] activations = new double[layerCount + 1][];
        double[][] preActivations = new double[layerCount][];
        activations[0] = input;
        for (int l = 0; l < layerCount; l++) {
            double[] z = new double[w[l].length];
            for (int o = 0; o < z.length; o++) {
                double sum = b[l][o];
                double[] row = w[l][o];
                for (int i = 0; i < row.length; i++) {
                    sum += row[i] * activations[l][i];
                }
                z[o] = sum;
            }
            preActivations[l] = z;
            activations[l + 1] = l == layerCount - 1
                    ? new double[]{Activations.sigmoid(z[0])}
                    : Activations.relu(z);
        }

        double[] delta = {activations[layerCount][0] - label};
        for (int l = layerCount - 1; l >= 0; l--) {
            double[] previous = activations[l];
            for (int o = 0; o < delta.length; o++) {
                gb[l][o] += delta[o];
                for (int i = 0; i < previous.length; i++) {
                    gw[l][o][i] += delta[o] * previous[i];
                }
            }
            if (l > 0) {
                double[] next = new double[previous.length];
                for (int i = 0; i < next.length; i++) {
                    if (preActivations[l - 1][i] <= 0.0) {
                        continue;
                    }
                    double sum = 0.0;
                    for (int o = 0; o < delta.length; o++) {
                        sum += w[l][o][i] * delta[o];
                    }
                    next[i] = sum;
                }
                delta = next;
            }
        }
    }

    private static double[][][] zerosLike(double[][][] shape) {
        double[][][] out = new double[shape.length][][];
        for (int l = 0; l < shape.length; l++) {
            out[l] = new double[shape[l].length][shape[l][0].length];
        }
        return out;
    }

    private static double[][] zerosLike(double[][] shape) {
        double[][] out = new double[shape.length][];
        for (int l = 0; l < shape.length; l++) {
            out[l] = new double[shape[l].length];
        }
        return out;
    }

    private static final class Adam {
        private final double learningRate;
        private final double[][][] mw;
        private final double[][][] vw;
        private final double[][] mb;
        private final double[][] vb;
        private int t;

        Adam(double[][][] w, double[][] b, double learningRate) {
            this.learningRate = learningRate;
            this.mw = zerosLike(w);
            this.vw = zerosLike(w);
            this.mb = zerosLike(b);
            this.vb = zerosLike(b);
        }

        void step(double[][][] w, double[][] b, double[][][] gw, double[][] gb, double scale) {
            t++;
            double correction1 = 1.0 - Math.pow(BETA1, t);
            double correction2 = 1.0 - Math.pow(BETA2, t);
            for (int l = 0; l < w.length; l++) {
                for (int o = 0; o < w[l].length; o++) {
                    for (int i = 0; i < w[l][o].length; i++) {
                        w[l][o][i] -= update(gw[l][o][i] * scale, mw[l][o], vw[l][o], i, correction1, correction2);
                    }
                    b[l][o] -= update(gb[l][o] * scale, mb[l], vb[l], o, correction1, correction2);
                }
            }
        }

        private double update(double gradient, double[] m, double[] v, int index,
                              double correction1, double correction2) {
            m[index] = BETA1 * m[index] + (1 - BETA1) * gradient;
            v[index] = BETA2 * v[index] + (1 - BETA2) * gradient * gradient;
            double mHat = m[index] / correction1;
            double vHat = v[index] / correction2;
            return learningRate * mHat / (Math.sqrt(vHat) + ADAM_EPSILON);
        }
    }
}
