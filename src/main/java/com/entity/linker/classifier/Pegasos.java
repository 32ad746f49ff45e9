package com.entity.linker.classifier;

import java.util.Random;

/**
 * Pegasos stochastic sub-gradient descent for the hinge-loss SVM objective
 * {@code lambda/2 |w|^2 + mean(max(0, 1 - y w.x))}.
 */
final class Pegasos {

    private Pegasos() {
    }

    /**
     * Primal solver over inputs augmented with a constant 1.
     *
     * @return weights followed by the bias term
     */
    static double[] trainLinear(TrainingData data, double lambda, int epochs, Random random) {
        int features = data.featureCount();
        double[] w = new double[features + 1];
        double maxNorm = 1.0 / Math.sqrt(lambda);
        long t = 0;
        int[] order = identity(data.size());
        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            for (int i : order) {
                t++;
                double eta = 1.0 / (lambda * t);
                double[] x = data.inputs()[i];
                int y = data.sign(i);
                double margin = y * dotAugmented(w, x);

                double decay = 1.0 - eta * lambda;
                for (int f = 0; f < w.length; f++) {
                    w[f] *= decay;
                }
                if (margin < 1.0) {
                    for (int f = 0; f < features; f++) {
                        w[f] += eta * y * x[f];
                    }
                    w[features] += eta * y;
                }
                double norm = 0.0;
                for (double v : w) {
                    norm += v * v;
                }
                norm = Math.sqrt(norm);
                if (norm > maxNorm) {
                    double scale = maxNorm / norm;
                    for (int f = 0; f < w.length; f++) {
                        w[f] *= scale;
                    }
                }
            }
        }
        return w;
    }

    /**
     * Kernelized solver. Returns the signed dual coefficients, already divided by
     * {@code lambda * T}, so that {@code f(x) = sum_j c_j K(x_j, x)}.
     */
    static double[] trainKernel(TrainingData data, double lambda, int epochs, double gamma, Random random) {
        int n = data.size();
        int[] alpha = new int[n];
        // running sum_j alpha_j y_j K(x_j, x_i) for every i
        double[] accumulated = new double[n];
        long t = 0;
        int[] order = identity(n);
        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            for (int i : order) {
                t++;
                int y = data.sign(i);
                if (y * accumulated[i] / (lambda * t) < 1.0) {
                    alpha[i]++;
                    double[] xi = data.inputs()[i];
                    for (int k = 0; k < n; k++) {
                        accumulated[k] += y * KernelSvmParameters.kernel(xi, data.inputs()[k], gamma);
                    }
                }
            }
        }
        double[] coefficients = new double[n];
        for (int i = 0; i < n; i++) {
            coefficients[i] = alpha[i] * data.sign(i) / (lambda * t);
        }
        return coefficients;
    }

    static double dotAugmented(double[] w, double[] x) {
        double sum = w[x.length];
        for (int f = 0; f < x.length; f++) {
            sum += w[f] * x[f];
        }
        return sum;
    }

    static int[] identity(int n) {
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        return order;
    }

    static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }
}
