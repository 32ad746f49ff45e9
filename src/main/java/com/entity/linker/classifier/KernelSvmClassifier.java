package com.entity.linker.classifier;

import java.util.ArrayList;
import java.util.List;

/**
 * RBF kernel SVM trained with kernelized Pegasos, calibrated by Platt scaling on the
 * training decision values.
 */
public class KernelSvmClassifier extends AbstractClassifier {

    public KernelSvmClassifier(ClassifierOptions options) {
        super(options);
    }

    @Override
    public ClassifierType type() {
        return ClassifierType.SVM;
    }

    @Override
    protected ModelParameters train(TrainingData data) {
        double gamma = options.getRbfGamma() > 0 ? options.getRbfGamma() : 1.0 / data.featureCount();
        double[] coefficients = Pegasos.trainKernel(
                data, options.getRegularization(), options.getEpochs(), gamma, random());

        List<double[]> supportVectors = new ArrayList<>();
        List<Double> kept = new ArrayList<>();
        for (int i = 0; i < coefficients.length; i++) {
            if (coefficients[i] != 0.0) {
                supportVectors.add(data.inputs()[i]);
                kept.add(coefficients[i]);
            }
        }
        double[] keptCoefficients = kept.stream().mapToDouble(Double::doubleValue).toArray();
        double[][] vectors = supportVectors.toArray(new double[0][]);

        KernelSvmParameters uncalibrated = new KernelSvmParameters(vectors, keptCoefficients, gamma, 0.0, 0.0);
        double[] decisionValues = new double[data.size()];
        for (int i = 0; i < data.size(); i++) {
            decisionValues[i] = uncalibrated.margin(data.inputs()[i]);
        }
        double[] platt = PlattScaling.fit(decisionValues, data.labels());
        return new KernelSvmParameters(vectors, keptCoefficients, gamma, platt[0], platt[1]);
    }
}
