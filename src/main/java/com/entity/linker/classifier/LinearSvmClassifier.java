package com.entity.linker.classifier;

import java.util.Arrays;

/**
 * Linear SVM trained with Pegasos. Emits an uncalibrated margin.
 */
public class LinearSvmClassifier extends AbstractClassifier {

    public LinearSvmClassifier(ClassifierOptions options) {
        super(options);
    }

    @Override
    public ClassifierType type() {
        return ClassifierType.LINEAR_SVM;
    }

    @Override
    protected ModelParameters train(TrainingData data) {
        double[] w = Pegasos.trainLinear(data, options.getRegularization(), options.getEpochs(), random());
        int features = data.featureCount();
        return new LinearParameters(Arrays.copyOf(w, features), w[features]);
    }
}
