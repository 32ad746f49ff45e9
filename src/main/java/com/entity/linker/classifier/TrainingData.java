package com.entity.linker.classifier;

/**
 * Dense design matrix with 0/1 labels, as handed to the learning routines.
 */
record TrainingData(double[][] inputs, int[] labels) {

    int size() {
        return labels.length;
    }

    int featureCount() {
        return inputs[0].length;
    }

    int positives() {
        int count = 0;
        for (int label : labels) {
            count += label;
        }
        return count;
    }

    /**
     * Label as {@code -1 / +1}.
     */
    int sign(int index) {
        return labels[index] == 1 ? 1 : -1;
    }
}
