package com.entity.linker.classifier;

/**
 * Array helpers for the parameter records.
 */
final class Matrices {

    private Matrices() {
    }

    /**
     * Deep copy of a row-major matrix.
     */
    static double[][] copy(double[][] matrix) {
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
