package com.entity.linker.classifier;

/**
 * Evaluation metrics of one cross-validation fold.
 */
public record FoldMetrics(int fold, ConfusionMatrix confusion) {

    public double precision() {
        return confusion.precision();
    }

    public double recall() {
        return confusion.recall();
    }

    public double fScore() {
        return confusion.fScore();
    }
}
