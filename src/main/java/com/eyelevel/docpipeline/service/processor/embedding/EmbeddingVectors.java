package com.eyelevel.docpipeline.service.processor.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Vector arithmetic for combining chunk embeddings into one document embedding.
 */
public final class EmbeddingVectors {

    private EmbeddingVectors() {
    }

    /**
     * Averages the vectors element-wise, then scales the mean to unit length.
     * A zero mean is returned unscaled.
     *
     * @throws IllegalArgumentException if the list is empty or the vectors differ in length.
     */
    public static List<Double> averageAndNormalize(List<List<Double>> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty list of embeddings");
        }
        int dimensions = vectors.get(0).size();
        double[] sum = new double[dimensions];
        for (List<Double> vector : vectors) {
            if (vector.size() != dimensions) {
                throw new IllegalArgumentException("Embedding dimensions differ: expected " + dimensions
                        + " but was " + vector.size());
            }
            for (int i = 0; i < dimensions; i++) {
                sum[i] += vector.get(i);
            }
        }

        double magnitude = 0;
        for (int i = 0; i < dimensions; i++) {
            sum[i] /= vectors.size();
            magnitude += sum[i] * sum[i];
        }
        magnitude = Math.sqrt(magnitude);

        List<Double> result = new ArrayList<>(dimensions);
        for (double value : sum) {
            result.add(magnitude == 0 ? value : value / magnitude);
        }
        return result;
    }

    public static double magnitude(List<Double> vector) {
        double sum = 0;
        for (double value : vector) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }
}
