package com.fleet.anomaly.engine.isolationforest;

import com.fleet.anomaly.model.FeatureRecord;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;

import java.util.Arrays;
import java.util.List;

/**
 * Builds the model input for one unit: one row per moving interval, one column per
 * configured feature.
 *
 * Steps, all computed from the given rows only:
 *   1. missing values are replaced by the column median of the non-missing values
 *   2. each column is centred on its mean and divided by its population standard deviation
 *      (a constant column is only centred)
 */
public final class FeatureExtractor {

    private FeatureExtractor() {}

    /**
     * @throws IllegalStateException when a column has no usable value, so the unit cannot be modelled
     */
    public static double[][] extract(List<FeatureRecord> rows, List<String> features) {
        int n = rows.size();
        int d = features.size();
        double[][] matrix = new double[n][d];

        for (int j = 0; j < d; j++) {
            String feature = features.get(j);
            double[] column = new double[n];
            for (int i = 0; i < n; i++) {
                column[i] = rows.get(i).get(feature);
            }
            impute(column, feature);
            standardize(column);
            for (int i = 0; i < n; i++) {
                matrix[i][j] = column[i];
            }
        }
        return matrix;
    }

    private static void impute(double[] column, String feature) {
        double[] present = Arrays.stream(column).filter(Double::isFinite).toArray();
        if (present.length == 0) {
            throw new IllegalStateException("Feature " + feature + " has no finite value to impute from");
        }
        if (present.length == column.length) {
            return;
        }
        double median = new Median().evaluate(present);
        for (int i = 0; i < column.length; i++) {
            if (!Double.isFinite(column[i])) {
                column[i] = median;
            }
        }
    }

    private static void standardize(double[] column) {
        double mean = new Mean().evaluate(column);
        double std = new StandardDeviation(false).evaluate(column, mean);
        double scale = std > 0.0 ? std : 1.0;
        for (int i = 0; i < column.length; i++) {
            column[i] = (column[i] - mean) / scale;
        }
    }
}
