package com.powersentinel.core.prediction;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ridge-regularised least squares over a second-order expansion of the
 * standardised features.
 *
 * <h3>Basis</h3>
 * <p>
 * Each feature is standardised to zero mean and unit variance over the
 * training set. Features that are constant in the training set carry no
 * information and are dropped. The basis is the intercept, every remaining
 * standardised feature, and every pairwise product (squares included), which
 * lets the model represent interactions such as {@code voltage × current}
 * exactly.
 * </p>
 *
 * <h3>Solve</h3>
 * <p>
 * Coefficients solve {@code (XᵀX + λnI')β = Xᵀy} by QR decomposition, where
 * {@code I'} is the identity with the intercept entry zeroed so the intercept
 * is never penalised. The penalty keeps the system well-posed when features
 * are collinear (power factor and efficiency always are).
 * </p>
 *
 * @since 1.0.0
 */
public class QuadraticRidgeRegression implements RegressionTrainer {

    /** Default ridge penalty per observation. */
    public static final double DEFAULT_PENALTY = 1e-6;

    private static final double CONSTANT_COLUMN_TOLERANCE = 1e-12;

    private final double penalty;

    public QuadraticRidgeRegression() {
        this(DEFAULT_PENALTY);
    }

    /**
     * @param penalty ridge penalty per observation; must be &gt; 0
     * @throws IllegalArgumentException if {@code penalty} is not positive
     */
    public QuadraticRidgeRegression(double penalty) {
        if (!(penalty > 0) || !Double.isFinite(penalty)) {
            throw new IllegalArgumentException("penalty must be a finite value > 0, got: " + penalty);
        }
        this.penalty = penalty;
    }

    @Override
    public RegressionModel fit(double[][] features, double[] targets) {
        Objects.requireNonNull(features, "features must not be null");
        Objects.requireNonNull(targets, "targets must not be null");
        int n = features.length;
        if (n == 0 || n != targets.length) {
            throw new ModelTrainingException(
                    "Training set must be non-empty with one target per row, got "
                            + n + " rows and " + targets.length + " targets");
        }
        int width = features[0].length;
        for (int r = 0; r < n; r++) {
            if (features[r].length != width) {
                throw new ModelTrainingException("Row " + r + " has " + features[r].length
                        + " features, expected " + width);
            }
            requireFinite(features[r], r);
            if (!Double.isFinite(targets[r])) {
                throw new ModelTrainingException("Non-finite target at row " + r);
            }
        }

        double[] means = new double[width];
        double[] scales = new double[width];
        int[] active = standardisation(features, means, scales);

        int basisSize = basisSize(active.length);
        double[][] design = new double[n][];
        for (int r = 0; r < n; r++) {
            design[r] = expand(features[r], active, means, scales, basisSize);
        }

        RealMatrix x = MatrixUtils.createRealMatrix(design);
        RealMatrix xt = x.transpose();
        RealMatrix normal = xt.multiply(x);
        for (int j = 1; j < basisSize; j++) {
            normal.addToEntry(j, j, penalty * n);
        }
        RealVector rhs = xt.operate(new ArrayRealVector(targets, false));

        double[] coefficients;
        try {
            coefficients = new QRDecomposition(normal).getSolver().solve(rhs).toArray();
        } catch (SingularMatrixException e) {
            throw new ModelTrainingException("Normal equations are singular", e);
        }
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new ModelTrainingException("Fit produced non-finite coefficients");
            }
        }
        return new Model(width, active, means, scales, coefficients);
    }

    // ---------------------------------------------------------------
    // Basis helpers
    // ---------------------------------------------------------------

    /** Fills means/scales and returns the indices of non-constant columns. */
    private static int[] standardisation(double[][] features, double[] means, double[] scales) {
        int n = features.length;
        int width = means.length;
        int[] active = new int[width];
        int k = 0;
        for (int c = 0; c < width; c++) {
            double sum = 0;
            for (double[] row : features) {
                sum += row[c];
            }
            double mean = sum / n;
            double squares = 0;
            for (double[] row : features) {
                double d = row[c] - mean;
                squares += d * d;
            }
            double sd = Math.sqrt(squares / n);
            means[c] = mean;
            scales[c] = sd;
            if (sd > CONSTANT_COLUMN_TOLERANCE * Math.max(1.0, Math.abs(mean))) {
                active[k++] = c;
            }
        }
        return Arrays.copyOf(active, k);
    }

    private static int basisSize(int activeCount) {
        return 1 + activeCount + activeCount * (activeCount + 1) / 2;
    }

    private static double[] expand(double[] row, int[] active, double[] means, double[] scales, int basisSize) {
        double[] basis = new double[basisSize];
        basis[0] = 1.0;
        int k = active.length;
        double[] z = new double[k];
        for (int i = 0; i < k; i++) {
            int c = active[i];
            z[i] = (row[c] - means[c]) / scales[c];
            basis[1 + i] = z[i];
        }
        int pos = 1 + k;
        for (int i = 0; i < k; i++) {
            for (int j = i; j < k; j++) {
                basis[pos++] = z[i] * z[j];
            }
        }
        return basis;
    }

    private static void requireFinite(double[] row, int index) {
        for (double v : row) {
            if (!Double.isFinite(v)) {
                throw new ModelTrainingException("Non-finite feature at row " + index);
            }
        }
    }

    // ---------------------------------------------------------------
    // Fitted model
    // ---------------------------------------------------------------

    private static final class Model implements RegressionModel {

        private final int width;
        private final int[] active;
        private final double[] means;
        private final double[] scales;
        private final double[] coefficients;

        private Model(int width, int[] active, double[] means, double[] scales, double[] coefficients) {
            this.width = width;
            this.active = active;
            this.means = means;
            this.scales = scales;
            this.coefficients = coefficients;
        }

        @Override
        public double predict(double[] features) {
            Objects.requireNonNull(features, "features must not be null");
            if (features.length != width) {
                throw new IllegalArgumentException(
                        "Expected " + width + " features, got: " + features.length);
            }
            double[] basis = expand(features, active, means, scales, coefficients.length);
            double sum = 0;
            for (int i = 0; i < basis.length; i++) {
                sum += coefficients[i] * basis[i];
            }
            return sum;
        }

        @Override
        public int featureCount() {
            return width;
        }
    }
}
