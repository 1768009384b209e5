package com.seasonalesd.core.decomposition;

/**
 * Locally weighted regression (degree 0 or 1, tricube kernel) over the
 * positions 1..n of a series, as used by the STL smoothing passes.
 *
 * <p>
 * Positions are 1-based throughout so that the neighbourhood arithmetic
 * reads like the published STL procedure; arrays are addressed with
 * {@code position - 1}.
 * </p>
 */
final class Loess {

    private Loess() {
    }

    /**
     * Smooth {@code y[0..n)} with a window of {@code span} points, writing the
     * fitted values to {@code out[outOffset..outOffset + n)}.
     *
     * <p>
     * A position whose neighbourhood carries no weight keeps its raw value.
     * </p>
     */
    static void smooth(double[] y, int n, int span, int degree,
            double[] robustnessWeights, double[] out, int outOffset) {
        if (n < 2) {
            out[outOffset] = y[0];
            return;
        }
        double[] weights = new double[n];
        int left = 1;
        int right = Math.min(span, n);
        int halfSpan = (span + 1) / 2;
        for (int i = 1; i <= n; i++) {
            if (span < n && i > halfSpan && right != n) {
                left++;
                right++;
            }
            double fit = estimate(y, n, span, degree, i, left, right, weights, robustnessWeights);
            out[outOffset + i - 1] = Double.isNaN(fit) ? y[i - 1] : fit;
        }
    }

    /**
     * Fitted value at position {@code x} from the points {@code left..right}.
     *
     * @return the fit, or {@code NaN} if the neighbourhood has zero total weight
     */
    static double estimate(double[] y, int n, int span, int degree, double x,
            int left, int right, double[] weights, double[] robustnessWeights) {
        double range = n - 1.0;
        double h = Math.max(x - left, right - x);
        if (span > n) {
            h += (span - n) / 2;
        }
        double upper = 0.999 * h;
        double lower = 0.001 * h;

        double total = 0;
        for (int j = left; j <= right; j++) {
            double w = 0;
            double r = Math.abs(j - x);
            if (r <= upper) {
                if (r <= lower) {
                    w = 1;
                } else {
                    double ratio = r / h;
                    double c = 1 - ratio * ratio * ratio;
                    w = c * c * c;
                }
                if (robustnessWeights != null) {
                    w *= robustnessWeights[j - 1];
                }
            }
            weights[j - 1] = w;
            total += w;
        }
        if (total <= 0) {
            return Double.NaN;
        }

        for (int j = left; j <= right; j++) {
            weights[j - 1] /= total;
        }
        if (h > 0 && degree > 0) {
            double center = 0;
            for (int j = left; j <= right; j++) {
                center += weights[j - 1] * j;
            }
            double slope = x - center;
            double spread = 0;
            for (int j = left; j <= right; j++) {
                spread += weights[j - 1] * (j - center) * (j - center);
            }
            if (Math.sqrt(spread) > 0.001 * range) {
                slope /= spread;
                for (int j = left; j <= right; j++) {
                    weights[j - 1] *= slope * (j - center) + 1;
                }
            }
        }

        double fit = 0;
        for (int j = left; j <= right; j++) {
            fit += weights[j - 1] * y[j - 1];
        }
        return fit;
    }
}
