package org.utd.cs.langmodel.smoothing;

/**
 * One interpolation step: {@code alpha} is the discounted probability of the
 * word in the current context, {@code gamma} the weight passed down to the
 * next shorter context.
 */
public final class AlphaGamma {

    /** Contributes nothing and defers entirely to the lower order. */
    public static final AlphaGamma DEFER = new AlphaGamma(0.0, 1.0);

    private final double alpha;
    private final double gamma;

    public AlphaGamma(double alpha, double gamma) {
        this.alpha = alpha;
        this.gamma = gamma;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getGamma() {
        return gamma;
    }

    @Override
    public String toString() {
        return "(alpha=" + alpha + ", gamma=" + gamma + ")";
    }
}
