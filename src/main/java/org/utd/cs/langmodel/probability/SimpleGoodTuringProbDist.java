/**
 * SimpleGoodTuringProbDist.java
 * Language Model Toolkit
 *
 * Description: Simple Good-Turing estimate (Gale and Sampson, "Good-Turing
 * Frequency Estimation Without Tears", 1995).
 *
 * The frequency-of-frequency table Nr is noisy and full of holes for large r,
 * so it is replaced by a power curve S(r) = exp(a + b * log(r)) fitted by
 * least squares in log-log space. The fitting proceeds in four steps:
 *
 *  1. Collect the (r, Nr) pairs with Nr > 0.
 *  2. Average each Nr over the gap to its neighbours (Zr = 2 Nr / (r+ - r-)),
 *     so that isolated counts at high r do not flatten the line.
 *  3. Regress log(Zr) on log(r) to get slope b and intercept a.
 *  4. For small r, keep the raw Turing estimate (r+1) Nr(r+1) / Nr(r) while it
 *     differs significantly (more than 1.96 standard deviations) from the
 *     smoothed one; from the first r where it does not, or where the r values
 *     stop being contiguous, switch to (r+1) S(r+1) / S(r) for good.
 *
 * Unseen samples keep Nr(1) / N as a whole, and the seen estimates are
 * renormalized so everything sums to one.
 */

package org.utd.cs.langmodel.probability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class SimpleGoodTuringProbDist<T extends Comparable<? super T>> implements ProbDist<T> {
    private static final Logger logger = LoggerFactory.getLogger(SimpleGoodTuringProbDist.class);

    // 0.05 significance criterion
    private static final double CONFIDENCE = 1.96;

    private final FreqDist<T> freqdist;
    private final int bins;

    private double slope = 0.0;
    private double intercept = 0.0;
    private int switchAt = 0;
    private double renormal = 1.0;

    public SimpleGoodTuringProbDist(FreqDist<T> freqdist) {
        this(freqdist, null);
    }

    public SimpleGoodTuringProbDist(FreqDist<T> freqdist, Integer bins) {
        this.bins = Bins.resolve(freqdist, bins, "SimpleGoodTuring");
        this.freqdist = freqdist;

        List<int[]> rNr = collectRNr();
        findBestFit(rNr);
        findSwitch(rNr);
        renormalize(rNr);

        logger.debug("SGT fit over {} points: slope={}, intercept={}, switchAt={}, renormal={}",
                rNr.size(), slope, intercept, switchAt, renormal);
    }

    /** Ascending (r, Nr) pairs for every r with Nr(r) > 0. */
    private List<int[]> collectRNr() {
        List<int[]> out = new ArrayList<>();
        int seen = 0;
        int r = 1;
        while (seen < freqdist.getB()) {
            int nr = freqdist.frequencyOfFrequency(r);
            if (nr > 0) {
                out.add(new int[]{ r, nr });
                seen += nr;
            }
            r++;
        }
        return out;
    }

    private void findBestFit(List<int[]> rNr) {
        if (rNr.isEmpty()) return;

        int size = rNr.size();
        double[] logR = new double[size];
        double[] logZr = new double[size];

        for (int j = 0; j < size; j++) {
            int r = rNr.get(j)[0];
            int nr = rNr.get(j)[1];
            int i = (j > 0) ? rNr.get(j - 1)[0] : 0;
            int k = (j != size - 1) ? rNr.get(j + 1)[0] : 2 * r - i;
            double zr = 2.0 * nr / (k - i);

            logR[j] = Math.log(r);
            logZr[j] = Math.log(zr);
        }

        double xMean = 0, yMean = 0;
        for (int j = 0; j < size; j++) {
            xMean += logR[j];
            yMean += logZr[j];
        }
        xMean /= size;
        yMean /= size;

        double xyCov = 0, xVar = 0;
        for (int j = 0; j < size; j++) {
            xyCov += (logR[j] - xMean) * (logZr[j] - yMean);
            xVar += (logR[j] - xMean) * (logR[j] - xMean);
        }

        if (xVar != 0) {
            slope = xyCov / xVar;
        } else {
            logger.debug("Zero variance in log(r); using a flat fit.");
            slope = 0.0;
        }
        intercept = yMean - slope * xMean;

        if (slope >= -1) {
            logger.warn("SimpleGoodTuring did not find a proper best fit line for smoothing probabilities "
                    + "of occurrences (slope={}). The probability estimates are likely to be unreliable.", slope);
        }
    }

    private void findSwitch(List<int[]> rNr) {
        for (int i = 0; i < rNr.size(); i++) {
            int r = rNr.get(i)[0];

            // end of the table, or a gap in r
            if (i + 1 == rNr.size() || rNr.get(i + 1)[0] != r + 1) {
                switchAt = r;
                return;
            }

            int nr = rNr.get(i)[1];
            int nr1 = rNr.get(i + 1)[1];
            double smoothRStar = (r + 1) * smoothedNr(r + 1) / smoothedNr(r);
            double unsmoothRStar = (double) (r + 1) * nr1 / nr;
            double std = Math.sqrt(variance(r, nr, nr1));

            if (Math.abs(unsmoothRStar - smoothRStar) <= CONFIDENCE * std) {
                switchAt = r;
                return;
            }
        }
    }

    private static double variance(double r, double nr, double nr1) {
        return (r + 1.0) * (r + 1.0) * (nr1 / (nr * nr)) * (1.0 + nr1 / nr);
    }

    private void renormalize(List<int[]> rNr) {
        double probCov = 0.0;
        for (int[] pair : rNr) {
            probCov += pair[1] * probMeasure(pair[0]);
        }
        if (probCov != 0) {
            renormal = (1 - probMeasure(0)) / probCov;
        }
    }

    /** S(r), the fitted number of samples with count r. */
    public double smoothedNr(int r) {
        return Math.exp(intercept + slope * Math.log(r));
    }

    @Override
    public double prob(T sample) {
        int count = freqdist.count(sample);
        double p = probMeasure(count);
        if (count == 0) {
            int unseenBins = bins - freqdist.getB();
            if (unseenBins == 0) return 0.0;
            return p / unseenBins;
        }
        return p * renormal;
    }

    // Unnormalized r* / N; for count 0 this is the whole unseen mass.
    private double probMeasure(int count) {
        long n = freqdist.getN();
        if (count == 0) {
            if (n == 0) return 1.0;
            return (double) freqdist.frequencyOfFrequency(1) / n;
        }

        double er1, er;
        if (switchAt > count) {
            er1 = freqdist.frequencyOfFrequency(count + 1);
            er = freqdist.frequencyOfFrequency(count);
        } else {
            er1 = smoothedNr(count + 1);
            er = smoothedNr(count);
        }
        double rStar = (count + 1) * er1 / er;
        return rStar / n;
    }

    /**
     * Total unseen mass, Nr(1) / N. An empty distribution hands all of its
     * mass to the unseen bins, so this is 1, or 0 when there are no bins.
     */
    @Override
    public double discount() {
        if (freqdist.getN() == 0) return (bins > 0) ? 1.0 : 0.0;
        return probMeasure(0);
    }

    @Override
    public T max() {
        return freqdist.max();
    }

    @Override
    public List<T> samples() {
        return freqdist.keys();
    }

    public FreqDist<T> getFreqDist() {
        return freqdist;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public int getSwitchAt() {
        return switchAt;
    }

    @Override
    public String toString() {
        return "SimpleGoodTuringProbDist based on " + freqdist.getN() + " samples";
    }
}
