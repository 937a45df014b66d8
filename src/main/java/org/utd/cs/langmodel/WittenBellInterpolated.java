package org.utd.cs.langmodel;

import org.utd.cs.langmodel.smoothing.WittenBell;

/** Interpolated model with Witten-Bell smoothing. */
public class WittenBellInterpolated extends InterpolatedLanguageModel {

    public WittenBellInterpolated(int order) {
        super(WittenBell::new, order);
    }

    public WittenBellInterpolated(int order, Vocabulary vocabulary) {
        super(WittenBell::new, order, vocabulary);
    }

    public WittenBellInterpolated(int order, Vocabulary vocabulary, NgramCounter counts) {
        super(WittenBell::new, order, vocabulary, counts);
    }
}
