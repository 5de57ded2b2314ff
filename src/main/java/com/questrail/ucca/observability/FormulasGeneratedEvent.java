package com.questrail.ucca.observability;

import com.questrail.ucca.formula.TimingConstraint;

/**
 * Record summarizing one generator run.
 *
 * @param constraint      the requested constraint category
 * @param controllerCount number of controllers supplied
 * @param actionCount     number of actions supplied
 * @param formulaCount    number of formulas produced
 * @param skippedReason   why nothing was generated, or {@code null} if the
 *                        inputs were usable
 */
public record FormulasGeneratedEvent(
    TimingConstraint constraint,
    int controllerCount,
    int actionCount,
    int formulaCount,
    String skippedReason
) {
    public boolean skipped() {
        return skippedReason != null;
    }
}
