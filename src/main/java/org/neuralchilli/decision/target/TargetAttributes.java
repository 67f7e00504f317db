package org.neuralchilli.decision.target;

/**
 * Task attributes read by target-task methods.
 */
public final class TargetAttributes {

    public static final String NORMAL_CI = "normal-ci";
    public static final String FULL_CI = "full-ci";
    public static final String RELEASE_ONLY = "release-only";
    public static final String SHIPPING_PHASE = "shipping-phase";

    public static final String PHASE_PROMOTE = "promote";
    public static final String PHASE_SHIP = "ship";

    private TargetAttributes() {
    }
}
