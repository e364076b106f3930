package com.hcltech.causal.docalculus;

import com.hcltech.causal.common.IEnvGetter;

/**
 * Bounds for candidate enumeration in {@link EffectIdentifier}.
 *
 * @param maxAdjustmentSetSize largest candidate set tried; enumeration is exponential in this
 * @param frontdoorEnabled     whether to search for frontdoor sets once backdoor search fails
 */
public record IdentificationConfig(int maxAdjustmentSetSize, boolean frontdoorEnabled) {
    public static final String MAX_ADJUSTMENT_SET_SIZE_ENV = "CAUSAL_MAX_ADJUSTMENT_SET_SIZE";
    public static final String FRONTDOOR_ENABLED_ENV = "CAUSAL_FRONTDOOR_ENABLED";
    public static final int DEFAULT_MAX_ADJUSTMENT_SET_SIZE = 3;

    public static final IdentificationConfig DEFAULT = new IdentificationConfig(DEFAULT_MAX_ADJUSTMENT_SET_SIZE, true);

    public IdentificationConfig {
        if (maxAdjustmentSetSize < 0) throw new IllegalArgumentException("maxAdjustmentSetSize must be >= 0: " + maxAdjustmentSetSize);
    }

    /** Every subset is a candidate. Exponential in the number of variables: opt in deliberately. */
    public static IdentificationConfig unbounded() {
        return new IdentificationConfig(Integer.MAX_VALUE, true);
    }

    public static IdentificationConfig fromEnv(IEnvGetter env) {
        return new IdentificationConfig(
                IEnvGetter.getIntOr(env, MAX_ADJUSTMENT_SET_SIZE_ENV, DEFAULT_MAX_ADJUSTMENT_SET_SIZE),
                IEnvGetter.getBooleanOr(env, FRONTDOOR_ENABLED_ENV, true));
    }
}
