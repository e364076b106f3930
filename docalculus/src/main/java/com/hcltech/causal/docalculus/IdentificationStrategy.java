package com.hcltech.causal.docalculus;

public enum IdentificationStrategy {
    /** Adjust for the set directly: P(y|do(x)) = Σ_z P(y|x,z) P(z). */
    BACKDOOR,
    /** Adjust through the mediator set: P(y|do(x)) = Σ_m P(m|x) Σ_x' P(y|x',m) P(x'). */
    FRONTDOOR,
    /** No candidate set identifies the effect. A normal outcome, not a failure. */
    UNIDENTIFIABLE
}
