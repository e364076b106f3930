package com.hcltech.causal.dag.exceptions;

public final class UnknownVariableException extends CausalGraphException {
    private final String variable;

    public UnknownVariableException(String variable) {
        super("Unknown variable: " + variable);
        this.variable = variable;
    }

    public String variable() { return variable; }
}
