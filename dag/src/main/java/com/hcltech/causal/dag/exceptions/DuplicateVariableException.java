package com.hcltech.causal.dag.exceptions;

public final class DuplicateVariableException extends CausalGraphException {
    private final String variable;

    public DuplicateVariableException(String variable) {
        super("Duplicate variable: " + variable);
        this.variable = variable;
    }

    public String variable() { return variable; }
}
