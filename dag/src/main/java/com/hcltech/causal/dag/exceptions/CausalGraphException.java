package com.hcltech.causal.dag.exceptions;

/** Root of the contract violations raised by graph operations. None are retryable. */
public abstract class CausalGraphException extends RuntimeException {
    protected CausalGraphException(String message) { super(message); }
}
