package com.hcltech.causal.common.errorsor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Never empty; the messages keep the order they were reported in. */
record Error<T>(List<String> errors) implements ErrorsOr<T> {
    Error {
        errors = List.copyOf(errors);
        if (errors.isEmpty()) throw new IllegalArgumentException("Errors must not be empty");
    }

    @Override
    public boolean isError() {
        return true;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.empty();
    }

    @Override
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public ErrorsOr<T> addPrefixIfError(String prefix) {
        List<String> prefixed = new ArrayList<>(errors.size());
        for (String e : errors) prefixed.add(prefix + e);
        return new Error<>(prefixed);
    }
}
