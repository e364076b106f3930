package com.hcltech.causal.common.errorsor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

record Value<T>(T value) implements ErrorsOr<T> {
    Value {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isError() {
        return false;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.of(value);
    }

    @Override
    public List<String> getErrors() {
        return List.of();
    }

    @Override
    public ErrorsOr<T> addPrefixIfError(String prefix) {
        return this;
    }
}
