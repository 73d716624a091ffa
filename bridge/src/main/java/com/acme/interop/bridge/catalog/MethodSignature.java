package com.acme.interop.bridge.catalog;

import java.util.List;
import java.util.Objects;

/**
 * One callable entry of a capability. {@code selector} is the ordinal inside the capability.
 * {@code fallible} methods may report a domain error in addition to their result.
 */
public record MethodSignature(int selector, String name, List<TypeRef> params, TypeRef result, boolean fallible) {

    public MethodSignature {
        if (selector < 0) {
            throw new IllegalArgumentException("selector must be >= 0, got " + selector);
        }
        Objects.requireNonNull(name, "name");
        params = List.copyOf(params);
        Objects.requireNonNull(result, "result");
    }

    public int arity() {
        return params.size();
    }
}
