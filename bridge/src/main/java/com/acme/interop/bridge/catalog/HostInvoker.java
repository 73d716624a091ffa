package com.acme.interop.bridge.catalog;

/**
 * Generated dispatch stub for one method: calls it on {@code target} with already-decoded
 * arguments. Returns {@code null} for methods without a result.
 */
@FunctionalInterface
public interface HostInvoker<T> {
    Object invoke(T target, Object[] args) throws Exception;
}
