package com.acme.interop.bridge.catalog;

import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;

/**
 * A selector, capability, or argument count that the target cannot dispatch.
 */
public final class NoSuchSelectorException extends BridgeException {

    public NoSuchSelectorException(String message) {
        super(FailureKind.NO_SUCH_METHOD, message);
    }
}
