package com.acme.interop.bridge.wire;

import com.acme.interop.bridge.error.BridgeException;
import com.acme.interop.bridge.error.FailureKind;

/**
 * A value does not fit the type declared for it in the catalogue.
 */
public final class MarshallingException extends BridgeException {

    public MarshallingException(String message) {
        super(FailureKind.MARSHALLING, message);
    }
}
