package com.acme.interop.bridge.call;

public enum CallDirection {
    HOST_TO_FOREIGN,
    FOREIGN_TO_HOST
}
