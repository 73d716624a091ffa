package com.acme.interop.bridge.fixture;

public interface Interface {
    void f();
}
