package com.acme.interop.bridge.handle;

public sealed interface RegisterResult permits RegisterResult.Registered, RegisterResult.Exhausted {
    record Registered(Handle handle) implements RegisterResult {}
    record Exhausted(int liveHandles, int capacity) implements RegisterResult {}
}
