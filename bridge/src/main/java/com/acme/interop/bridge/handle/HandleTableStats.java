package com.acme.interop.bridge.handle;

public record HandleTableStats(int liveHandles,
                               int capacity,
                               long registerCount,
                               long releaseCount,
                               long staleReleaseCount,
                               long exhaustedCount) {}
