package com.acme.interop.bridge.catalog;

import java.util.List;

/**
 * Build-time description of every capability, as emitted by the glue generator.
 */
public record CatalogDescriptor(int version, List<CapabilityDescriptor> capabilities) {

    public CatalogDescriptor {
        capabilities = List.copyOf(capabilities);
    }

    public record CapabilityDescriptor(String name, boolean identityPreserving, List<MethodSignature> methods) {
        public CapabilityDescriptor {
            methods = List.copyOf(methods);
        }
    }
}
