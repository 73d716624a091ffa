package com.acme.interop.bridge.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of capabilities known to both sides, looked up by name or by Java interface.
 */
public final class CapabilityCatalog {
    private final Map<String, Capability<?>> byName;
    private final Map<Class<?>, Capability<?>> byType;

    private CapabilityCatalog(Map<String, Capability<?>> byName, Map<Class<?>, Capability<?>> byType) {
        this.byName = byName;
        this.byType = byType;
    }

    public static CapabilityCatalog of(Capability<?>... capabilities) {
        return of(List.of(capabilities));
    }

    public static CapabilityCatalog of(Collection<? extends Capability<?>> capabilities) {
        Map<String, Capability<?>> names = new LinkedHashMap<>();
        Map<Class<?>, Capability<?>> types = new HashMap<>();
        for (Capability<?> capability : capabilities) {
            if (names.putIfAbsent(capability.name(), capability) != null) {
                throw new CatalogException("Duplicate capability " + capability.name());
            }
            if (types.putIfAbsent(capability.type(), capability) != null) {
                throw new CatalogException("Interface " + capability.type().getName() + " bound to more than one capability");
            }
        }
        return new CapabilityCatalog(Map.copyOf(names), Map.copyOf(types));
    }

    public Optional<Capability<?>> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    /**
     * @throws NoSuchSelectorException if no capability has this name
     */
    public Capability<?> require(String name) {
        Capability<?> capability = byName.get(Objects.requireNonNull(name, "name"));
        if (capability == null) {
            throw new NoSuchSelectorException("Unknown capability " + name);
        }
        return capability;
    }

    /**
     * @throws NoSuchSelectorException if the interface is not bound
     */
    @SuppressWarnings("unchecked")
    public <T> Capability<T> forType(Class<T> type) {
        Capability<?> capability = byType.get(Objects.requireNonNull(type, "type"));
        if (capability == null) {
            throw new NoSuchSelectorException("Interface " + type.getName() + " is not in the catalogue");
        }
        return (Capability<T>) capability;
    }

    public Collection<Capability<?>> capabilities() {
        return byName.values();
    }

    public int size() {
        return byName.size();
    }

    /**
     * Describes the bindings in descriptor form, the shape {@link CatalogLoader} reads.
     */
    public CatalogDescriptor describe() {
        List<CatalogDescriptor.CapabilityDescriptor> described = new ArrayList<>();
        for (Capability<?> capability : byName.values()) {
            described.add(new CatalogDescriptor.CapabilityDescriptor(
                capability.name(), capability.identityPreserving(), capability.methods()));
        }
        return new CatalogDescriptor(CatalogLoader.SUPPORTED_VERSION, described);
    }

    /**
     * Checks the bindings against the generator's descriptor.
     *
     * @throws CatalogException listing every mismatch
     */
    public void verify(CatalogDescriptor descriptor) {
        List<String> problems = new ArrayList<>();
        Map<String, CatalogDescriptor.CapabilityDescriptor> described = new HashMap<>();
        for (CatalogDescriptor.CapabilityDescriptor capability : descriptor.capabilities()) {
            described.put(capability.name(), capability);
        }
        for (CatalogDescriptor.CapabilityDescriptor expected : descriptor.capabilities()) {
            Capability<?> actual = byName.get(expected.name());
            if (actual == null) {
                problems.add("capability " + expected.name() + " has no binding");
                continue;
            }
            if (actual.identityPreserving() != expected.identityPreserving()) {
                problems.add("capability " + expected.name() + " identityPreserving is "
                    + actual.identityPreserving() + ", descriptor says " + expected.identityPreserving());
            }
            verifyMethods(expected, actual, problems);
        }
        for (String bound : byName.keySet()) {
            if (!described.containsKey(bound)) {
                problems.add("capability " + bound + " is bound but not described");
            }
        }
        if (!problems.isEmpty()) {
            throw new CatalogException(problems);
        }
    }

    private static void verifyMethods(CatalogDescriptor.CapabilityDescriptor expected, Capability<?> actual,
                                      List<String> problems) {
        List<MethodSignature> actualMethods = actual.methods();
        if (actualMethods.size() != expected.methods().size()) {
            problems.add("capability " + expected.name() + " has " + actualMethods.size()
                + " methods, descriptor says " + expected.methods().size());
        }
        for (MethodSignature want : expected.methods()) {
            if (want.selector() >= actualMethods.size()) {
                problems.add(expected.name() + "#" + want.selector() + " (" + want.name() + ") has no binding");
                continue;
            }
            MethodSignature have = actualMethods.get(want.selector());
            if (!have.equals(want)) {
                problems.add(expected.name() + "#" + want.selector() + " is bound as " + render(have)
                    + ", descriptor says " + render(want));
            }
        }
    }

    private static String render(MethodSignature signature) {
        return signature.name() + signature.params() + " -> " + signature.result()
            + (signature.fallible() ? " (fallible)" : "");
    }
}
