package com.acme.interop.bridge.catalog;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named interface the bridge can dispatch: its method table plus one {@link HostInvoker} per
 * selector.
 *
 * <p>Java interface methods are matched to selectors once, in {@link Builder#build()}, so
 * proxies can forward without looking anything up by name at call time. Every abstract method of
 * the interface must be bound; default methods that are not bound run locally on the proxy.</p>
 *
 * <p>{@code identityPreserving} capabilities get one proxy per foreign object.
 * {@code serialized} capabilities are dispatched under a per-object lock because their
 * implementations are not safe for concurrent use.</p>
 */
public final class Capability<T> {
    private final String name;
    private final Class<T> type;
    private final boolean identityPreserving;
    private final boolean serialized;
    private final List<MethodSignature> methods;
    private final List<HostInvoker<T>> invokers;
    private final Map<String, MethodSignature> byName;
    private final Map<Method, MethodSignature> byJavaMethod;

    private Capability(Builder<T> builder, Map<Method, MethodSignature> byJavaMethod) {
        this.name = builder.name;
        this.type = builder.type;
        this.identityPreserving = builder.identityPreserving;
        this.serialized = builder.serialized;
        this.methods = List.copyOf(builder.methods);
        this.invokers = List.copyOf(builder.invokers);
        Map<String, MethodSignature> names = new HashMap<>();
        for (MethodSignature signature : methods) {
            names.put(signature.name(), signature);
        }
        this.byName = Collections.unmodifiableMap(names);
        this.byJavaMethod = Collections.unmodifiableMap(byJavaMethod);
    }

    public static <T> Builder<T> builder(String name, Class<T> type) {
        return new Builder<>(name, type);
    }

    public String name() {
        return name;
    }

    public Class<T> type() {
        return type;
    }

    public boolean identityPreserving() {
        return identityPreserving;
    }

    public boolean serialized() {
        return serialized;
    }

    public List<MethodSignature> methods() {
        return methods;
    }

    /**
     * @throws NoSuchSelectorException if the selector addresses another capability or no method
     */
    public MethodSignature resolve(Selector selector) {
        if (!name.equals(selector.capability())) {
            throw new NoSuchSelectorException("Selector " + selector + " does not address capability " + name);
        }
        MethodSignature signature;
        if (selector.byOrdinal()) {
            signature = selector.ordinal() < methods.size() ? methods.get(selector.ordinal()) : null;
        } else {
            signature = byName.get(selector.method());
        }
        if (signature == null) {
            throw new NoSuchSelectorException("No method " + selector + " in capability " + name);
        }
        if (selector.byOrdinal() && selector.method() != null && !selector.method().equals(signature.name())) {
            throw new NoSuchSelectorException(
                "Selector " + selector + " names " + selector.method() + " but ordinal is " + signature.name());
        }
        return signature;
    }

    public MethodSignature method(String methodName) {
        return resolve(Selector.named(name, methodName));
    }

    /** Returns the signature bound to an interface method, or {@code null} if it is unbound. */
    public MethodSignature forJavaMethod(Method method) {
        return byJavaMethod.get(method);
    }

    /**
     * Runs the generated stub for {@code signature} on {@code target}.
     */
    public Object invoke(Object target, MethodSignature signature, Object[] args) throws Exception {
        return invokers.get(signature.selector()).invoke(type.cast(target), args);
    }

    @Override
    public String toString() {
        return "Capability[" + name + " -> " + type.getName() + ", methods=" + methods.size() + "]";
    }

    public static final class Builder<T> {
        private final String name;
        private final Class<T> type;
        private final List<MethodSignature> methods = new ArrayList<>();
        private final List<HostInvoker<T>> invokers = new ArrayList<>();
        private boolean identityPreserving;
        private boolean serialized;

        private Builder(String name, Class<T> type) {
            if (Objects.requireNonNull(name, "name").isBlank()) {
                throw new CatalogException("Capability name must not be blank");
            }
            this.name = name;
            this.type = Objects.requireNonNull(type, "type");
            if (!type.isInterface()) {
                throw new CatalogException("Capability " + name + " must be bound to an interface, got " + type.getName());
            }
        }

        public Builder<T> identityPreserving() {
            this.identityPreserving = true;
            return this;
        }

        public Builder<T> serialized() {
            this.serialized = true;
            return this;
        }

        public Builder<T> method(String methodName, TypeRef result, HostInvoker<T> invoker, TypeRef... params) {
            return add(methodName, result, false, invoker, params);
        }

        /** Adds a method that may report a domain error by throwing from its invoker. */
        public Builder<T> fallibleMethod(String methodName, TypeRef result, HostInvoker<T> invoker, TypeRef... params) {
            return add(methodName, result, true, invoker, params);
        }

        private Builder<T> add(String methodName, TypeRef result, boolean fallible, HostInvoker<T> invoker, TypeRef[] params) {
            Objects.requireNonNull(invoker, "invoker");
            for (MethodSignature existing : methods) {
                if (existing.name().equals(methodName)) {
                    throw new CatalogException("Duplicate method " + methodName + " in capability " + name);
                }
            }
            methods.add(new MethodSignature(methods.size(), methodName, List.of(params), result, fallible));
            invokers.add(invoker);
            return this;
        }

        public Capability<T> build() {
            Map<Method, MethodSignature> bound = new LinkedHashMap<>();
            for (MethodSignature signature : methods) {
                Method match = null;
                for (Method candidate : type.getMethods()) {
                    if (Modifier.isStatic(candidate.getModifiers())
                        || !candidate.getName().equals(signature.name())
                        || candidate.getParameterCount() != signature.arity()) {
                        continue;
                    }
                    if (match != null) {
                        throw new CatalogException("Method " + signature.name() + "/" + signature.arity()
                            + " of " + type.getName() + " is overloaded");
                    }
                    match = candidate;
                }
                if (match == null) {
                    throw new CatalogException("Capability " + name + " declares " + signature.name() + "/"
                        + signature.arity() + " but " + type.getName() + " has no such method");
                }
                bound.put(match, signature);
            }
            for (Method method : type.getMethods()) {
                if (Modifier.isAbstract(method.getModifiers()) && !bound.containsKey(method)) {
                    throw new CatalogException("Method " + method.getName() + " of " + type.getName()
                        + " is not bound in capability " + name);
                }
            }
            return new Capability<>(this, bound);
        }
    }
}
