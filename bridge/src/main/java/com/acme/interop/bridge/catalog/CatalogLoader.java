package com.acme.interop.bridge.catalog;

import com.acme.interop.bridge.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reads the catalogue descriptor emitted by the glue generator.
 *
 * <pre>{@code
 * {"version": 1,
 *  "capabilities": [
 *    {"name": "I", "identityPreserving": false,
 *     "methods": [{"selector": 0, "name": "times", "params": ["INT32"], "result": "INT64", "fallible": false}]}]}
 * }</pre>
 */
public final class CatalogLoader {
    private static final Logger LOG = Logger.getLogger(CatalogLoader.class.getName());
    public static final int SUPPORTED_VERSION = 1;

    private CatalogLoader() {
    }

    public static CatalogDescriptor loadResource(ClassLoader loader, String resource) {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new CatalogException("Catalogue descriptor not found on classpath: " + resource);
            }
            CatalogDescriptor descriptor = load(in);
            LOG.fine(() -> "Loaded catalogue descriptor " + resource + " capabilities=" + descriptor.capabilities().size());
            return descriptor;
        } catch (IOException e) {
            throw new CatalogException("Failed to read catalogue descriptor " + resource, e);
        }
    }

    public static CatalogDescriptor load(InputStream in) throws IOException {
        JsonNode root = JsonCodec.readTree(in);
        if (root == null || root.isMissingNode()) {
            throw new CatalogException("Catalogue descriptor is empty");
        }
        return parse(root);
    }

    public static CatalogDescriptor parse(String json) {
        try {
            return parse(JsonCodec.readTree(json));
        } catch (IOException e) {
            throw new CatalogException("Catalogue descriptor is not valid JSON", e);
        }
    }

    static CatalogDescriptor parse(JsonNode root) {
        if (!root.isObject()) {
            throw new CatalogException("Catalogue descriptor must be a JSON object");
        }
        int version = root.path("version").asInt(-1);
        if (version != SUPPORTED_VERSION) {
            throw new CatalogException("Unsupported catalogue version " + version + ", expected " + SUPPORTED_VERSION);
        }
        JsonNode capabilitiesNode = root.path("capabilities");
        if (!capabilitiesNode.isArray()) {
            throw new CatalogException("'capabilities' must be an array");
        }
        List<CatalogDescriptor.CapabilityDescriptor> capabilities = new ArrayList<>();
        for (JsonNode node : capabilitiesNode) {
            capabilities.add(parseCapability(node));
        }
        return new CatalogDescriptor(version, capabilities);
    }

    private static CatalogDescriptor.CapabilityDescriptor parseCapability(JsonNode node) {
        String name = requiredText(node, "name", "capability");
        JsonNode methodsNode = node.path("methods");
        if (!methodsNode.isArray()) {
            throw new CatalogException("capability " + name + ": 'methods' must be an array");
        }
        List<MethodSignature> methods = new ArrayList<>();
        for (JsonNode methodNode : methodsNode) {
            methods.add(parseMethod(name, methodNode));
        }
        return new CatalogDescriptor.CapabilityDescriptor(name, node.path("identityPreserving").asBoolean(false), methods);
    }

    private static MethodSignature parseMethod(String capability, JsonNode node) {
        String name = requiredText(node, "name", "method of " + capability);
        JsonNode selector = node.path("selector");
        if (!selector.canConvertToInt()) {
            throw new CatalogException(capability + "." + name + ": 'selector' must be an integer");
        }
        List<TypeRef> params = new ArrayList<>();
        for (JsonNode param : node.path("params")) {
            params.add(parseType(capability, name, param.asText()));
        }
        TypeRef result = node.hasNonNull("result") ? parseType(capability, name, node.get("result").asText()) : TypeRef.UNIT;
        try {
            return new MethodSignature(selector.asInt(), name, params, result, node.path("fallible").asBoolean(false));
        } catch (IllegalArgumentException e) {
            throw new CatalogException(capability + "." + name + ": " + e.getMessage(), e);
        }
    }

    private static TypeRef parseType(String capability, String method, String raw) {
        try {
            return TypeRef.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new CatalogException(capability + "." + method + ": unknown type '" + raw + "'", e);
        }
    }

    private static String requiredText(JsonNode node, String field, String what) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new CatalogException(what + " is missing '" + field + "'");
        }
        return value.asText();
    }
}
