package com.acme.interop.bridge.catalog;

import com.acme.interop.bridge.fixture.FixtureCatalog;
import com.acme.interop.bridge.wire.WireType;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogLoaderTest {

    @Test
    void shouldParseMinimalDescriptor() {
        CatalogDescriptor descriptor = CatalogLoader.parse("""
            {"version": 1,
             "capabilities": [
               {"name": "I2", "methods": [
                 {"selector": 0, "name": "times", "params": ["INT32"], "result": "INT64"},
                 {"selector": 1, "name": "peer", "params": ["ref:I2"]}
               ]}
             ]}
            """);

        assertEquals(1, descriptor.version());
        CatalogDescriptor.CapabilityDescriptor i2 = descriptor.capabilities().get(0);
        assertEquals("I2", i2.name());
        assertFalse(i2.identityPreserving());
        MethodSignature times = i2.methods().get(0);
        assertEquals(List.of(TypeRef.INT32), times.params());
        assertEquals(TypeRef.INT64, times.result());
        assertFalse(times.fallible());
        MethodSignature peer = i2.methods().get(1);
        assertEquals(TypeRef.UNIT, peer.result());
        assertEquals(WireType.REF, peer.params().get(0).type());
        assertEquals("I2", peer.params().get(0).capability());
    }

    @Test
    void shouldLoadBundledDescriptor() throws Exception {
        CatalogDescriptor descriptor = CatalogLoader.loadResource(
            CatalogLoaderTest.class.getClassLoader(), FixtureCatalog.DESCRIPTOR);

        assertEquals(13, descriptor.capabilities().size());
        CatalogDescriptor.CapabilityDescriptor iface = descriptor.capabilities().stream()
            .filter(c -> c.name().equals("Interface"))
            .findFirst()
            .orElseThrow();
        assertTrue(iface.identityPreserving());
    }

    @Test
    void shouldLoadFromStream() throws Exception {
        byte[] json = "{\"version\":1,\"capabilities\":[]}".getBytes(StandardCharsets.UTF_8);
        CatalogDescriptor descriptor = CatalogLoader.load(new ByteArrayInputStream(json));
        assertTrue(descriptor.capabilities().isEmpty());
    }

    @Test
    void shouldRejectMalformedDescriptors() {
        assertThrows(CatalogException.class, () -> CatalogLoader.parse("not json {"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse("[]"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse("{\"version\":2,\"capabilities\":[]}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse("{\"version\":1}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse(
            "{\"version\":1,\"capabilities\":[{\"methods\":[]}]}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse(
            "{\"version\":1,\"capabilities\":[{\"name\":\"X\"}]}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse(
            "{\"version\":1,\"capabilities\":[{\"name\":\"X\",\"methods\":[{\"name\":\"m\",\"selector\":\"a\"}]}]}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse(
            "{\"version\":1,\"capabilities\":[{\"name\":\"X\",\"methods\":[{\"name\":\"m\",\"selector\":0,\"params\":[\"DECIMAL\"]}]}]}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse(
            "{\"version\":1,\"capabilities\":[{\"name\":\"X\",\"methods\":[{\"name\":\"m\",\"selector\":0,\"result\":\"REF:\"}]}]}"));
        assertThrows(CatalogException.class, () -> CatalogLoader.parse(
            "{\"version\":1,\"capabilities\":[{\"name\":\"X\",\"methods\":[{\"name\":\"m\",\"selector\":-1}]}]}"));
    }

    @Test
    void shouldReportMissingResource() {
        assertThrows(CatalogException.class,
            () -> CatalogLoader.loadResource(CatalogLoaderTest.class.getClassLoader(), "catalog/missing.json"));
    }

    @Test
    void shouldFormatTypesInDescriptorNotation() {
        assertEquals("REF:Counter", TypeRef.ref("Counter").format());
        assertEquals("BYTES", TypeRef.BYTES.format());
        assertEquals(TypeRef.FLOAT32, TypeRef.parse(" float32 "));
    }
}
