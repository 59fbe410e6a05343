package imgpack.utils;

import org.junit.jupiter.api.*;

import java.util.jar.*;

import static org.junit.jupiter.api.Assertions.*;

class ManifestVersionProviderTest {

    @Test
    void describesManifestAttributes() {
        Manifest manifest = new Manifest();
        Attributes attrs = manifest.getMainAttributes();
        attrs.put(Attributes.Name.MANIFEST_VERSION, "1.0");
        attrs.put(Attributes.Name.IMPLEMENTATION_TITLE, "imgpack");
        attrs.put(Attributes.Name.IMPLEMENTATION_VERSION, "1.2.3");
        attrs.put(new Attributes.Name("Build-Timestamp"), "2026-01-02T03:04:05");
        attrs.put(new Attributes.Name("Build-Jdk-Spec"), "17");

        String[] lines = ManifestVersionProvider.describe(manifest);

        assertArrayEquals(new String[] {
                "imgpack version 1.2.3",
                "Built on: 2026-01-02T03:04:05 (JDK 17)",
        }, lines);
    }

    @Test
    void fallsBackWhenAttributesAreMissing() {
        String[] lines = ManifestVersionProvider.describe(new Manifest());

        assertEquals("imgpack version unknown-version", lines[0]);
        assertTrue(lines[1].startsWith("Built on: unknown-timestamp"));
    }
}
