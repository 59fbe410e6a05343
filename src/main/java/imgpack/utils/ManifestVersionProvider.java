package imgpack.utils;

import picocli.CommandLine.*;

import java.io.*;
import java.util.jar.*;

public class ManifestVersionProvider implements IVersionProvider {
    static final String MANIFEST_PATH = "/META-INF/MANIFEST.MF";

    @Override
    public String[] getVersion() throws Exception {
        try (InputStream is = getClass().getResourceAsStream(MANIFEST_PATH)) {
            if (is == null) {
                return new String[] { "imgpack (version information not available)" };
            }
            return describe(new Manifest(is));
        }
    }

    static String[] describe(Manifest manifest) {
        var attrs = manifest.getMainAttributes();
        String title = StringUtils.getOrDefault(attrs.getValue("Implementation-Title"), "imgpack");
        String version = StringUtils.getOrDefault(attrs.getValue("Implementation-Version"), "unknown-version");
        String timestamp = StringUtils.getOrDefault(attrs.getValue("Build-Timestamp"), "unknown-timestamp");
        String jdk = StringUtils.getOrDefault(attrs.getValue("Build-Jdk-Spec"), System.getProperty("java.specification.version"));

        return new String[] {
                String.format("%s version %s", title, version),
                String.format("Built on: %s (JDK %s)", timestamp, jdk),
        };
    }
}
