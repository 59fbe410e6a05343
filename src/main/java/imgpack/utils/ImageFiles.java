package imgpack.utils;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.stream.*;

// Eligibility and naming rules for source images.
public final class ImageFiles {

    public static final Set<String> ELIGIBLE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp");

    private ImageFiles() {
        throw new IllegalStateException(String.format("Cannot instantiate: %s", ImageFiles.class.getName()));
    }

    public static boolean isEligibleName(String fileName) {
        return ELIGIBLE_EXTENSIONS.contains(extensionOf(fileName).toLowerCase(Locale.ROOT));
    }

    public static boolean isEligible(Path file) {
        return Files.isRegularFile(file) && isEligibleName(file.getFileName().toString());
    }

    // "p1.jpg" -> "jpg", "archive.tar.gz" -> "gz", "README" -> ""
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(dot + 1) : "";
    }

    public static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot >= 0 ? fileName.substring(0, dot) : fileName;
    }

    /** Immediate eligible files of {@code dir} in name order; subdirectories are not entered. */
    public static List<Path> listEligible(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(ImageFiles::isEligible)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    /** Number of eligible files, or 0 when the directory cannot be read. */
    public static int countEligible(Path dir) {
        try {
            return listEligible(dir).size();
        } catch (IOException | UncheckedIOException e) {
            return 0;
        }
    }

    /** Immediate subdirectories of {@code root} in name order. */
    public static List<Path> listSubdirectories(Path root) throws IOException {
        try (Stream<Path> entries = Files.list(root)) {
            return entries
                    .filter(Files::isDirectory)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
