package org.lsst.fits.reduce.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Copies the first part of a dataset to another directory, to make a smaller
 * dataset for trying out reductions. Files are taken in natural order, so
 * that <code>img_9</code> comes before <code>img_10</code>.
 *
 * @author tonyj
 */
public class SubsetDataset {

    private static final Logger LOG = Logger.getLogger(SubsetDataset.class.getName());
    public static final String ALL_FILES = "*";

    /**
     * Copy the first <code>percent</code> percent of the matching files,
     * rounded up.
     *
     * @param source The directory to copy from
     * @param target The directory to copy to, created if missing
     * @param percent The share of files to copy, 1 to 100
     * @param extension Only copy files with this extension, with or without
     * the leading dot, or
     * {@value #ALL_FILES} for every file
     * @return The files copied
     * @throws IOException If a file cannot be copied
     */
    public static List<Path> copySubset(Path source, Path target, int percent, String extension) throws IOException {
        if (percent < 1 || percent > 100) {
            throw new IllegalArgumentException("Percentage must be between 1 and 100, got " + percent);
        }
        if (!Files.isDirectory(source)) {
            throw new IOException("Source directory " + source + " does not exist");
        }
        String lower = extension.toLowerCase(Locale.ROOT);
        String suffix = lower.startsWith(".") ? lower : "." + lower;
        List<Path> files;
        try (Stream<Path> stream = Files.list(source)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(p -> ALL_FILES.equals(extension) || p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString(), NaturalOrderComparator.INSTANCE))
                    .collect(Collectors.toList());
        }
        if (files.isEmpty()) {
            throw new IOException("No files matching " + extension + " found in " + source);
        }
        int count = (int) Math.ceil(files.size() * percent / 100.0);
        Files.createDirectories(target);
        List<Path> subset = files.subList(0, count);
        for (Path file : subset) {
            Files.copy(file, target.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        }
        LOG.log(Level.INFO, "Copied {0} of {1} files from {2} to {3}", new Object[]{count, files.size(), source, target});
        return subset;
    }

    public static void main(String[] args) {
        if (args.length != 4) {
            System.err.println("Usage: SubsetDataset <source> <target> <percent> <extension|*>");
            System.exit(2);
        }
        int percent;
        try {
            percent = Integer.parseInt(args[2]);
        } catch (NumberFormatException x) {
            System.err.println("Percentage must be an integer, got " + args[2]);
            System.exit(2);
            return;
        }
        try {
            copySubset(Paths.get(args[0]), Paths.get(args[1]), percent, args[3]);
        } catch (IOException | IllegalArgumentException x) {
            LOG.log(Level.SEVERE, "Copying the subset failed", x);
            System.err.println(x.getMessage());
            System.exit(1);
        }
    }
}
