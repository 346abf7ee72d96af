package org.lsst.fits.reduce.input;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.lsst.fits.reduce.ConfirmationProvider;
import org.lsst.fits.reduce.Timed;
import org.lsst.fits.reduce.io.FrameFormat;

/**
 * Finds the frames to reduce in one input location. Frames are either loose
 * files in the location, or inside an archive which is first extracted into a
 * scratch directory next to it.
 *
 * @author tonyj
 */
public class InputResolver {

    private static final Logger LOG = Logger.getLogger(InputResolver.class.getName());
    public static final String SCRATCH_PREFIX = "sa_temp_";

    private final FrameNaming naming;
    private final ConfirmationProvider confirmation;

    public InputResolver(FrameNaming naming, ConfirmationProvider confirmation) {
        this.naming = naming;
        this.confirmation = confirmation;
    }

    /**
     * Resolve the frames of one input location.
     *
     * @param location The input directory
     * @param fileType A frame type token (<code>.tif</code>, <code>fits</code>
     * ...) or an archive type token (<code>.zip</code>,
     * <code>.tar.gz</code>)
     * @return The frames, in acquisition order
     * @throws ResolutionException If nothing to process is found
     * @throws IOException If the location cannot be listed or an archive
     * cannot be extracted
     */
    public ResolvedInput resolve(Path location, String fileType) throws IOException {
        if (!Files.isDirectory(location)) {
            throw new ResolutionException("Input location " + location + " is not a directory");
        }
        Optional<ArchiveType> archiveType = ArchiveType.forToken(fileType);
        if (!archiveType.isPresent()) {
            return resolveFrames(location, fileType, null);
        }
        ScratchDirectory scratch = extractFirstArchive(location, archiveType.get());
        try {
            String derivedType = deriveFrameType(scratch.getPath());
            return resolveFrames(scratch.getPath(), derivedType, scratch);
        } catch (IOException | RuntimeException x) {
            scratch.close();
            throw x;
        }
    }

    private ResolvedInput resolveFrames(Path directory, String fileType, ScratchDirectory scratch) throws IOException {
        FrameFormat format = FrameFormat.forToken(fileType)
                .orElseThrow(() -> new ResolutionException("Unsupported file type " + fileType));
        String extension = fileType.startsWith(".") ? fileType : "." + fileType;
        List<Path> frames = listFiles(directory, extension).stream()
                .filter(p -> naming.isAcquisitionFrame(p.getFileName().toString()))
                .collect(Collectors.toList());
        LOG.log(Level.INFO, "{0} images of type {1} found", new Object[]{frames.size(), extension});
        if (frames.isEmpty()) {
            throw new ResolutionException("No images of type " + extension + " found in " + directory);
        }
        return new ResolvedInput(directory, format, extension, frames, scratch);
    }

    private ScratchDirectory extractFirstArchive(Path location, ArchiveType type) throws IOException {
        List<Path> archives = listFiles(location, type.getSuffix());
        LOG.log(Level.INFO, "{0} archives of type {1} found", new Object[]{archives.size(), type.getSuffix()});
        if (archives.isEmpty()) {
            throw new ResolutionException("No archives of type " + type.getSuffix() + " found in " + location);
        }
        Path archive = archives.get(0);
        if (archives.size() > 1) {
            LOG.log(Level.WARNING, "Only the first archive {0} will be processed", archive.getFileName());
        }
        Path target = location.resolve(SCRATCH_PREFIX + archive.getFileName());
        if (Files.exists(target)
                && confirmation.confirm("Path " + target + " exists already. Continue without extracting?", true)) {
            return new ScratchDirectory(target, true);
        }
        ScratchDirectory.deleteTree(target);
        LOG.log(Level.INFO, "Created temporary folder {0}.", target);
        ScratchDirectory scratch = new ScratchDirectory(target, false);
        try {
            int count = Timed.execute(Level.INFO, () -> ArchiveExtractor.extract(type, archive, target),
                    "Extracting %s took %dms", archive.getFileName());
            LOG.log(Level.FINE, "{0} files extracted", count);
        } catch (IOException | RuntimeException x) {
            scratch.close();
            throw x;
        }
        return scratch;
    }

    /**
     * The frame type of an extracted archive is the extension of its first
     * file in name order.
     */
    private static String deriveFrameType(Path directory) throws IOException {
        List<Path> files = listFiles(directory, "");
        if (files.isEmpty()) {
            throw new ResolutionException("Archive extracted into " + directory + " contains no files");
        }
        String name = files.get(0).getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new ResolutionException("Cannot derive file type from " + name);
        }
        String type = name.substring(dot);
        LOG.log(Level.FINE, "File type {0} derived from {1}", new Object[]{type, name});
        return type;
    }

    private static List<Path> listFiles(Path directory, String suffix) throws IOException {
        String lowerSuffix = suffix.toLowerCase(Locale.ROOT);
        try (Stream<Path> stream = Files.list(directory)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(lowerSuffix))
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
