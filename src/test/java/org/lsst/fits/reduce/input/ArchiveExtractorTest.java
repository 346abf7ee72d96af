package org.lsst.fits.reduce.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 *
 * @author tonyj
 */
public class ArchiveExtractorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static void zipEntries(Path archive, String... names) throws IOException {
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(archive))) {
            for (String name : names) {
                out.putNextEntry(new ZipEntry(name));
                if (!name.endsWith("/")) {
                    out.write(name.getBytes(StandardCharsets.US_ASCII));
                }
                out.closeEntry();
            }
        }
    }

    @Test
    public void testExtractZip() throws IOException {
        Path archive = folder.getRoot().toPath().resolve("frames.zip");
        zipEntries(archive, "a_ct_1.tif", "nested/", "nested/b_ct_2.tif");
        Path target = folder.getRoot().toPath().resolve("out");
        assertEquals(2, ArchiveExtractor.extract(ArchiveType.ZIP, archive, target));
        assertTrue(Files.isRegularFile(target.resolve("a_ct_1.tif")));
        assertEquals("nested/b_ct_2.tif", new String(Files.readAllBytes(target.resolve("nested/b_ct_2.tif")), StandardCharsets.US_ASCII));
    }

    @Test
    public void testRefuseEntryOutsideTarget() throws IOException {
        Path archive = folder.getRoot().toPath().resolve("evil.zip");
        zipEntries(archive, "../escaped.tif");
        Path target = folder.getRoot().toPath().resolve("out");
        try {
            ArchiveExtractor.extract(ArchiveType.ZIP, archive, target);
            fail("Entry outside the target should be refused");
        } catch (IOException x) {
            assertTrue(x.getMessage().contains("escaped.tif"));
        }
        assertFalse(Files.exists(folder.getRoot().toPath().resolve("escaped.tif")));
    }

    @Test
    public void testArchiveTypeTokens() {
        assertEquals(ArchiveType.ZIP, ArchiveType.forToken("zip").get());
        assertEquals(ArchiveType.TAR_GZ, ArchiveType.forToken(".TAR.GZ").get());
        assertFalse(ArchiveType.forToken(".tif").isPresent());
        assertFalse(ArchiveType.forToken(".rar").isPresent());
    }
}
