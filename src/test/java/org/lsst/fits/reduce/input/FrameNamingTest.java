package org.lsst.fits.reduce.input;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.io.IOException;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class FrameNamingTest {

    private final FrameNaming naming = new FrameNaming();

    @Test
    public void testAcquisitionFrames() {
        assertTrue(naming.isAcquisitionFrame("popc_water_ct_00001.tif"));
        assertTrue(naming.isAcquisitionFrame("ct_1.tif"));
        assertFalse(naming.isAcquisitionFrame("popc_water_00001.tif"));
        assertFalse(naming.isAcquisitionFrame("popc_ct_water_00001.tif"));
        assertFalse(naming.isAcquisitionFrame("ct.tif"));
        assertFalse(naming.isAcquisitionFrame("sample_CT_00001.tif"));
    }

    @Test
    public void testOtherMarker() {
        FrameNaming dark = new FrameNaming("dk");
        assertTrue(dark.isAcquisitionFrame("det_dk_003.fits"));
        assertFalse(dark.isAcquisitionFrame("det_ct_003.fits"));
    }

    @Test
    public void testOutputBaseName() throws IOException {
        assertEquals("sample_ct_00001_to_00010", naming.outputBaseName("sample_ct_00001.tif", "sample_ct_00010.tif", ".tif"));
        assertEquals("a_ct_7_to_7", naming.outputBaseName("a_ct_7.fits", "a_ct_7.fits", ".fits"));
    }

    @Test(expected = IOException.class)
    public void testMissingIndex() throws IOException {
        naming.outputBaseName("sample_ct_01.tif", "sample_ct_.tif", ".tif");
    }

    @Test(expected = IOException.class)
    public void testWrongExtension() throws IOException {
        naming.outputBaseName("sample_ct_01.tif", "sample_ct_02.fits", ".tif");
    }
}
