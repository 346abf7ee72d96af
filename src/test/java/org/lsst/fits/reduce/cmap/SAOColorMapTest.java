package org.lsst.fits.reduce.cmap;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class SAOColorMapTest {

    @Test
    public void testB() {
        SAOColorMap b = new SAOColorMap(256, "b.sao");
        assertEquals(0, b.getRGB(0));
        assertEquals(0xff0200, b.getRGB(128));
        assertEquals(0xffffff, b.getRGB(255));
    }

    @Test
    public void testGrey() {
        SAOColorMap grey = new SAOColorMap(256, "grey.sao");
        assertEquals(0, grey.getRGB(0));
        assertEquals(0x808080, grey.getRGB(128));
        assertEquals(0xffffff, grey.getRGB(255));
    }

    @Test
    public void testFraction() {
        SAOColorMap grey = new SAOColorMap(256, "grey.sao");
        assertEquals(0, grey.getRGB(-0.5));
        assertEquals(0xffffff, grey.getRGB(1.0));
        assertEquals(0xffffff, grey.getRGB(7.0));
        assertEquals(grey.getRGB(128), grey.getRGB(128 / 255.0));
    }

    @Test
    public void testMissing() {
        try {
            SAOColorMap saoColorMap = new SAOColorMap(256, "missing.sao");
            fail("should not reach here: " + saoColorMap);
        } catch (RuntimeException x) {
            assertTrue(x.getMessage().contains("missing.sao"));
        }
    }
}
