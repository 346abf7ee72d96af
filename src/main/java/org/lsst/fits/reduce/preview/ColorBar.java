package org.lsst.fits.reduce.preview;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.FontMetrics;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.geom.AffineTransform;
import javax.swing.JComponent;
import org.lsst.fits.reduce.cmap.RGBColorMap;

/**
 * Vertical color bar for a log scaled image, labeled with the value range.
 *
 * @author tonyj
 */
class ColorBar extends JComponent {

    private static final long serialVersionUID = 1L;
    private static final int BAR_WIDTH = 20;

    private final transient RGBColorMap cmap;
    private final String min;
    private final String max;
    private final String label;

    ColorBar(RGBColorMap cmap, double min, double max, String label) {
        this.cmap = cmap;
        this.min = String.format("%.3g", min);
        this.max = String.format("%.3g", max);
        this.label = label;
    }

    @Override
    public Dimension getPreferredSize() {
        return new Dimension(BAR_WIDTH + 90, 200);
    }

    @Override
    protected void paintComponent(Graphics g) {
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            FontMetrics fm = g2.getFontMetrics();
            int top = fm.getHeight();
            int height = Math.max(1, getHeight() - 2 * top);
            for (int y = 0; y < height; y++) {
                g2.setColor(new Color(cmap.getRGB(1.0 - (double) y / (height - 1 == 0 ? 1 : height - 1))));
                g2.drawLine(4, top + y, 4 + BAR_WIDTH, top + y);
            }
            g2.setColor(Color.BLACK);
            g2.drawRect(4, top, BAR_WIDTH, height - 1);
            g2.drawString(max, BAR_WIDTH + 8, top + fm.getAscent() / 2);
            g2.drawString(min, BAR_WIDTH + 8, top + height);
            AffineTransform saved = g2.getTransform();
            g2.translate(getWidth() - 4, top + height / 2 + fm.stringWidth(label) / 2);
            g2.rotate(-Math.PI / 2);
            g2.drawString(label, 0, 0);
            g2.setTransform(saved);
        } finally {
            g2.dispose();
        }
    }
}
