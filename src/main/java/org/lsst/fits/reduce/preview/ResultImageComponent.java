package org.lsst.fits.reduce.preview;

import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import javax.swing.JComponent;

/**
 * Displays a rendered image scaled to the component, without axes. Row 0 is
 * drawn at the bottom, as detector images are conventionally shown.
 *
 * @author tonyj
 */
class ResultImageComponent extends JComponent {

    private static final long serialVersionUID = 1L;
    private static final int MAX_PREFERRED_SIZE = 800;
    private final transient BufferedImage image;

    ResultImageComponent(BufferedImage image) {
        this.image = image;
    }

    @Override
    public Dimension getPreferredSize() {
        float scale = Math.min(1, (float) MAX_PREFERRED_SIZE / Math.max(image.getWidth(), image.getHeight()));
        return new Dimension(Math.round(image.getWidth() * scale), Math.round(image.getHeight() * scale));
    }

    @Override
    protected void paintComponent(Graphics g) {
        Graphics2D g2 = (Graphics2D) g.create();
        try {
            float scale = Math.min((float) getWidth() / image.getWidth(), (float) getHeight() / image.getHeight());
            int w = Math.round(image.getWidth() * scale);
            int h = Math.round(image.getHeight() * scale);
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g2.translate((getWidth() - w) / 2, (getHeight() + h) / 2);
            g2.scale(1, -1);
            g2.drawImage(image, 0, 0, w, h, this);
        } finally {
            g2.dispose();
        }
    }
}
