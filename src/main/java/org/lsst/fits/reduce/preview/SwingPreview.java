package org.lsst.fits.reduce.preview;

import java.awt.BorderLayout;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.awt.image.BufferedImage;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.swing.JFrame;
import javax.swing.JPanel;
import javax.swing.SwingUtilities;
import org.lsst.fits.reduce.cmap.RGBColorMap;
import org.lsst.fits.reduce.cmap.SAOColorMap;
import org.lsst.fits.reduce.reducer.ReducerResult;

/**
 * Opens one window per reduced image. Windows are created on the event
 * dispatch thread, so showing a result returns immediately.
 *
 * @author tonyj
 */
class SwingPreview implements PreviewDisplay {

    private static final Logger LOG = Logger.getLogger(SwingPreview.class.getName());
    private static final RGBColorMap COLOR_MAP = new SAOColorMap(256, "b.sao");
    static final String INTENSITY_UNITS = "cts/s/px";

    private final Object lock = new Object();
    private int openWindows = 0;

    @Override
    public void show(ReducerResult result) {
        LogScaling scaling = new LogScaling(result.getValue());
        if (scaling.isEmpty()) {
            LOG.log(Level.WARNING, "{0} has no positive values, nothing to preview", result.getLabel());
            return;
        }
        BufferedImage image = scaling.render(result.getValue(), result.getWidth(), result.getHeight(), COLOR_MAP);
        synchronized (lock) {
            openWindows++;
        }
        SwingUtilities.invokeLater(() -> {
            JPanel content = new JPanel(new BorderLayout());
            content.add(new ResultImageComponent(image), BorderLayout.CENTER);
            content.add(new ColorBar(COLOR_MAP, scaling.getMin(), scaling.getMax(), INTENSITY_UNITS), BorderLayout.EAST);
            JFrame frame = new JFrame(result.getLabel());
            frame.setContentPane(content);
            frame.setDefaultCloseOperation(JFrame.DISPOSE_ON_CLOSE);
            frame.addWindowListener(new WindowAdapter() {
                @Override
                public void windowClosed(WindowEvent e) {
                    synchronized (lock) {
                        openWindows--;
                        lock.notifyAll();
                    }
                }
            });
            frame.pack();
            frame.setVisible(true);
        });
    }

    @Override
    public void awaitDismissal() throws InterruptedException {
        synchronized (lock) {
            if (openWindows > 0) {
                LOG.info("Close the preview windows to continue.");
            }
            while (openWindows > 0) {
                lock.wait();
            }
        }
    }
}
