package org.lsst.fits.reduce;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gives the same answer to every question, for unattended runs.
 *
 * @author tonyj
 */
public class FixedConfirmationProvider implements ConfirmationProvider {

    private static final Logger LOG = Logger.getLogger(FixedConfirmationProvider.class.getName());

    public static final FixedConfirmationProvider ASSUME_YES = new FixedConfirmationProvider(true);
    public static final FixedConfirmationProvider ASSUME_NO = new FixedConfirmationProvider(false);

    private final boolean answer;

    private FixedConfirmationProvider(boolean answer) {
        this.answer = answer;
    }

    @Override
    public boolean confirm(String question, boolean defaultAnswer) {
        LOG.log(Level.INFO, "{0} {1}", new Object[]{question, answer ? "yes" : "no"});
        return answer;
    }

    public boolean getAnswer() {
        return answer;
    }
}
