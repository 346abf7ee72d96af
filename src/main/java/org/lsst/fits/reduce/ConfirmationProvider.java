package org.lsst.fits.reduce;

import java.io.IOException;

/**
 * Answers yes/no questions asked while processing, for example whether an
 * existing output file may be overwritten.
 *
 * @author tonyj
 */
public interface ConfirmationProvider {

    /**
     * Ask a question.
     *
     * @param question The question to present
     * @param defaultAnswer The answer assumed when the operator just hits
     * enter
     * @return <code>true</code> for yes
     * @throws IOException If the answer cannot be read
     */
    boolean confirm(String question, boolean defaultAnswer) throws IOException;
}
