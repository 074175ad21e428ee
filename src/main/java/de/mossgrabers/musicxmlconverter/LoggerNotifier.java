// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter;

import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * A notifier which forwards all messages to a Java logger.
 *
 * @author Jürgen Moßgraber
 */
public class LoggerNotifier implements INotifier
{
    private final Logger logger;


    /**
     * Constructor. Uses the logger of the converter package.
     */
    public LoggerNotifier ()
    {
        this (Logger.getLogger (LoggerNotifier.class.getPackageName ()));
    }


    /**
     * Constructor.
     *
     * @param logger The logger to write to
     */
    public LoggerNotifier (final Logger logger)
    {
        this.logger = logger;
    }


    /** {@inheritDoc} */
    @Override
    public void log (final String messageID, final String... replaceStrings)
    {
        this.logger.info (Functions.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final String... replaceStrings)
    {
        this.logger.severe (Functions.getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final Throwable throwable)
    {
        this.logger.log (Level.SEVERE, Functions.getMessage (messageID, throwable), throwable);
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final Throwable throwable)
    {
        String message = throwable.getMessage ();
        if (message == null)
            message = throwable.getClass ().getName ();
        this.logger.log (Level.SEVERE, message, throwable);
    }
}
