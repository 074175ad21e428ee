// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import de.mossgrabers.musicxmlconverter.INotifier;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.concurrent.Callable;


/**
 * The task to run the actual conversion process.
 *
 * @author Jürgen Moßgraber
 */
public class ConversionTask implements Callable<Boolean>
{
    private final File               sourceFile;
    private final ISourceFormat      sourceFormat;
    private final IDestinationFormat destinationFormat;
    private final INotifier          notifier;
    private final File               outputFile;


    /**
     * Constructor.
     *
     * @param sourceFile The source file to convert
     * @param outputFile The file to write the result to
     * @param sourceFormat The format of the source file
     * @param destinationFormat The destination format
     * @param notifier Where to log to
     */
    public ConversionTask (final File sourceFile, final File outputFile, final ISourceFormat sourceFormat, final IDestinationFormat destinationFormat, final INotifier notifier)
    {
        this.sourceFile = sourceFile;
        this.outputFile = outputFile;
        this.sourceFormat = sourceFormat;
        this.destinationFormat = destinationFormat;
        this.notifier = notifier;
    }


    /**
     * Converts the source file. Nothing is written if reading or parsing fails.
     *
     * @return True if the conversion succeeded
     */
    @Override
    public Boolean call ()
    {
        this.notifier.log ("IDS_NOTIFY_PARSING_FILE", this.sourceFile.getAbsolutePath ());

        final TimelineContainer container;
        try
        {
            container = this.sourceFormat.read (this.sourceFile);
        }
        catch (final IOException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_READ", ex);
            return Boolean.FALSE;
        }
        catch (final ParseException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_PARSE", ex);
            return Boolean.FALSE;
        }

        this.notifier.log ("IDS_NOTIFY_WRITING_FILE", this.outputFile.getAbsolutePath ());
        try
        {
            this.destinationFormat.write (container, this.outputFile);
        }
        catch (final IOException ex)
        {
            this.notifier.logError ("IDS_NOTIFY_COULD_NOT_WRITE_FILE", ex);
            return Boolean.FALSE;
        }

        this.notifier.log ("IDS_NOTIFY_CONVERSION_FINISHED");
        return Boolean.TRUE;
    }
}
