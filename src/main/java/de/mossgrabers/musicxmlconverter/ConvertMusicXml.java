// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter;

import de.mossgrabers.musicxmlconverter.core.ConversionTask;
import de.mossgrabers.musicxmlconverter.format.json.JsonDestinationFormat;
import de.mossgrabers.musicxmlconverter.format.musicxml.ImportSettings;
import de.mossgrabers.musicxmlconverter.format.musicxml.MusicXmlSourceFormat;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.ConfigurationTables;

import java.io.File;
import java.io.IOException;


/**
 * The main class for converting a MusicXML file from the command line. Converts the given file and
 * stores the timelines as JSON in the same directory as the source file.
 *
 * @author Jürgen Moßgraber
 */
public final class ConvertMusicXml
{
    private static final String OUTPUT_ENDING = ".timeline.json";


    /**
     * Constructor.
     */
    private ConvertMusicXml ()
    {
        // Intentionally empty
    }


    /**
     * The main function.
     *
     * @param args The MusicXML file to convert and optionally a YAML settings file
     */
    public static void main (final String [] args)
    {
        System.exit (convert (args, new LoggerNotifier ()) ? 0 : 1);
    }


    /**
     * Runs the conversion.
     *
     * @param args The MusicXML file to convert and optionally a YAML settings file
     * @param notifier Where to log to
     * @return True if the conversion succeeded
     */
    public static boolean convert (final String [] args, final INotifier notifier)
    {
        if (args.length == 0)
        {
            notifier.logError ("IDS_CLI_USAGE");
            return false;
        }

        final File inputFile = new File (args[0]).getAbsoluteFile ();

        final ImportSettings settings;
        try
        {
            settings = ImportSettings.load (args.length > 1 ? new File (args[1]) : null);
        }
        catch (final IOException ex)
        {
            notifier.logError ("IDS_NOTIFY_COULD_NOT_LOAD_SETTINGS", ex);
            return false;
        }

        final MusicXmlSourceFormat sourceFormat = new MusicXmlSourceFormat (notifier, settings, ConfigurationTables.createDefault ());
        if (!sourceFormat.supports (inputFile))
        {
            notifier.logError ("IDS_NOTIFY_UNSUPPORTED_FILE", inputFile.getAbsolutePath ());
            return false;
        }

        final File outputFile = new File (inputFile.getParentFile (), Functions.getNameWithoutType (inputFile) + OUTPUT_ENDING);
        final ConversionTask task = new ConversionTask (inputFile, outputFile, sourceFormat, new JsonDestinationFormat (notifier), notifier);
        final boolean success = task.call ().booleanValue ();
        if (!success)
            notifier.logError ("IDS_NOTIFY_CONVERSION_FAILED");
        return success;
    }
}
