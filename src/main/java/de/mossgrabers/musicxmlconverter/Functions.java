// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter;

import java.io.File;
import java.util.MissingResourceException;
import java.util.ResourceBundle;


/**
 * Looks up the texts of message IDs from the string resources of the converter.
 *
 * @author Jürgen Moßgraber
 */
public class Functions
{
    private static final String         BUNDLE_NAME = "de.mossgrabers.musicxmlconverter.Strings";
    private static final ResourceBundle MESSAGES    = ResourceBundle.getBundle (BUNDLE_NAME);


    /**
     * Private constructor since this is a utility class.
     */
    private Functions ()
    {
        // Intentionally empty
    }


    /**
     * Get the text for a message ID. The placeholders %1..%n are replaced with the given strings.
     * If there is no text for the ID the ID itself is returned.
     *
     * @param messageID The ID of the message
     * @param replaceStrings The strings to insert
     * @return The formatted message
     */
    public static String getMessage (final String messageID, final String... replaceStrings)
    {
        String message;
        try
        {
            message = MESSAGES.getString (messageID);
        }
        catch (final MissingResourceException ex)
        {
            message = messageID;
        }

        // Replace from the back, otherwise %1 would match the start of %10
        for (int i = replaceStrings.length; i > 0; i--)
            message = message.replace ("%" + i, replaceStrings[i - 1] == null ? "" : replaceStrings[i - 1]);
        return message;
    }


    /**
     * Get the text for a message ID and add the message of the throwable as the first parameter.
     *
     * @param messageID The ID of the message
     * @param throwable The throwable from which to take the message
     * @return The formatted message
     */
    public static String getMessage (final String messageID, final Throwable throwable)
    {
        String text = throwable.getLocalizedMessage ();
        if (text == null)
            text = throwable.getClass ().getName ();
        return getMessage (messageID, text);
    }


    /**
     * Get the name of a file without the file type ending.
     *
     * @param file The file
     * @return The name without the ending, e.g. 'Song' for 'Song.musicxml'
     */
    public static String getNameWithoutType (final File file)
    {
        final String fileName = file.getName ();
        final int pos = fileName.lastIndexOf ('.');
        return pos > 0 ? fileName.substring (0, pos) : fileName;
    }
}
