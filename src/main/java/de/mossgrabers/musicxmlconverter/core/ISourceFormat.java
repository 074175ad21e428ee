// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;


/**
 * The interface to a score source.
 *
 * @author Jürgen Moßgraber
 */
public interface ISourceFormat extends ICoreTask
{
    /**
     * Read and convert the source file into timelines.
     *
     * @param sourceFile The score file to load
     * @return The read, parsed and converted timelines
     * @throws IOException Could not read the file
     * @throws ParseException Could not parse the score
     */
    TimelineContainer read (File sourceFile) throws IOException, ParseException;


    /**
     * Check if the format can read the given file.
     *
     * @param sourceFile The file to check
     * @return True if supported
     */
    boolean supports (File sourceFile);
}
