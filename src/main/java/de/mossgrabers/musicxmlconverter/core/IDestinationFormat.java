// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import java.io.File;
import java.io.IOException;


/**
 * The interface to the receiver of the converted timelines.
 *
 * @author J&uuml;rgen Mo&szlig;graber
 */
public interface IDestinationFormat extends ICoreTask
{
    /**
     * Write the timelines.
     *
     * @param container The timelines to store
     * @param outputFile The file to write to
     * @throws IOException Could not write the file
     */
    void write (TimelineContainer container, File outputFile) throws IOException;
}
