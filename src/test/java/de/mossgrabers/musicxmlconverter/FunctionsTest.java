// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;


class FunctionsTest
{
    @Test
    void replacesParameters ()
    {
        assertEquals ("Parsing file: Song.xml", Functions.getMessage ("IDS_NOTIFY_PARSING_FILE", "Song.xml"));
        assertEquals ("Created 2 staff timeline(s), 1 tempo marker(s) and 0 region(s).", Functions.getMessage ("IDS_NOTIFY_STAVES_CREATED", "2", "1", "0"));
        assertEquals ("Could not read the file: Locked", Functions.getMessage ("IDS_NOTIFY_COULD_NOT_READ", new IOException ("Locked")));
    }


    @Test
    void usesIdOfUnknownMessages ()
    {
        assertEquals ("IDS_UNKNOWN", Functions.getMessage ("IDS_UNKNOWN"));
    }


    @Test
    void removesTheFileType ()
    {
        assertEquals ("Song", Functions.getNameWithoutType (new File ("Song.musicxml")));
        assertEquals ("My.Song", Functions.getNameWithoutType (new File ("My.Song.xml")));
        assertEquals ("Song", Functions.getNameWithoutType (new File ("Song")));
        assertEquals (".hidden", Functions.getNameWithoutType (new File (".hidden")));
    }
}
