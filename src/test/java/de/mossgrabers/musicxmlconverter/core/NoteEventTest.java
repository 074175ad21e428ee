// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;


class NoteEventTest
{
    @Test
    void limitsPitchToMidiRange ()
    {
        assertEquals (127, new NoteEvent (0, 960, 0, 131, 100).getPitch ());
        assertEquals (0, new NoteEvent (0, 960, 0, -3, 100).getPitch ());
        assertEquals (64, new NoteEvent (0, 960, 0, 64, 100).getPitch ());
    }


    @Test
    void keepsTheNoteAfterTheStart ()
    {
        final NoteEvent note = new NoteEvent (-10, -20, 0, 60, 100);
        assertEquals (0, note.getStart ());
        assertEquals (0, note.getEnd ());
    }
}
