// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.core.NoteEvent;
import de.mossgrabers.musicxmlconverter.core.TextEvent;
import de.mossgrabers.musicxmlconverter.core.TextEventType;

import java.util.ArrayList;
import java.util.List;


/**
 * Collects the events of one staff while a part is walked.
 *
 * @author Jürgen Moßgraber
 */
class StaffData
{
    final List<NoteEvent> notes = new ArrayList<> ();
    final List<TextEvent> texts = new ArrayList<> ();

    private double        chordStart;
    private int           chordCount;


    /**
     * Get the position of a note. The first note of a chord starts at the current position. The
     * following notes of the chord are each moved further by the chord offset.
     *
     * @param isChordContinuation True if the note is marked as belonging to the chord of the
     *            previous note
     * @param position The current position of the walk in ticks
     * @param chordOffset The offset in ticks between the notes of a chord
     * @return The position of the note in ticks
     */
    double getOnset (final boolean isChordContinuation, final double position, final int chordOffset)
    {
        if (!isChordContinuation || this.chordCount == 0)
        {
            this.chordStart = position;
            this.chordCount = 1;
            return position;
        }

        this.chordCount++;
        return this.chordStart + (this.chordCount - 1) * (double) chordOffset;
    }


    /**
     * Forget the current chord, e.g. after a rest.
     */
    void resetChord ()
    {
        this.chordCount = 0;
    }


    /**
     * Add a note.
     *
     * @param start The start in ticks
     * @param duration The duration in ticks
     * @param channel The MIDI channel (0-15)
     * @param pitch The MIDI note
     * @param velocity The velocity
     */
    void addNote (final double start, final double duration, final int channel, final int pitch, final int velocity)
    {
        this.notes.add (new NoteEvent (Math.round (start), Math.round (start + duration), channel, pitch, velocity));
    }


    /**
     * Add a text event.
     *
     * @param position The position in ticks
     * @param type The kind of event
     * @param text The text
     */
    void addText (final double position, final TextEventType type, final String text)
    {
        this.texts.add (new TextEvent (Math.round (position), type, text));
    }


    /**
     * Add the text event of an articulation.
     *
     * @param position The position in ticks
     * @param articulation The articulation
     */
    void addText (final double position, final ResolvedArticulation articulation)
    {
        this.addText (position, articulation.getType (), articulation.getText ());
    }
}
