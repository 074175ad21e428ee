// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

/**
 * An instrument of a part which plays unpitched (percussion) notes. Created from a score-instrument
 * and the midi-instrument with the same ID.
 *
 * @author Jürgen Moßgraber
 */
public class UnpitchedInstrument
{
    /** The MIDI channel if the document does not declare one. */
    public static final int DEFAULT_MIDI_CHANNEL = 10;

    private final String    id;
    private final String    name;
    private final int       midiChannel;
    private final int       midiUnpitched;


    /**
     * Constructor.
     *
     * @param id The ID of the instrument
     * @param name The name of the instrument
     * @param midiChannel The declared MIDI channel (1-16)
     * @param midiUnpitched The declared MIDI note
     */
    public UnpitchedInstrument (final String id, final String name, final int midiChannel, final int midiUnpitched)
    {
        this.id = id;
        this.name = name;
        this.midiChannel = midiChannel;
        this.midiUnpitched = midiUnpitched;
    }


    /**
     * Get the ID.
     *
     * @return The ID
     */
    public String getId ()
    {
        return this.id;
    }


    /**
     * Get the name, e.g. 'Snare (hit)'.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the declared MIDI channel.
     *
     * @return The channel in the range of 1-16
     */
    public int getMidiChannel ()
    {
        return this.midiChannel;
    }


    /**
     * Get the declared MIDI note.
     *
     * @return The note
     */
    public int getMidiUnpitched ()
    {
        return this.midiUnpitched;
    }
}
