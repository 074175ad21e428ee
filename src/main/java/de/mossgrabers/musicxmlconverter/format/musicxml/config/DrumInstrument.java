// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.config;

import java.util.Optional;
import java.util.OptionalInt;


/**
 * The mapping of a drum instrument name to its' label, MIDI channel and MIDI note. Each value is
 * optional, missing values are taken from the document.
 *
 * @author Jürgen Moßgraber
 */
public class DrumInstrument
{
    private final String  name;
    private final String  label;
    private final Integer channel;
    private final Integer pitch;


    /**
     * Constructor.
     *
     * @param name The instrument name as it appears in the document, e.g. "Snare (hit)"
     * @param label The short label, might be null
     * @param channel The MIDI channel (1-9), might be null
     * @param pitch The MIDI note, might be null
     */
    public DrumInstrument (final String name, final String label, final Integer channel, final Integer pitch)
    {
        this.name = name;
        this.label = label;
        this.channel = channel;
        this.pitch = pitch;
    }


    /**
     * Get the instrument name.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the short label.
     *
     * @return The label if configured
     */
    public Optional<String> getLabel ()
    {
        return Optional.ofNullable (this.label);
    }


    /**
     * Get the MIDI channel.
     *
     * @return The 1-based channel if configured
     */
    public OptionalInt getChannel ()
    {
        return this.channel == null ? OptionalInt.empty () : OptionalInt.of (this.channel.intValue ());
    }


    /**
     * Get the MIDI note.
     *
     * @return The note if configured
     */
    public OptionalInt getPitch ()
    {
        return this.pitch == null ? OptionalInt.empty () : OptionalInt.of (this.pitch.intValue ());
    }
}
