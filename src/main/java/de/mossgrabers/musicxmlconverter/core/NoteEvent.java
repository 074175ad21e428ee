// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * A note on a staff timeline. Positions are in ticks (pulses per quarter note of the host).
 *
 * @author Jürgen Moßgraber
 */
public class NoteEvent
{
    private final long start;
    private final long end;
    private final int  channel;
    private final int  pitch;
    private final int  velocity;


    /**
     * Constructor.
     *
     * @param start The start of the note in ticks
     * @param end The end of the note in ticks, not before the start
     * @param channel The MIDI channel (0-15)
     * @param pitch The MIDI note number, limited to 0-127
     * @param velocity The velocity (1-127)
     */
    public NoteEvent (final long start, final long end, final int channel, final int pitch, final int velocity)
    {
        this.start = Math.max (0, start);
        this.end = Math.max (this.start, end);
        this.channel = channel;
        this.pitch = Math.max (0, Math.min (127, pitch));
        this.velocity = velocity;
    }


    /**
     * Get the start of the note.
     *
     * @return The start in ticks
     */
    public long getStart ()
    {
        return this.start;
    }


    /**
     * Get the end of the note.
     *
     * @return The end in ticks
     */
    public long getEnd ()
    {
        return this.end;
    }


    /**
     * Get the MIDI channel of the note.
     *
     * @return The channel (0-15)
     */
    public int getChannel ()
    {
        return this.channel;
    }


    /**
     * Get the MIDI note number.
     *
     * @return The pitch
     */
    public int getPitch ()
    {
        return this.pitch;
    }


    /**
     * Get the velocity.
     *
     * @return The velocity
     */
    public int getVelocity ()
    {
        return this.velocity;
    }
}
