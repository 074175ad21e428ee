// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * A text event (label, marker or cue) on a staff timeline.
 *
 * @author Jürgen Moßgraber
 */
public class TextEvent
{
    private final long          position;
    private final TextEventType type;
    private final String        text;


    /**
     * Constructor.
     *
     * @param position The position in ticks
     * @param type The kind of the event
     * @param text The text
     */
    public TextEvent (final long position, final TextEventType type, final String text)
    {
        this.position = Math.max (0, position);
        this.type = type;
        this.text = text;
    }


    /**
     * Get the position.
     *
     * @return The position in ticks
     */
    public long getPosition ()
    {
        return this.position;
    }


    /**
     * Get the kind of the event.
     *
     * @return The type
     */
    public TextEventType getType ()
    {
        return this.type;
    }


    /**
     * Get the text.
     *
     * @return The text
     */
    public String getText ()
    {
        return this.text;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.position + " " + this.type + " " + this.text;
    }
}
