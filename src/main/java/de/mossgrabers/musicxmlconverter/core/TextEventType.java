// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * The kinds of text events which can be placed on a staff timeline.
 *
 * @author Jürgen Moßgraber
 */
public enum TextEventType
{
    /** A label which is shown inline with the note. */
    TEXT(1),
    /** A marker, e.g. for palm mutes or strum directions. */
    MARKER(6),
    /** A cue point. */
    CUE(7);


    private final int hostType;


    private TextEventType (final int hostType)
    {
        this.hostType = hostType;
    }


    /**
     * Get the number of the meta event type which the host uses for this kind of event.
     *
     * @return The type number
     */
    public int getHostType ()
    {
        return this.hostType;
    }
}
