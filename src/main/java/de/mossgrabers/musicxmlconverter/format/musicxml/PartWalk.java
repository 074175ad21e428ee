// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.core.TempoConverter;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;


/**
 * Little helper class to aggregate the state of walking through the measures of one part.
 *
 * @author Jürgen Moßgraber
 */
class PartWalk
{
    static final double                DEFAULT_TEMPO = 120.0;

    final ScorePart                    scorePart;
    final boolean                      isPrimary;
    final int                          ticksPerQuarter;
    final Map<Integer, StaffData>      staves        = new TreeMap<> ();
    final Map<Integer, List<Integer>>  tunings       = new TreeMap<> ();
    final SlideTracker                 slides        = new SlideTracker ();

    double                             ticks;
    double                             seconds;
    double                             tempo         = DEFAULT_TEMPO;
    double                             divisions;
    boolean                            isTuningParsed;
    int                                skippedNotes;


    /**
     * Constructor.
     *
     * @param scorePart The part which is walked
     * @param isPrimary True if this is the first part of the document
     * @param ticksPerQuarter The resolution of the timeline
     */
    PartWalk (final ScorePart scorePart, final boolean isPrimary, final int ticksPerQuarter)
    {
        this.scorePart = scorePart;
        this.isPrimary = isPrimary;
        this.ticksPerQuarter = ticksPerQuarter;
    }


    /**
     * Is the number of divisions per quarter note known?
     *
     * @return True if known
     */
    boolean hasDivisions ()
    {
        return this.divisions > 0;
    }


    /**
     * Move the position forward. The time is calculated with the current tempo.
     *
     * @param tickDuration The number of ticks to move
     */
    void advance (final double tickDuration)
    {
        if (tickDuration <= 0)
            return;
        this.ticks += tickDuration;
        this.seconds += TempoConverter.ticksToSeconds (tickDuration, this.ticksPerQuarter, this.tempo);
    }


    /**
     * Move the position backward. Neither the position nor the time gets negative.
     *
     * @param tickDuration The number of ticks to move
     */
    void rewind (final double tickDuration)
    {
        if (tickDuration <= 0)
            return;
        this.ticks = Math.max (0, this.ticks - tickDuration);
        this.seconds = Math.max (0, this.seconds - TempoConverter.ticksToSeconds (tickDuration, this.ticksPerQuarter, this.tempo));
    }


    /**
     * Get the data of a staff. Created if it does not exist yet.
     *
     * @param staffNumber The number of the staff
     * @return The data
     */
    StaffData getStaff (final int staffNumber)
    {
        return this.staves.computeIfAbsent (Integer.valueOf (staffNumber), number -> new StaffData ());
    }
}
