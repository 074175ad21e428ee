// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * A tempo and/or time signature change at a position on the global timeline. Several changes at
 * the same position are merged into one marker.
 *
 * @author Jürgen Moßgraber
 */
public class TempoMarker
{
    private final double time;
    private Double       tempo;
    private Integer      beats;
    private Integer      beatUnit;


    /**
     * Constructor.
     *
     * @param time The position of the change in seconds
     */
    public TempoMarker (final double time)
    {
        this.time = time;
    }


    /**
     * Get the position of the change.
     *
     * @return The position in seconds
     */
    public double getTime ()
    {
        return this.time;
    }


    /**
     * Get the new tempo.
     *
     * @return The tempo in BPM or null if the tempo does not change
     */
    public Double getTempo ()
    {
        return this.tempo;
    }


    /**
     * Set the new tempo.
     *
     * @param tempo The tempo in BPM
     */
    public void setTempo (final double tempo)
    {
        this.tempo = Double.valueOf (tempo);
    }


    /**
     * Get the numerator of the new time signature.
     *
     * @return The number of beats or null if the time signature does not change
     */
    public Integer getBeats ()
    {
        return this.beats;
    }


    /**
     * Get the denominator of the new time signature.
     *
     * @return The beat unit or null if the time signature does not change
     */
    public Integer getBeatUnit ()
    {
        return this.beatUnit;
    }


    /**
     * Set the new time signature.
     *
     * @param beats The number of beats
     * @param beatUnit The beat unit
     */
    public void setTimeSignature (final int beats, final int beatUnit)
    {
        this.beats = Integer.valueOf (beats);
        this.beatUnit = Integer.valueOf (beatUnit);
    }
}
