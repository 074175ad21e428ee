// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import java.util.ArrayList;
import java.util.List;


/**
 * A container for everything which was read from a score: the staff timelines, the tempo and time
 * signature markers and the sections.
 *
 * @author Jürgen Moßgraber
 */
public class TimelineContainer
{
    private final String              name;
    private final List<StaffTimeline> staffTimelines = new ArrayList<> ();
    private final List<TempoMarker>   tempoMarkers   = new ArrayList<> ();
    private final List<Region>        regions        = new ArrayList<> ();
    private double                    length;


    /**
     * Constructor.
     *
     * @param name The name of the score
     */
    public TimelineContainer (final String name)
    {
        this.name = name;
    }


    /**
     * Get the name of the score.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the staff timelines in the order of the parts.
     *
     * @return The timelines
     */
    public List<StaffTimeline> getStaffTimelines ()
    {
        return this.staffTimelines;
    }


    /**
     * Get the tempo and time signature markers sorted by their time.
     *
     * @return The markers
     */
    public List<TempoMarker> getTempoMarkers ()
    {
        return this.tempoMarkers;
    }


    /**
     * Get the sections sorted by their start.
     *
     * @return The regions
     */
    public List<Region> getRegions ()
    {
        return this.regions;
    }


    /**
     * Get the length of the longest part.
     *
     * @return The length in seconds
     */
    public double getLength ()
    {
        return this.length;
    }


    /**
     * Set the length of the longest part.
     *
     * @param length The length in seconds
     */
    public void setLength (final double length)
    {
        this.length = length;
    }
}
