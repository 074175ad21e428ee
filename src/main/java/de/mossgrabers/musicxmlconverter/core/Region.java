// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * A named section of the song (e.g. verse or chorus) on the global timeline.
 *
 * @author Jürgen Moßgraber
 */
public class Region
{
    private final String name;
    private final double start;
    private final double end;
    private final int    color;


    /**
     * Constructor.
     *
     * @param name The name of the section
     * @param start The start in seconds
     * @param end The end in seconds
     * @param color The display color as 0xRRGGBB
     */
    public Region (final String name, final double start, final double end, final int color)
    {
        this.name = name;
        this.start = start;
        this.end = end;
        this.color = color;
    }


    /**
     * Get the name of the section.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the start of the section.
     *
     * @return The start in seconds
     */
    public double getStart ()
    {
        return this.start;
    }


    /**
     * Get the end of the section.
     *
     * @return The end in seconds
     */
    public double getEnd ()
    {
        return this.end;
    }


    /**
     * Get the display color.
     *
     * @return The color as 0xRRGGBB
     */
    public int getColor ()
    {
        return this.color;
    }
}
