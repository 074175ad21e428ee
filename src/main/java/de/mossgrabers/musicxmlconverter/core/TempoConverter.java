// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * Helper class to convert between note durations, ticks, beats and seconds.
 *
 * @author Jürgen Moßgraber
 */
public class TempoConverter
{
    /**
     * Private constructor since this is a utility class.
     */
    private TempoConverter ()
    {
        // Intentionally empty
    }


    /**
     * Convert a time value in beats to seconds.
     *
     * @param beats The time value in beats
     * @param tempo The tempo in BPM
     * @return The time in seconds
     */
    public static double beatsToSeconds (final double beats, final double tempo)
    {
        final double beatsPerSecond = tempo / 60.0;
        return beats / beatsPerSecond;
    }


    /**
     * Convert a number of ticks to seconds.
     *
     * @param ticks The number of ticks
     * @param ticksPerQuarter The number of ticks of a quarter note
     * @param tempo The tempo in BPM (quarter notes per minute)
     * @return The time in seconds
     */
    public static double ticksToSeconds (final double ticks, final int ticksPerQuarter, final double tempo)
    {
        return beatsToSeconds (ticks / ticksPerQuarter, tempo);
    }


    /**
     * Convert a note duration to ticks.
     *
     * @param duration The duration in divisions
     * @param divisions The number of divisions of a quarter note
     * @param ticksPerQuarter The number of ticks of a quarter note
     * @return The duration in ticks
     */
    public static double durationToTicks (final double duration, final double divisions, final int ticksPerQuarter)
    {
        return duration / divisions * ticksPerQuarter;
    }
}
