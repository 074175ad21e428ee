// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;


/**
 * The settings of a MusicXML import.
 *
 * @author Jürgen Moßgraber
 */
public class ImportSettings
{
    /** The default number of ticks per quarter note. */
    public static final int     DEFAULT_TICKS_PER_QUARTER = 960;
    /** The default offset between the notes of a chord. */
    public static final int     DEFAULT_CHORD_OFFSET      = 1;

    private final int           ticksPerQuarter;
    private final int           chordOffsetTicks;
    private final boolean       importMarkers;
    private final boolean       importRegions;


    /**
     * Constructor.
     *
     * @param ticksPerQuarter The resolution of the timeline in ticks per quarter note, must be
     *            larger than 0
     * @param chordOffsetTicks The number of ticks by which each further note of a chord is moved
     *            behind the previous one, 0 disables the offset
     * @param importMarkers Create tempo and time signature markers
     * @param importRegions Create regions from rehearsal marks
     */
    public ImportSettings (final int ticksPerQuarter, final int chordOffsetTicks, final boolean importMarkers, final boolean importRegions)
    {
        if (ticksPerQuarter <= 0)
            throw new IllegalArgumentException ("Ticks per quarter must be positive: " + ticksPerQuarter);
        if (chordOffsetTicks < 0)
            throw new IllegalArgumentException ("Chord offset must not be negative: " + chordOffsetTicks);

        this.ticksPerQuarter = ticksPerQuarter;
        this.chordOffsetTicks = chordOffsetTicks;
        this.importMarkers = importMarkers;
        this.importRegions = importRegions;
    }


    /**
     * Create the default settings.
     *
     * @return The settings
     */
    public static ImportSettings createDefault ()
    {
        return new ImportSettings (DEFAULT_TICKS_PER_QUARTER, DEFAULT_CHORD_OFFSET, true, true);
    }


    /**
     * Load the settings from a YAML file. Missing or invalid values are replaced by their
     * defaults.
     *
     * @param settingsFile The file, if it does not exist the default settings are returned
     * @return The settings
     * @throws IOException The file could not be read or is not YAML
     */
    public static ImportSettings load (final File settingsFile) throws IOException
    {
        if (settingsFile == null || !settingsFile.exists ())
            return createDefault ();

        final ObjectMapper yamlMapper = new ObjectMapper (new YAMLFactory ());
        yamlMapper.configure (DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        final YamlSettings yamlSettings = yamlMapper.readValue (settingsFile, YamlSettings.class);
        if (yamlSettings == null)
            return createDefault ();

        final int ticks = yamlSettings.ticksPerQuarter != null && yamlSettings.ticksPerQuarter.intValue () > 0 ? yamlSettings.ticksPerQuarter.intValue () : DEFAULT_TICKS_PER_QUARTER;
        final int offset = yamlSettings.chordOffsetTicks != null && yamlSettings.chordOffsetTicks.intValue () >= 0 ? yamlSettings.chordOffsetTicks.intValue () : DEFAULT_CHORD_OFFSET;
        final boolean markers = yamlSettings.importMarkers == null || yamlSettings.importMarkers.booleanValue ();
        final boolean regions = yamlSettings.importRegions == null || yamlSettings.importRegions.booleanValue ();
        return new ImportSettings (ticks, offset, markers, regions);
    }


    /**
     * Get the resolution of the timeline.
     *
     * @return The number of ticks per quarter note
     */
    public int getTicksPerQuarter ()
    {
        return this.ticksPerQuarter;
    }


    /**
     * Get the offset between the notes of a chord.
     *
     * @return The offset in ticks
     */
    public int getChordOffsetTicks ()
    {
        return this.chordOffsetTicks;
    }


    /**
     * Should tempo and time signature markers be created?
     *
     * @return True to create them
     */
    public boolean isImportMarkers ()
    {
        return this.importMarkers;
    }


    /**
     * Should regions be created from rehearsal marks?
     *
     * @return True to create them
     */
    public boolean isImportRegions ()
    {
        return this.importRegions;
    }


    /** The structure of the settings file. */
    private static class YamlSettings
    {
        public Integer ticksPerQuarter;
        public Integer chordOffsetTicks;
        public Boolean importMarkers;
        public Boolean importRegions;
    }
}
