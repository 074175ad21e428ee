// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;


/**
 * The lookup tables which control the conversion: articulation rules, drum instruments and the
 * colors of sections. The tables cannot be changed after creation.
 *
 * @author Jürgen Moßgraber
 */
public class ConfigurationTables
{
    private static final String                   DRUMS_RESOURCE         = "drums.json";
    private static final String                   REGION_COLORS_RESOURCE = "region-colors.json";
    private static final ObjectMapper             MAPPER                 = new ObjectMapper ();

    private final Map<String, IArticulationRule>  articulationRules;
    private final Map<String, DrumInstrument>     drumInstruments;
    private final Map<String, Integer>            regionColors;
    private final int                             defaultRegionColor;


    /**
     * Constructor.
     *
     * @param articulationRules The articulation rules by element name
     * @param drumInstruments The drum instruments by instrument name
     * @param regionColors The section colors (0xRRGGBB) by section name, matched case-insensitive
     * @param defaultRegionColor The color of sections not found in the region colors
     */
    public ConfigurationTables (final Map<String, IArticulationRule> articulationRules, final Map<String, DrumInstrument> drumInstruments, final Map<String, Integer> regionColors, final int defaultRegionColor)
    {
        this.articulationRules = Collections.unmodifiableMap (new LinkedHashMap<> (articulationRules));
        this.drumInstruments = Collections.unmodifiableMap (new LinkedHashMap<> (drumInstruments));

        final Map<String, Integer> colors = new HashMap<> ();
        regionColors.forEach ( (name, color) -> colors.put (name.toLowerCase (Locale.ROOT), color));
        this.regionColors = Collections.unmodifiableMap (colors);
        this.defaultRegionColor = defaultRegionColor;
    }


    /**
     * Create the default tables. The drum instruments and section colors are loaded from the
     * resources next to this class.
     *
     * @return The tables
     */
    public static ConfigurationTables createDefault ()
    {
        try (final InputStream drumsInput = openResource (DRUMS_RESOURCE); final InputStream colorsInput = openResource (REGION_COLORS_RESOURCE))
        {
            final RegionColors colors = loadRegionColors (colorsInput);
            return new ConfigurationTables (createDefaultArticulationRules (), loadDrumInstruments (drumsInput), colors.colors, colors.defaultColor);
        }
        catch (final IOException ex)
        {
            throw new UncheckedIOException ("Could not load the default configuration tables.", ex);
        }
    }


    /**
     * Create the default articulation rules.
     *
     * @return The rules by element name
     */
    public static Map<String, IArticulationRule> createDefaultArticulationRules ()
    {
        final Map<String, IArticulationRule> rules = new LinkedHashMap<> ();

        // Articulations
        rules.put ("accent", ArticulationRule.text (">"));
        rules.put ("staccato", ArticulationRule.text ("."));
        rules.put ("tenuto", ArticulationRule.text ("-"));
        rules.put ("staccatissimo", ArticulationRule.text ("'"));
        rules.put ("spiccato", ArticulationRule.text ("!"));
        rules.put ("scoop", ArticulationRule.text ("s"));
        rules.put ("falloff", ArticulationRule.text ("\\"));
        rules.put ("doit", ArticulationRule.text ("/"));
        rules.put ("breath-mark", ArticulationRule.text (","));

        // Technical
        rules.put ("palm", ArticulationRule.marker ("P.M___").withoutPrefix ());
        rules.put ("straight", ArticulationRule.text ("x").replacingLabel ().withoutPrefix ());
        rules.put ("hammer-on", ArticulationRule.text ("H"));
        rules.put ("pull-off", ArticulationRule.text ("P"));
        rules.put ("tap", ArticulationRule.text ("T"));
        rules.put ("fingering", new FingeringRule ());
        rules.put ("harmonic", ArticulationRule.text ("<%d>").replacingLabel ());
        rules.put ("natural-harmonic", ArticulationRule.text ("<%d>").replacingLabel ());
        rules.put ("artificial-harmonic", ArticulationRule.text ("<%d>").replacingLabel ());
        rules.put ("vibrato", ArticulationRule.text ("~"));
        rules.put ("bend", ArticulationRule.text ("^"));
        rules.put ("bend-release", ArticulationRule.text ("^^"));
        rules.put ("grace-note", ArticulationRule.text ("gr"));

        // Slides, paired by the slide tracker
        rules.put ("slide", ArticulationRule.marker ("sl.").withoutPrefix ());
        rules.put ("slide-up", ArticulationRule.text ("/"));
        rules.put ("slide-down", ArticulationRule.text ("\\"));

        // Strum directions
        rules.put ("up-stroke", ArticulationRule.marker ("˄"));
        rules.put ("down-stroke", ArticulationRule.marker ("˅"));

        // Play instructions
        rules.put ("mute", new MuteRule ());

        return rules;
    }


    /**
     * Load a drum instrument table. The JSON contains an array of objects with the attributes
     * name, label, channel and pitch. Only the name is required.
     *
     * @param input The stream to read from
     * @return The instruments by name
     * @throws IOException Could not read or parse the table
     */
    public static Map<String, DrumInstrument> loadDrumInstruments (final InputStream input) throws IOException
    {
        final List<DrumEntry> entries = MAPPER.readValue (input, new TypeReference<List<DrumEntry>> ()
        {
            // Intentionally empty
        });

        final Map<String, DrumInstrument> instruments = new LinkedHashMap<> ();
        for (final DrumEntry entry: entries)
        {
            if (entry.name == null || entry.name.isBlank ())
                throw new IOException ("Drum instrument without name.");
            if (entry.channel != null && (entry.channel.intValue () < 1 || entry.channel.intValue () > 16))
                throw new IOException ("Drum channel out of range for " + entry.name + ": " + entry.channel);
            instruments.put (entry.name, new DrumInstrument (entry.name, entry.label, entry.channel, entry.pitch));
        }
        return instruments;
    }


    /**
     * Get the rule for a notation element.
     *
     * @param elementName The name of the element
     * @return The rule or empty if the element is not converted
     */
    public Optional<IArticulationRule> getArticulationRule (final String elementName)
    {
        return Optional.ofNullable (this.articulationRules.get (elementName));
    }


    /**
     * Get the configuration of a drum instrument.
     *
     * @param instrumentName The name of the instrument as it appears in the document
     * @return The configuration or empty if the instrument is unknown
     */
    public Optional<DrumInstrument> getDrumInstrument (final String instrumentName)
    {
        return Optional.ofNullable (this.drumInstruments.get (instrumentName));
    }


    /**
     * Get the display color for a section.
     *
     * @param sectionName The name of the section, case is ignored
     * @return The color as 0xRRGGBB
     */
    public int getRegionColor (final String sectionName)
    {
        final Integer color = this.regionColors.get (sectionName.toLowerCase (Locale.ROOT));
        return color == null ? this.defaultRegionColor : color.intValue ();
    }


    private static InputStream openResource (final String resourceName) throws IOException
    {
        final InputStream input = ConfigurationTables.class.getResourceAsStream (resourceName);
        if (input == null)
            throw new IOException ("Missing resource: " + resourceName);
        return input;
    }


    private static RegionColors loadRegionColors (final InputStream input) throws IOException
    {
        final RegionColorsEntry entry = MAPPER.readValue (input, RegionColorsEntry.class);
        final RegionColors result = new RegionColors ();
        result.defaultColor = parseColor (entry.defaultColor);
        if (entry.colors != null)
        {
            for (final Map.Entry<String, String> color: entry.colors.entrySet ())
                result.colors.put (color.getKey (), Integer.valueOf (parseColor (color.getValue ())));
        }
        return result;
    }


    /**
     * Parses a color in the format #RRGGBB.
     *
     * @param text The text to parse
     * @return The color as 0xRRGGBB
     * @throws IOException The text is not a color
     */
    static int parseColor (final String text) throws IOException
    {
        if (text == null || !text.matches ("#[0-9a-fA-F]{6}"))
            throw new IOException ("Not a color: " + text);
        return Integer.parseInt (text.substring (1), 16);
    }


    /** The structure of an entry in the drum instrument table. */
    private static class DrumEntry
    {
        public String  name;
        public String  label;
        public Integer channel;
        public Integer pitch;
    }


    /** The structure of the section color file. */
    private static class RegionColorsEntry
    {
        @JsonProperty ("default")
        public String              defaultColor;
        public Map<String, String> colors;
    }


    private static class RegionColors
    {
        int                        defaultColor;
        final Map<String, Integer> colors = new LinkedHashMap<> ();
    }
}
