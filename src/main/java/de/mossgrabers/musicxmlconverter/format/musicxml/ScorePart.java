// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.NodeHelper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;


/**
 * The information about a part from the part-list of a score: its' name and the instruments which
 * play unpitched notes.
 *
 * @author Jürgen Moßgraber
 */
public class ScorePart
{
    private static final List<Integer>             GUITAR_TUNING       = List.of (Integer.valueOf (40), Integer.valueOf (45), Integer.valueOf (50), Integer.valueOf (55), Integer.valueOf (59), Integer.valueOf (64));
    private static final List<Integer>             BASS_TUNING         = List.of (Integer.valueOf (28), Integer.valueOf (33), Integer.valueOf (38), Integer.valueOf (43));
    private static final List<Integer>             FIVE_STRING_TUNING  = List.of (Integer.valueOf (23), Integer.valueOf (28), Integer.valueOf (33), Integer.valueOf (38), Integer.valueOf (43));
    private static final List<Integer>             DRUM_PROFILE        = List.of (Integer.valueOf (36), Integer.valueOf (38), Integer.valueOf (42), Integer.valueOf (45), Integer.valueOf (51), Integer.valueOf (49), Integer.valueOf (56), Integer.valueOf (60), Integer.valueOf (70));

    private final String                           id;
    private final String                           name;
    private final Map<String, UnpitchedInstrument> unpitchedInstruments;


    /**
     * Constructor.
     *
     * @param id The ID of the part
     * @param name The name of the part
     * @param unpitchedInstruments The instruments playing unpitched notes by their' ID
     */
    public ScorePart (final String id, final String name, final Map<String, UnpitchedInstrument> unpitchedInstruments)
    {
        this.id = id;
        this.name = name;
        this.unpitchedInstruments = Collections.unmodifiableMap (new LinkedHashMap<> (unpitchedInstruments));
    }


    /**
     * Create a part for which the part-list contains no entry.
     *
     * @param id The ID of the part
     * @return The part
     */
    public static ScorePart createUnlisted (final String id)
    {
        return new ScorePart (id, "Part " + id, Collections.emptyMap ());
    }


    /**
     * Reads all score-part entries of the part-list.
     *
     * @param root The root element of the document
     * @return The parts by their' ID in the order of the part-list
     */
    public static Map<String, ScorePart> readPartList (final Node root)
    {
        final Map<String, ScorePart> parts = new LinkedHashMap<> ();
        final Optional<Node> partList = root.getChildNode ("part-list");
        if (partList.isEmpty ())
            return parts;

        for (final Node scorePart: partList.get ().getChildNodes ("score-part"))
        {
            final Optional<String> id = scorePart.getAttribute ("id");
            if (id.isEmpty ())
                continue;
            final String partName = scorePart.getChildText ("part-name").trim ();
            final String name = partName.isEmpty () ? "Part " + id.get () : partName;
            parts.put (id.get (), new ScorePart (id.get (), name, readUnpitchedInstruments (scorePart)));
        }
        return parts;
    }


    /**
     * Creates the unpitched instruments of a score-part. Only instruments with a midi-instrument
     * which declares a midi-unpitched note are included.
     *
     * @param scorePart The score-part element
     * @return The instruments by ID
     */
    private static Map<String, UnpitchedInstrument> readUnpitchedInstruments (final Node scorePart)
    {
        final Map<String, UnpitchedInstrument> instruments = new LinkedHashMap<> ();
        final List<Node> midiInstruments = scorePart.getChildNodes ("midi-instrument");
        for (final Node scoreInstrument: scorePart.getChildNodes ("score-instrument"))
        {
            final Optional<String> instrumentID = scoreInstrument.getAttribute ("id");
            if (instrumentID.isEmpty ())
                continue;

            for (final Node midiInstrument: midiInstruments)
            {
                if (!instrumentID.get ().equals (midiInstrument.getAttribute ("id").orElse (null)))
                    continue;

                final OptionalInt unpitched = NodeHelper.getChildInteger (midiInstrument, "midi-unpitched");
                if (unpitched.isPresent ())
                {
                    final int channel = NodeHelper.getChildInteger (midiInstrument, "midi-channel").orElse (UnpitchedInstrument.DEFAULT_MIDI_CHANNEL);
                    final String instrumentName = scoreInstrument.getChildText ("instrument-name").trim ();
                    instruments.put (instrumentID.get (), new UnpitchedInstrument (instrumentID.get (), instrumentName, channel, unpitched.getAsInt ()));
                }
                break;
            }
        }
        return instruments;
    }


    /**
     * Get the ID.
     *
     * @return The ID
     */
    public String getId ()
    {
        return this.id;
    }


    /**
     * Get the name.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Lookup an unpitched instrument.
     *
     * @param instrumentID The ID of the instrument
     * @return The instrument or empty if the part has no unpitched instrument with that ID
     */
    public Optional<UnpitchedInstrument> getUnpitchedInstrument (final String instrumentID)
    {
        return Optional.ofNullable (this.unpitchedInstruments.get (instrumentID));
    }


    /**
     * Does the part contain any instrument playing unpitched notes?
     *
     * @return True if there is at least one
     */
    public boolean hasUnpitchedInstruments ()
    {
        return !this.unpitchedInstruments.isEmpty ();
    }


    /**
     * Is this a bass part? Checks if the name contains 'bass'.
     *
     * @return True if it is a bass
     */
    public boolean isBass ()
    {
        return this.getLowerCaseName ().contains ("bass");
    }


    /**
     * Is this a 5-string bass part? Checks if the name contains 'bass' and either '5' or 'five'.
     *
     * @return True if it is a 5-string bass
     */
    public boolean isFiveStringBass ()
    {
        final String lowerName = this.getLowerCaseName ();
        return lowerName.contains ("bass") && (lowerName.contains ("5") || lowerName.contains ("five"));
    }


    /**
     * Is this a drum part? True if the part has unpitched instruments or if the name contains
     * 'drum', 'percussion' or 'kit'.
     *
     * @return True if it is a drum part
     */
    public boolean isDrums ()
    {
        if (this.hasUnpitchedInstruments ())
            return true;
        final String lowerName = this.getLowerCaseName ();
        return lowerName.contains ("drum") || lowerName.contains ("percussion") || lowerName.contains ("kit");
    }


    /**
     * Get the tuning to use for a staff of this part if the document does not declare one. Drum
     * parts get one base note for each of their nine channels.
     *
     * @return The MIDI notes of the strings, lowest string first
     */
    public List<Integer> getDefaultTuning ()
    {
        if (this.isDrums ())
            return DRUM_PROFILE;
        if (this.isFiveStringBass ())
            return FIVE_STRING_TUNING;
        if (this.isBass ())
            return BASS_TUNING;
        return GUITAR_TUNING;
    }


    private String getLowerCaseName ()
    {
        return this.name.toLowerCase (Locale.ROOT);
    }
}
