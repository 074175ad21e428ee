// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.INotifier;
import de.mossgrabers.musicxmlconverter.core.Region;
import de.mossgrabers.musicxmlconverter.core.StaffTimeline;
import de.mossgrabers.musicxmlconverter.core.TempoConverter;
import de.mossgrabers.musicxmlconverter.core.TempoMarker;
import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.core.TimelineContainer;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.ConfigurationTables;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.DrumInstrument;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.NodeHelper;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.TreeMap;


/**
 * Walks through the (repeat expanded) measures of all parts of a score and creates the note and
 * text events of each staff as well as the tempo markers and regions of the score.
 *
 * @author Jürgen Moßgraber
 */
public class TimelineSynthesizer
{
    private static final int                  VELOCITY             = 100;
    private static final int                  DEFAULT_OCTAVE       = 4;
    private static final int                  DEFAULT_TUNING_OCTAVE = 2;
    private static final double               REGION_EPSILON       = 0.01;
    private static final double               MINIMUM_LENGTH       = 0.001;
    private static final double               FALLBACK_LENGTH      = 1.0;
    private static final Map<String, Integer> STEP_OFFSETS         = Map.of ("C", Integer.valueOf (0), "D", Integer.valueOf (2), "E", Integer.valueOf (4), "F", Integer.valueOf (5), "G", Integer.valueOf (7), "A", Integer.valueOf (9), "B", Integer.valueOf (11));

    private final ConfigurationTables         tables;
    private final ImportSettings              settings;
    private final INotifier                   notifier;
    private final ArticulationResolver        articulationResolver;


    /**
     * Constructor.
     *
     * @param tables The configuration tables
     * @param settings The import settings
     * @param notifier Where to report skipped content
     */
    public TimelineSynthesizer (final ConfigurationTables tables, final ImportSettings settings, final INotifier notifier)
    {
        this.tables = tables;
        this.settings = settings;
        this.notifier = notifier;
        this.articulationResolver = new ArticulationResolver (tables);
    }


    /**
     * Creates the timelines of a score.
     *
     * @param name The name for the result
     * @param root The root element of the document
     * @return The timelines, tempo markers and regions
     * @throws ParseException The document contains no part
     */
    public TimelineContainer synthesize (final String name, final Node root) throws ParseException
    {
        final List<Node> partNodes = root.getChildNodes ("part");
        if (partNodes.isEmpty ())
            throw new ParseException ("The document contains no part.", 0);

        final Map<String, ScorePart> scoreParts = ScorePart.readPartList (root);
        final Map<Double, TempoMarker> tempoMarkers = new TreeMap<> ();
        final List<Section> sections = new ArrayList<> ();

        final Map<String, PartWalk> walks = new LinkedHashMap<> ();
        double length = 0;
        for (int i = 0; i < partNodes.size (); i++)
        {
            final Node partNode = partNodes.get (i);
            final String partID = partNode.getAttribute ("id").orElse ("P" + (i + 1));
            ScorePart scorePart = scoreParts.get (partID);
            if (scorePart == null)
                scorePart = ScorePart.createUnlisted (partID);

            final PartWalk walk = new PartWalk (scorePart, i == 0, this.settings.getTicksPerQuarter ());
            this.walkPart (partNode, walk, tempoMarkers, sections);
            walks.put (partID, walk);
            length = Math.max (length, walk.seconds);
        }
        if (length < MINIMUM_LENGTH)
            length = FALLBACK_LENGTH;

        final TimelineContainer container = new TimelineContainer (name);
        container.setLength (length);

        // Parts in the order of the part-list, parts missing in the part-list at the end
        for (final String partID: scoreParts.keySet ())
        {
            final PartWalk walk = walks.remove (partID);
            if (walk != null)
                addStaffTimelines (walk, container.getStaffTimelines ());
        }
        for (final PartWalk walk: walks.values ())
            addStaffTimelines (walk, container.getStaffTimelines ());

        container.getTempoMarkers ().addAll (tempoMarkers.values ());
        this.addRegions (sections, length, container.getRegions ());
        return container;
    }


    /**
     * Walks through all measures of a part.
     *
     * @param partNode The part element
     * @param walk The state of the walk
     * @param tempoMarkers Where to add tempo and time signature changes
     * @param sections Where to add the start of sections
     */
    private void walkPart (final Node partNode, final PartWalk walk, final Map<Double, TempoMarker> tempoMarkers, final List<Section> sections)
    {
        final RepeatExpander repeatExpander = new RepeatExpander ();
        final List<Node> measures = repeatExpander.expand (partNode.getChildNodes ("measure"));

        for (final Node measure: measures)
        {
            for (final Node element: measure.getChildNodes ())
            {
                if (element.isText ())
                    continue;

                switch (element.getName ())
                {
                    case "attributes":
                        this.processAttributes (element, walk, tempoMarkers);
                        break;

                    case "note":
                        this.processNote (element, walk);
                        break;

                    case "backup":
                        getTickDuration (element, walk).ifPresent (walk::rewind);
                        break;

                    case "forward":
                        getTickDuration (element, walk).ifPresent (walk::advance);
                        break;

                    case "direction":
                        this.processDirection (element, walk, tempoMarkers, sections);
                        break;

                    case "sound":
                        this.processSound (element, walk, tempoMarkers);
                        break;

                    default:
                        // Not relevant for the timeline
                        break;
                }
            }
        }

        final String partName = walk.scorePart.getName ();
        if (repeatExpander.getUnmatchedRepeats () > 0)
            this.notifier.log ("IDS_NOTIFY_UNMATCHED_REPEATS", Integer.toString (repeatExpander.getUnmatchedRepeats ()), partName);
        if (repeatExpander.getLimitedRepeats () > 0)
            this.notifier.log ("IDS_NOTIFY_LIMITED_REPEATS", Integer.toString (repeatExpander.getLimitedRepeats ()), partName);
        if (walk.skippedNotes > 0)
            this.notifier.log ("IDS_NOTIFY_SKIPPED_NOTES", Integer.toString (walk.skippedNotes), partName);
        walk.slides.reportOpenSlides (this.notifier, partName);
    }


    /**
     * Reads the divisions, the tuning (only from the first attributes of a part) and time
     * signature changes.
     *
     * @param attributes The attributes element
     * @param walk The state of the walk
     * @param tempoMarkers Where to add time signature changes
     */
    private void processAttributes (final Node attributes, final PartWalk walk, final Map<Double, TempoMarker> tempoMarkers)
    {
        final OptionalDouble divisions = NodeHelper.getChildDouble (attributes, "divisions");
        if (divisions.isPresent () && divisions.getAsDouble () > 0)
            walk.divisions = divisions.getAsDouble ();

        if (!walk.isTuningParsed)
        {
            walk.isTuningParsed = true;
            if (!walk.scorePart.hasUnpitchedInstruments ())
            {
                for (final Node staffDetails: attributes.getChildNodes ("staff-details"))
                {
                    final List<Integer> tuning = parseTuning (staffDetails);
                    if (!tuning.isEmpty ())
                        walk.tunings.put (Integer.valueOf (getStaffNumber (staffDetails.getAttribute ("number").orElse (null))), tuning);
                }
            }
        }

        if (!walk.isPrimary || !this.settings.isImportMarkers ())
            return;
        final Optional<Node> time = attributes.getChildNode ("time");
        if (time.isEmpty ())
            return;
        final OptionalInt beats = NodeHelper.getChildInteger (time.get (), "beats");
        final OptionalInt beatType = NodeHelper.getChildInteger (time.get (), "beat-type");
        if (beats.isPresent () && beatType.isPresent ())
            getTempoMarker (tempoMarkers, walk.seconds).setTimeSignature (beats.getAsInt (), beatType.getAsInt ());
    }


    /**
     * Creates the events of a note and moves the position forward.
     *
     * @param note The note element
     * @param walk The state of the walk
     */
    private void processNote (final Node note, final PartWalk walk)
    {
        final OptionalDouble tickDuration = getTickDuration (note, walk);
        if (tickDuration.isEmpty ())
            return;

        final double duration = tickDuration.getAsDouble ();
        final boolean isChordContinuation = note.hasChildNode ("chord");
        final int staffNumber = getStaffNumber (note.getChildNode ("staff").map (Node::getText).orElse (null));
        final StaffData staff = walk.getStaff (staffNumber);

        if (note.hasChildNode ("rest"))
        {
            staff.resetChord ();
            walk.advance (duration);
            return;
        }

        final Optional<UnpitchedInstrument> instrument = note.getChildNode ("instrument").flatMap (node -> node.getAttribute ("id")).flatMap (walk.scorePart::getUnpitchedInstrument);
        if (instrument.isPresent ())
            this.processDrumNote (note, instrument.get (), walk, staff, duration, isChordContinuation);
        else
            this.processPitchedNote (note, walk, staff, staffNumber, duration, isChordContinuation);

        // Only the first note of a chord moves the position
        if (!isChordContinuation)
            walk.advance (duration);
    }


    /**
     * Creates the events of a note of a fretted instrument. Notes without pitch or without string
     * and fret are skipped.
     *
     * @param note The note element
     * @param walk The state of the walk
     * @param staff The staff of the note
     * @param staffNumber The number of the staff
     * @param duration The duration in ticks
     * @param isChordContinuation True if the note belongs to the chord of the previous note
     */
    private void processPitchedNote (final Node note, final PartWalk walk, final StaffData staff, final int staffNumber, final double duration, final boolean isChordContinuation)
    {
        final OptionalInt pitch = getPitch (note);
        final Optional<Node> technical = findTablature (note);
        if (pitch.isEmpty () || technical.isEmpty ())
        {
            walk.skippedNotes++;
            return;
        }

        final int string = NodeHelper.getChildInteger (technical.get (), "string").getAsInt ();
        final int fret = NodeHelper.getChildInteger (technical.get (), "fret").getAsInt ();

        // Lowest string on the first channel
        int channel = 7 - string;
        if (channel < 1 || channel > 16)
            channel = 1;
        channel--;
        if (walk.scorePart.isBass ())
            channel = Math.max (0, channel - 1);

        final double onset = staff.getOnset (isChordContinuation, walk.ticks, this.settings.getChordOffsetTicks ());
        staff.addNote (onset, duration, channel, pitch.getAsInt (), VELOCITY);

        final List<ResolvedArticulation> articulations = this.articulationResolver.resolve (note, fret);
        addLabels (staff, onset, ResolvedArticulation.LABEL_PREFIX + fret, articulations);

        for (final Node slide: ArticulationResolver.getSlides (note))
        {
            final String slideType = slide.getAttribute ("type").orElse (null);
            this.articulationResolver.resolveSlide (slide, fret).flatMap (resolved -> walk.slides.process (staffNumber, string, slideType, onset, resolved)).ifPresent (resolved -> staff.addText (onset, resolved));
        }
    }


    /**
     * Creates the events of a note of an unpitched instrument. Slides are ignored.
     *
     * @param note The note element
     * @param instrument The instrument which plays the note
     * @param walk The state of the walk
     * @param staff The staff of the note
     * @param duration The duration in ticks
     * @param isChordContinuation True if the note belongs to the chord of the previous note
     */
    private void processDrumNote (final Node note, final UnpitchedInstrument instrument, final PartWalk walk, final StaffData staff, final double duration, final boolean isChordContinuation)
    {
        final Optional<DrumInstrument> drum = this.tables.getDrumInstrument (instrument.getName ());

        final int pitch = drum.isPresent () ? drum.get ().getPitch ().orElse (instrument.getMidiUnpitched ()) : instrument.getMidiUnpitched ();
        OptionalInt drumChannel = OptionalInt.empty ();
        if (drum.isPresent ())
            drumChannel = drum.get ().getChannel ();
        final int channel = Math.max (0, Math.min (15, drumChannel.orElse (instrument.getMidiChannel ()) - 1));
        final Optional<String> drumLabel = drum.flatMap (DrumInstrument::getLabel);
        final String label = ResolvedArticulation.LABEL_PREFIX + (drumLabel.isPresent () ? drumLabel.get () : createDrumLabel (instrument.getName ()));

        final double onset = staff.getOnset (isChordContinuation, walk.ticks, this.settings.getChordOffsetTicks ());
        staff.addNote (onset, duration, channel, pitch, VELOCITY);
        addLabels (staff, onset, label, this.articulationResolver.resolve (note, 0));
    }


    /**
     * Reads tempo changes and rehearsal marks.
     *
     * @param direction The direction element
     * @param walk The state of the walk
     * @param tempoMarkers Where to add tempo changes
     * @param sections Where to add the start of sections
     */
    private void processDirection (final Node direction, final PartWalk walk, final Map<Double, TempoMarker> tempoMarkers, final List<Section> sections)
    {
        for (final Node sound: direction.getChildNodes ("sound"))
            this.processSound (sound, walk, tempoMarkers);

        if (!walk.isPrimary || !this.settings.isImportRegions ())
            return;

        for (final Node directionType: direction.getChildNodes ("direction-type"))
        {
            for (final Node rehearsal: directionType.getChildNodes ("rehearsal"))
            {
                final String sectionName = rehearsal.getText ().trim ();
                if (!sectionName.isEmpty ())
                    addSection (sections, sectionName, walk.seconds);
            }
        }
    }


    /**
     * Reads a tempo change. Only the first part creates tempo markers and changes the tempo.
     *
     * @param sound The sound element
     * @param walk The state of the walk
     * @param tempoMarkers Where to add tempo changes
     */
    private void processSound (final Node sound, final PartWalk walk, final Map<Double, TempoMarker> tempoMarkers)
    {
        if (!walk.isPrimary || !this.settings.isImportMarkers ())
            return;

        final OptionalDouble tempo = NodeHelper.getAttributeDouble (sound, "tempo");
        if (tempo.isEmpty () || tempo.getAsDouble () <= 0)
            return;

        getTempoMarker (tempoMarkers, walk.seconds).setTempo (tempo.getAsDouble ());
        walk.tempo = tempo.getAsDouble ();
    }


    /**
     * Creates the regions from the section starts. Each region ends at the start of the next one,
     * the last one at the end of the score.
     *
     * @param sections The section starts
     * @param length The length of the score in seconds
     * @param regions Where to add the regions
     */
    private void addRegions (final List<Section> sections, final double length, final List<Region> regions)
    {
        sections.sort ( (s1, s2) -> Double.compare (s1.start, s2.start));
        for (int i = 0; i < sections.size (); i++)
        {
            final Section section = sections.get (i);
            double end = i + 1 < sections.size () ? sections.get (i + 1).start : length;
            if (end <= section.start)
                end = section.start + REGION_EPSILON;
            regions.add (new Region (section.name, section.start, end, this.tables.getRegionColor (section.name)));
        }
    }


    /**
     * Adds the timelines of all staves of a part which contain notes.
     *
     * @param walk The finished walk of the part
     * @param timelines Where to add the timelines
     */
    private static void addStaffTimelines (final PartWalk walk, final List<StaffTimeline> timelines)
    {
        final ScorePart scorePart = walk.scorePart;
        final boolean isDrums = scorePart.isDrums ();
        for (final Map.Entry<Integer, StaffData> entry: walk.staves.entrySet ())
        {
            final StaffData staff = entry.getValue ();
            if (staff.notes.isEmpty ())
                continue;

            final List<Integer> declaredTuning = isDrums ? null : walk.tunings.get (entry.getKey ());
            final List<Integer> tuning = declaredTuning == null ? scorePart.getDefaultTuning () : declaredTuning;
            timelines.add (new StaffTimeline (scorePart.getId (), scorePart.getName (), entry.getKey ().intValue (), isDrums, staff.notes, staff.texts, tuning, declaredTuning != null));
        }
    }


    /**
     * Adds the label of a note and the events of its articulations. The first articulation which
     * replaces the label is used instead of the label.
     *
     * @param staff The staff
     * @param onset The position of the note
     * @param label The label of the note
     * @param articulations The articulations of the note
     */
    private static void addLabels (final StaffData staff, final double onset, final String label, final List<ResolvedArticulation> articulations)
    {
        final Optional<ResolvedArticulation> replacement = articulations.stream ().filter (ResolvedArticulation::isReplacesLabel).findFirst ();
        if (replacement.isPresent ())
            staff.addText (onset, replacement.get ());
        else
            staff.addText (onset, TextEventType.TEXT, label);

        for (final ResolvedArticulation articulation: articulations)
        {
            if (!articulation.isReplacesLabel ())
                staff.addText (onset, articulation);
        }
    }


    private static void addSection (final List<Section> sections, final String name, final double start)
    {
        for (final Section section: sections)
        {
            if (section.name.equals (name) && Math.abs (section.start - start) < REGION_EPSILON)
                return;
        }
        sections.add (new Section (name, start));
    }


    private static TempoMarker getTempoMarker (final Map<Double, TempoMarker> tempoMarkers, final double time)
    {
        return tempoMarkers.computeIfAbsent (Double.valueOf (time), key -> new TempoMarker (key.doubleValue ()));
    }


    /**
     * Get the duration of a note, backup or forward element in ticks.
     *
     * @param element The element
     * @param walk The state of the walk which contains the current divisions
     * @return The duration or empty if the element has no (valid) duration or the divisions are
     *         not yet known
     */
    private static OptionalDouble getTickDuration (final Node element, final PartWalk walk)
    {
        if (!walk.hasDivisions ())
            return OptionalDouble.empty ();
        final OptionalDouble duration = NodeHelper.getChildDouble (element, "duration");
        if (duration.isEmpty () || duration.getAsDouble () < 0)
            return OptionalDouble.empty ();
        return OptionalDouble.of (TempoConverter.durationToTicks (duration.getAsDouble (), walk.divisions, walk.ticksPerQuarter));
    }


    /**
     * Calculates the MIDI note of a pitch element.
     *
     * @param note The note element
     * @return The MIDI note or empty if there is no pitch or no valid step
     */
    private static OptionalInt getPitch (final Node note)
    {
        final Optional<Node> pitch = note.getChildNode ("pitch");
        if (pitch.isEmpty ())
            return OptionalInt.empty ();
        final Integer offset = STEP_OFFSETS.get (pitch.get ().getChildText ("step").trim ());
        if (offset == null)
            return OptionalInt.empty ();
        final double alter = NodeHelper.getChildDouble (pitch.get (), "alter").orElse (0);
        final int octave = NodeHelper.getChildInteger (pitch.get (), "octave").orElse (DEFAULT_OCTAVE);
        return OptionalInt.of ((int) Math.round ((octave + 1) * 12 + offset.intValue () + alter));
    }


    /**
     * Find the technical element which contains the string and fret of a note.
     *
     * @param note The note element
     * @return The technical element or empty if the note has no string and fret
     */
    private static Optional<Node> findTablature (final Node note)
    {
        for (final Node notations: note.getChildNodes ("notations"))
        {
            for (final Node technical: notations.getChildNodes ("technical"))
            {
                if (NodeHelper.getChildInteger (technical, "string").isPresent () && NodeHelper.getChildInteger (technical, "fret").isPresent ())
                    return Optional.of (technical);
            }
        }
        return Optional.empty ();
    }


    /**
     * Reads the tuning of a staff, sorted by line number.
     *
     * @param staffDetails The staff-details element
     * @return The MIDI notes of the strings, lowest string first, empty if there is no tuning
     */
    private static List<Integer> parseTuning (final Node staffDetails)
    {
        final List<Node> staffTunings = new ArrayList<> (staffDetails.getChildNodes ("staff-tuning"));
        staffTunings.sort ( (t1, t2) -> Integer.compare (NodeHelper.getAttributeInteger (t1, "line").orElse (0), NodeHelper.getAttributeInteger (t2, "line").orElse (0)));

        final List<Integer> tuning = new ArrayList<> ();
        for (final Node staffTuning: staffTunings)
        {
            final String step = staffTuning.getChildText ("tuning-step").trim ();
            if (step.isEmpty ())
                continue;
            final Integer offset = STEP_OFFSETS.get (step);
            final double alter = NodeHelper.getChildDouble (staffTuning, "tuning-alter").orElse (0);
            final int octave = NodeHelper.getChildInteger (staffTuning, "tuning-octave").orElse (DEFAULT_TUNING_OCTAVE);
            tuning.add (Integer.valueOf ((int) Math.round ((octave + 1) * 12 + (offset == null ? 0 : offset.intValue ()) + alter)));
        }
        return tuning;
    }


    /**
     * Creates a label from a drum instrument name: the first word of the lower case name without
     * parenthesis.
     *
     * @param instrumentName The name of the instrument
     * @return The label
     */
    static String createDrumLabel (final String instrumentName)
    {
        final String lowerName = instrumentName.toLowerCase (Locale.ROOT);
        final String simple = lowerName.replaceAll ("[()]", "").trim ();
        if (simple.isEmpty ())
            return lowerName;
        return simple.split ("\\s+")[0];
    }


    private static int getStaffNumber (final String text)
    {
        if (text == null)
            return 1;
        final OptionalInt number = NodeHelper.toInteger (text);
        return number.isPresent () && number.getAsInt () > 0 ? number.getAsInt () : 1;
    }


    /** The start of a section. */
    private static class Section
    {
        final String name;
        final double start;


        Section (final String name, final double start)
        {
            this.name = name;
            this.start = start;
        }
    }
}
