// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.json;

import de.mossgrabers.musicxmlconverter.INotifier;
import de.mossgrabers.musicxmlconverter.core.AbstractCoreTask;
import de.mossgrabers.musicxmlconverter.core.IDestinationFormat;
import de.mossgrabers.musicxmlconverter.core.NoteEvent;
import de.mossgrabers.musicxmlconverter.core.Region;
import de.mossgrabers.musicxmlconverter.core.StaffTimeline;
import de.mossgrabers.musicxmlconverter.core.TempoMarker;
import de.mossgrabers.musicxmlconverter.core.TextEvent;
import de.mossgrabers.musicxmlconverter.core.TimelineContainer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.File;
import java.io.IOException;


/**
 * Writes the timelines as a JSON document which can be picked up by the host which creates the
 * tracks, items and markers.
 *
 * @author Jürgen Moßgraber
 */
public class JsonDestinationFormat extends AbstractCoreTask implements IDestinationFormat
{
    private final ObjectMapper mapper = new ObjectMapper ().enable (SerializationFeature.INDENT_OUTPUT);


    /**
     * Constructor.
     *
     * @param notifier The notifier
     */
    public JsonDestinationFormat (final INotifier notifier)
    {
        super ("JSON", notifier);
    }


    /** {@inheritDoc} */
    @Override
    public void write (final TimelineContainer container, final File outputFile) throws IOException
    {
        this.mapper.writeValue (outputFile, this.toJson (container));
    }


    /**
     * Creates the JSON tree of the timelines.
     *
     * @param container The timelines
     * @return The root object
     */
    public ObjectNode toJson (final TimelineContainer container)
    {
        final ObjectNode root = this.mapper.createObjectNode ();
        root.put ("name", container.getName ());
        root.put ("length", container.getLength ());

        final ArrayNode tempoMarkers = root.putArray ("tempoMarkers");
        for (final TempoMarker tempoMarker: container.getTempoMarkers ())
        {
            final ObjectNode markerNode = tempoMarkers.addObject ();
            markerNode.put ("time", tempoMarker.getTime ());
            if (tempoMarker.getTempo () != null)
                markerNode.put ("tempo", tempoMarker.getTempo ().doubleValue ());
            if (tempoMarker.getBeats () != null)
                markerNode.put ("beats", tempoMarker.getBeats ().intValue ());
            if (tempoMarker.getBeatUnit () != null)
                markerNode.put ("beatUnit", tempoMarker.getBeatUnit ().intValue ());
        }

        final ArrayNode regions = root.putArray ("regions");
        for (final Region region: container.getRegions ())
        {
            final ObjectNode regionNode = regions.addObject ();
            regionNode.put ("name", region.getName ());
            regionNode.put ("start", region.getStart ());
            regionNode.put ("end", region.getEnd ());
            regionNode.put ("color", String.format ("#%06X", Integer.valueOf (region.getColor ())));
        }

        final ArrayNode staves = root.putArray ("staves");
        for (final StaffTimeline staff: container.getStaffTimelines ())
            writeStaff (staves.addObject (), staff);

        return root;
    }


    private static void writeStaff (final ObjectNode staffNode, final StaffTimeline staff)
    {
        staffNode.put ("part", staff.getPartID ());
        staffNode.put ("name", staff.getName ());
        staffNode.put ("staff", staff.getStaffNumber ());
        staffNode.put ("percussion", staff.isPercussion ());
        staffNode.put ("tuningDeclared", staff.isTuningDeclared ());

        final ArrayNode tuning = staffNode.putArray ("tuning");
        for (final Integer pitch: staff.getTuning ())
            tuning.add (pitch.intValue ());

        final ArrayNode notes = staffNode.putArray ("notes");
        for (final NoteEvent note: staff.getNotes ())
        {
            final ObjectNode noteNode = notes.addObject ();
            noteNode.put ("start", note.getStart ());
            noteNode.put ("end", note.getEnd ());
            noteNode.put ("channel", note.getChannel ());
            noteNode.put ("pitch", note.getPitch ());
            noteNode.put ("velocity", note.getVelocity ());
        }

        final ArrayNode texts = staffNode.putArray ("texts");
        for (final TextEvent text: staff.getTexts ())
        {
            final ObjectNode textNode = texts.addObject ();
            textNode.put ("position", text.getPosition ());
            textNode.put ("type", text.getType ().getHostType ());
            textNode.put ("text", text.getText ());
        }
    }
}
