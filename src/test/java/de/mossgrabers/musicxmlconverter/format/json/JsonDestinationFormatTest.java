// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.musicxmlconverter.RecordingNotifier;
import de.mossgrabers.musicxmlconverter.core.NoteEvent;
import de.mossgrabers.musicxmlconverter.core.Region;
import de.mossgrabers.musicxmlconverter.core.StaffTimeline;
import de.mossgrabers.musicxmlconverter.core.TempoMarker;
import de.mossgrabers.musicxmlconverter.core.TextEvent;
import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.core.TimelineContainer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;


class JsonDestinationFormatTest
{
    private final JsonDestinationFormat format = new JsonDestinationFormat (new RecordingNotifier ());

    @TempDir
    Path                                folder;


    @Test
    void writesAllTimelines () throws IOException
    {
        final File file = this.folder.resolve ("Song.timeline.json").toFile ();
        this.format.write (createContainer (), file);

        final JsonNode root = new ObjectMapper ().readTree (file);
        assertEquals ("Song", root.get ("name").asText ());
        assertEquals (4.0, root.get ("length").asDouble (), 0.0);

        final JsonNode marker = root.get ("tempoMarkers").get (0);
        assertEquals (90.0, marker.get ("tempo").asDouble (), 0.0);
        assertEquals (6, marker.get ("beats").asInt ());
        assertEquals (8, marker.get ("beatUnit").asInt ());
        final JsonNode tempoOnly = root.get ("tempoMarkers").get (1);
        assertEquals (2.0, tempoOnly.get ("time").asDouble (), 0.0);
        assertFalse (tempoOnly.has ("beats"));

        final JsonNode region = root.get ("regions").get (0);
        assertEquals ("Intro", region.get ("name").asText ());
        assertEquals ("#0A0B0C", region.get ("color").asText ());

        final JsonNode staff = root.get ("staves").get (0);
        assertEquals ("P1", staff.get ("part").asText ());
        assertEquals (2, staff.get ("staff").asInt ());
        assertTrue (staff.get ("tuningDeclared").asBoolean ());
        assertFalse (staff.get ("percussion").asBoolean ());
        assertEquals (2, staff.get ("tuning").size ());
        assertEquals (960, staff.get ("notes").get (0).get ("end").asLong ());
        assertEquals (3, staff.get ("notes").get (0).get ("channel").asInt ());

        final JsonNode marker6 = staff.get ("texts").get (1);
        assertEquals (6, marker6.get ("type").asInt ());
        assertEquals ("P.M.", marker6.get ("text").asText ());
        assertEquals (1, staff.get ("texts").get (0).get ("type").asInt ());
    }


    @Test
    void writesEmptyLists ()
    {
        final TimelineContainer container = new TimelineContainer ("Empty");
        container.setLength (1.0);

        final JsonNode root = this.format.toJson (container);
        assertEquals (0, root.get ("tempoMarkers").size ());
        assertEquals (0, root.get ("regions").size ());
        assertEquals (0, root.get ("staves").size ());
    }


    private static TimelineContainer createContainer ()
    {
        final TimelineContainer container = new TimelineContainer ("Song");
        container.setLength (4.0);

        final TempoMarker first = new TempoMarker (0);
        first.setTempo (90);
        first.setTimeSignature (6, 8);
        container.getTempoMarkers ().add (first);
        final TempoMarker second = new TempoMarker (2.0);
        second.setTempo (100);
        container.getTempoMarkers ().add (second);

        container.getRegions ().add (new Region ("Intro", 0, 2.0, 0x0A0B0C));

        final List<NoteEvent> notes = List.of (new NoteEvent (0, 960, 3, 52, 100));
        final List<TextEvent> texts = List.of (new TextEvent (0, TextEventType.TEXT, "_2"), new TextEvent (0, TextEventType.MARKER, "P.M."));
        container.getStaffTimelines ().add (new StaffTimeline ("P1", "Guitar", 2, false, notes, texts, List.of (Integer.valueOf (40), Integer.valueOf (45)), true));
        return container;
    }
}
