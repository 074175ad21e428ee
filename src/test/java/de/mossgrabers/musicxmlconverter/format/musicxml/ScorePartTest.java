// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.musicxmlconverter.format.musicxml.model.MusicXmlParser;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.List;
import java.util.Map;


class ScorePartTest
{
    @Test
    void readsThePartList () throws ParseException
    {
        final Map<String, ScorePart> parts = ScorePart.readPartList (MusicXmlParser.parse ("""
                <score-partwise>
                  <part-list>
                    <score-part id="P2"><part-name>Lead Guitar</part-name></score-part>
                    <part-group type="start"/>
                    <score-part id="P1"><part-name>  </part-name></score-part>
                    <score-part id="P3">
                      <part-name>Drums</part-name>
                      <score-instrument id="P3-I1"><instrument-name>Kick (hit)</instrument-name></score-instrument>
                      <score-instrument id="P3-I2"><instrument-name>Unused</instrument-name></score-instrument>
                      <midi-instrument id="P3-I1"><midi-channel>10</midi-channel><midi-unpitched>36</midi-unpitched></midi-instrument>
                      <midi-instrument id="P3-I2"><midi-channel>10</midi-channel></midi-instrument>
                    </score-part>
                  </part-list>
                </score-partwise>
                """));

        assertEquals (List.of ("P2", "P1", "P3"), List.copyOf (parts.keySet ()));
        assertEquals ("Lead Guitar", parts.get ("P2").getName ());
        assertEquals ("Part P1", parts.get ("P1").getName ());

        final ScorePart drums = parts.get ("P3");
        assertTrue (drums.hasUnpitchedInstruments ());
        final UnpitchedInstrument kick = drums.getUnpitchedInstrument ("P3-I1").orElseThrow ();
        assertEquals ("Kick (hit)", kick.getName ());
        assertEquals (10, kick.getMidiChannel ());
        assertEquals (36, kick.getMidiUnpitched ());
        assertFalse (drums.getUnpitchedInstrument ("P3-I2").isPresent ());
    }


    @Test
    void detectsInstrumentsFromTheName ()
    {
        final ScorePart bass = ScorePart.createUnlisted ("P1");
        assertEquals ("Part P1", bass.getName ());
        assertFalse (bass.isBass ());

        assertTrue (new ScorePart ("P1", "Electric Bass", Map.of ()).isBass ());
        assertFalse (new ScorePart ("P1", "Electric Bass", Map.of ()).isFiveStringBass ());
        assertTrue (new ScorePart ("P1", "Five String BASS", Map.of ()).isFiveStringBass ());
        assertTrue (new ScorePart ("P1", "Drum Kit", Map.of ()).isDrums ());
        assertTrue (new ScorePart ("P1", "Percussion", Map.of ()).isDrums ());
        assertFalse (new ScorePart ("P1", "Acoustic Guitar", Map.of ()).isDrums ());
    }


    @Test
    void selectsTheDefaultTuning ()
    {
        assertEquals (6, new ScorePart ("P1", "Guitar", Map.of ()).getDefaultTuning ().size ());
        assertEquals (4, new ScorePart ("P1", "Bass", Map.of ()).getDefaultTuning ().size ());
        assertEquals (5, new ScorePart ("P1", "5-String Bass", Map.of ()).getDefaultTuning ().size ());
        assertEquals (Integer.valueOf (36), new ScorePart ("P1", "Drums", Map.of ()).getDefaultTuning ().get (0));
        assertEquals (9, new ScorePart ("P1", "Drums", Map.of ()).getDefaultTuning ().size ());
    }
}
