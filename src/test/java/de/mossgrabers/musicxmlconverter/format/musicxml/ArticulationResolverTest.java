// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.ArticulationRule;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.ConfigurationTables;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.MusicXmlParser;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;


class ArticulationResolverTest
{
    private final ArticulationResolver resolver = new ArticulationResolver (ConfigurationTables.createDefault ());


    @Test
    void resolvesInTraversalOrder () throws ParseException
    {
        final Node note = MusicXmlParser.parse ("""
                <note>
                  <notations>
                    <technical><hammer-on type="start">H</hammer-on><string>3</string><fret>5</fret></technical>
                    <articulations><accent/><staccato/></articulations>
                    <slide type="start"/>
                    <fermata/>
                    <vibrato/>
                  </notations>
                  <play><mute>palm</mute></play>
                </note>
                """);

        final List<ResolvedArticulation> result = this.resolver.resolve (note, 5);

        assertEquals (List.of ("_>", "_.", "_H", "_~", "P.M___"), texts (result));
        assertEquals (TextEventType.MARKER, result.get (4).getType ());
        assertTrue (result.stream ().noneMatch (ResolvedArticulation::isReplacesLabel));
    }


    @Test
    void fillsInTheFretNumber () throws ParseException
    {
        final Node note = MusicXmlParser.parse ("<note><notations><technical><harmonic><natural/></harmonic><string>2</string><fret>7</fret></technical></notations></note>");

        final List<ResolvedArticulation> result = this.resolver.resolve (note, 7);

        assertEquals (1, result.size ());
        assertEquals ("<7>", result.get (0).getSymbol ());
        assertEquals ("_<7>", result.get (0).getText ());
        assertTrue (result.get (0).isReplacesLabel ());
    }


    @Test
    void prefersFretOfTheHarmonic () throws ParseException
    {
        final Node note = MusicXmlParser.parse ("<note><notations><technical><artificial-harmonic><fret>12</fret></artificial-harmonic></technical></notations></note>");
        assertEquals ("<12>", this.resolver.resolve (note, 0).get (0).getSymbol ());
    }


    @Test
    void resolvesMuteVariants () throws ParseException
    {
        final Node straight = MusicXmlParser.parse ("<note><play><mute>straight</mute></play></note>");
        final ResolvedArticulation dead = this.resolver.resolve (straight, 3).get (0);
        assertEquals (TextEventType.TEXT, dead.getType ());
        assertEquals ("_x", dead.getText ());
        assertTrue (dead.isReplacesLabel ());

        final Node other = MusicXmlParser.parse ("<note><play><mute>on</mute></play></note>");
        final ResolvedArticulation mute = this.resolver.resolve (other, 3).get (0);
        assertEquals (TextEventType.MARKER, mute.getType ());
        assertEquals ("Mute", mute.getText ());
        assertFalse (mute.isReplacesLabel ());
    }


    @Test
    void keepsAllLabelReplacingCandidates () throws ParseException
    {
        final Node note = MusicXmlParser.parse ("<note><notations><technical><harmonic/></technical></notations><play><mute>straight</mute></play></note>");

        final List<ResolvedArticulation> result = this.resolver.resolve (note, 4);

        assertEquals (List.of ("_<4>", "_x"), texts (result));
        assertTrue (result.get (0).isReplacesLabel ());
    }


    @Test
    void usesTextOfFingering () throws ParseException
    {
        final Node note = MusicXmlParser.parse ("<note><notations><technical><fingering>2</fingering></technical></notations></note>");
        assertEquals (List.of ("_2"), texts (this.resolver.resolve (note, 9)));
    }


    @Test
    void resolvesSlides () throws ParseException
    {
        final Node note = MusicXmlParser.parse ("<note><notations><slide type=\"start\"/><glissando/><slide-up/></notations></note>");

        final List<Node> slides = ArticulationResolver.getSlides (note);
        assertEquals (2, slides.size ());

        final ResolvedArticulation slide = this.resolver.resolveSlide (slides.get (0), 5).orElseThrow ();
        assertEquals (TextEventType.MARKER, slide.getType ());
        assertEquals ("sl.", slide.getText ());
        assertEquals ("_/", this.resolver.resolveSlide (slides.get (1), 5).orElseThrow ().getText ());
    }


    @Test
    void usesInjectedRules () throws ParseException
    {
        final ConfigurationTables tables = new ConfigurationTables (Map.of ("accent", ArticulationRule.text ("A")), Map.of (), Map.of (), 0);
        final Node note = MusicXmlParser.parse ("<note><notations><articulations><accent/><staccato/></articulations></notations></note>");

        assertEquals (List.of ("_A"), texts (new ArticulationResolver (tables).resolve (note, 0)));
    }


    private static List<String> texts (final List<ResolvedArticulation> articulations)
    {
        final List<String> texts = new ArrayList<> ();
        for (final ResolvedArticulation articulation: articulations)
            texts.add (articulation.getText ());
        return texts;
    }
}
