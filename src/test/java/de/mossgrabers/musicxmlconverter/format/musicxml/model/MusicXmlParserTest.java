// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.List;
import java.util.Map;


class MusicXmlParserTest
{
    private static final String DOCUMENT = """
            <?xml version="1.0" encoding="UTF-8" standalone="no"?>
            <!DOCTYPE score-partwise PUBLIC "-//Recordare//DTD MusicXML 4.0 Partwise//EN" "http://www.musicxml.org/dtds/partwise.dtd">
            <score-partwise version="4.0">
              <!-- Exported by a notation program -->
              <part-list>
                <score-part id="P1"><part-name>Guitar</part-name></score-part>
              </part-list>
              <part id="P1">
                <measure number="1">
                  <note><pitch><step>E</step><octave>2</octave></pitch><duration>4</duration></note>
                </measure>
                <measure number="2"/>
              </part>
            </score-partwise>
            """;


    @Test
    void parsesElementsAttributesAndText () throws ParseException
    {
        final Node root = MusicXmlParser.parse (DOCUMENT);

        assertEquals ("score-partwise", root.getName ());
        assertEquals ("4.0", root.getAttribute ("version").orElse (null));
        assertEquals (2, root.getChildNodes ().size (), "Comments and whitespace must not create nodes");

        final Node part = root.getChildNode ("part").orElseThrow ();
        assertEquals ("P1", part.getAttribute ("id").orElse (null));

        final List<Node> measures = part.getChildNodes ("measure");
        assertEquals (2, measures.size ());
        assertEquals ("2", measures.get (1).getAttribute ("number").orElse (null));
        assertTrue (measures.get (1).getChildNodes ().isEmpty ());

        final Node pitch = measures.get (0).getChildNode ("note").orElseThrow ().getChildNode ("pitch").orElseThrow ();
        assertEquals ("E", pitch.getChildText ("step"));
        assertEquals ("Guitar", root.getChildNode ("part-list").orElseThrow ().getChildNode ("score-part").orElseThrow ().getChildText ("part-name"));
    }


    @Test
    void keepsAttributeOrder () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("<note default-x=\"10\" color=\"#FF0000\" print-object=\"no\"/>");

        final Map<String, String> attributes = root.getAttributes ();
        assertEquals (List.of ("default-x", "color", "print-object"), List.copyOf (attributes.keySet ()));
    }


    @Test
    void capturesCharacterData () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("<words><![CDATA[Verse <1> & more]]></words>");
        assertEquals ("Verse <1> & more", root.getText ());
    }


    @Test
    void decodesEntities () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("<words font=\"A &amp; B\">1 &lt; 2 &#65;&#x42;</words>");

        assertEquals ("A & B", root.getAttribute ("font").orElse (null));
        assertEquals ("1 < 2 AB", root.getText ());
        assertEquals ("&unknown;", MusicXmlParser.decodeEntities ("&unknown;"));
    }


    @Test
    void allowsGreaterThanInsideOfAttributeValues () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("<direction><words text=\"a > b\">x</words><sound tempo=\"90\"/></direction>");

        assertEquals (2, root.getChildNodes ().size ());
        assertEquals ("a > b", root.getChildNode ("words").orElseThrow ().getAttribute ("text").orElse (null));
        assertEquals ("90", root.getChildNode ("sound").orElseThrow ().getAttribute ("tempo").orElse (null));
    }


    @Test
    void skipsMalformedTags () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("<measure><1bad/><note>x</note><= ></measure>");

        assertEquals ("measure", root.getName ());
        assertEquals (1, root.getChildNodes ().size ());
        assertEquals ("x", root.getChildText ("note"));
    }


    @Test
    void closesUnterminatedElements () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("<score-partwise><part id=\"P1\"><measure number=\"1\"/>");

        assertEquals ("score-partwise", root.getName ());
        final Node part = root.getChildNode ("part").orElseThrow ();
        assertEquals (1, part.getChildNodes ("measure").size ());
    }


    @Test
    void ignoresClosingTagsWithoutOpenElement () throws ParseException
    {
        final Node root = MusicXmlParser.parse ("</stray><root><child/></root>");

        assertEquals ("root", root.getName ());
        assertTrue (root.hasChildNode ("child"));
    }


    @Test
    void failsWithoutRootElement ()
    {
        assertThrows (ParseException.class, () -> MusicXmlParser.parse (""));
        assertThrows (ParseException.class, () -> MusicXmlParser.parse ("   \n  "));
        assertThrows (ParseException.class, () -> MusicXmlParser.parse ("just some text"));
        assertThrows (ParseException.class, () -> MusicXmlParser.parse ("<?xml version=\"1.0\"?><!-- nothing -->"));
    }


    @Test
    void parsingTwiceCreatesIdenticalTrees () throws ParseException
    {
        assertEquals (describe (MusicXmlParser.parse (DOCUMENT)), describe (MusicXmlParser.parse (DOCUMENT)));
    }


    private static String describe (final Node node)
    {
        if (node instanceof final TextNode textNode)
            return "'" + textNode.getContent () + "'";

        final StringBuilder sb = new StringBuilder (node.getName ()).append (node.getAttributes ()).append ('[');
        for (final Node child: node.getChildNodes ())
            sb.append (describe (child)).append (',');
        return sb.append (']').toString ();
    }
}
