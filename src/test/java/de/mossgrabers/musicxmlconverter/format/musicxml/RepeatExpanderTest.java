// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.musicxmlconverter.format.musicxml.model.MusicXmlParser;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;

import org.junit.jupiter.api.Test;

import java.text.ParseException;
import java.util.ArrayList;
import java.util.List;


class RepeatExpanderTest
{
    private static final String FORWARD_LEFT   = "<barline location=\"left\"><repeat direction=\"forward\"/></barline>";
    private static final String FORWARD_RIGHT  = "<barline location=\"right\"><repeat direction=\"forward\"/></barline>";
    private static final String BACKWARD       = "<barline location=\"right\"><repeat direction=\"backward\"/></barline>";
    private static final String BACKWARD_THREE = "<barline location=\"right\"><repeat direction=\"backward\" times=\"3\"/></barline>";


    @Test
    void keepsMeasuresWithoutRepeats () throws ParseException
    {
        final List<Node> measures = parseMeasures ("", "", "");
        final List<Node> expanded = new RepeatExpander ().expand (measures);
        assertEquals (measures, expanded);
    }


    @Test
    void repeatsWithDeclaredCount () throws ParseException
    {
        final List<Node> measures = parseMeasures (FORWARD_LEFT, "", BACKWARD_THREE);
        assertEquals (List.of ("1", "2", "3", "1", "2", "3", "1", "2", "3"), numbers (new RepeatExpander ().expand (measures)));
    }


    @Test
    void forwardRepeatAtTheEndOfAMeasureStartsWithTheNextMeasure () throws ParseException
    {
        final List<Node> measures = parseMeasures (FORWARD_RIGHT, "", BACKWARD);
        assertEquals (List.of ("1", "2", "3", "2", "3"), numbers (new RepeatExpander ().expand (measures)));
    }


    @Test
    void usesCountOfForwardRepeat () throws ParseException
    {
        final List<Node> measures = parseMeasures ("<barline location=\"left\"><repeat direction=\"forward\" times=\"3\"/></barline>", BACKWARD);
        assertEquals (List.of ("1", "2", "1", "2", "1", "2"), numbers (new RepeatExpander ().expand (measures)));
    }


    @Test
    void expandsInnerRepeatsFirst () throws ParseException
    {
        final List<Node> measures = parseMeasures (FORWARD_LEFT, FORWARD_LEFT, BACKWARD, BACKWARD);
        final List<String> inner = List.of ("1", "2", "3", "2", "3", "4");
        final List<String> expected = new ArrayList<> (inner);
        expected.addAll (inner);
        assertEquals (expected, numbers (new RepeatExpander ().expand (measures)));
    }


    @Test
    void closesAndOpensInTheSameMeasure () throws ParseException
    {
        final List<Node> measures = parseMeasures (FORWARD_LEFT, BACKWARD + FORWARD_RIGHT, BACKWARD);
        assertEquals (List.of ("1", "2", "1", "2", "3", "3"), numbers (new RepeatExpander ().expand (measures)));
    }


    @Test
    void ignoresBackwardRepeatWithoutForwardRepeat () throws ParseException
    {
        final List<Node> measures = parseMeasures ("", BACKWARD, "");
        final RepeatExpander expander = new RepeatExpander ();
        assertEquals (List.of ("1", "2", "3"), numbers (expander.expand (measures)));
        assertEquals (1, expander.getUnmatchedRepeats ());
    }


    @Test
    void limitsTheNumberOfPasses () throws ParseException
    {
        final List<Node> measures = parseMeasures (FORWARD_LEFT, "<barline location=\"right\"><repeat direction=\"backward\" times=\"200000\"/></barline>");
        final RepeatExpander expander = new RepeatExpander ();

        assertEquals (2 * RepeatExpander.MAX_REPEAT_COUNT, expander.expand (measures).size ());
        assertEquals (1, expander.getLimitedRepeats ());
    }


    @Test
    void limitsTheNumberOfMeasures () throws ParseException
    {
        // Three nested repeats with 30 passes each would create 27000 measures
        final String backward = "<barline location=\"right\"><repeat direction=\"backward\" times=\"30\"/></barline>";
        final List<Node> measures = parseMeasures (FORWARD_LEFT, FORWARD_LEFT, FORWARD_LEFT + backward, backward, backward);
        final RepeatExpander expander = new RepeatExpander ();

        final List<Node> expanded = expander.expand (measures);
        assertTrue (expanded.size () <= RepeatExpander.MAX_EXPANDED_MEASURES);
        assertEquals (1, expander.getLimitedRepeats ());
        assertEquals (0, expander.getUnmatchedRepeats ());
    }


    @Test
    void handlesEmptyPart ()
    {
        assertEquals (List.of (), new RepeatExpander ().expand (List.of ()));
    }


    /**
     * Creates a part with one measure for each given barline content. The measures are numbered
     * starting with 1.
     *
     * @param barlines The barlines of each measure
     * @return The measure nodes
     * @throws ParseException Could not parse the part
     */
    private static List<Node> parseMeasures (final String... barlines) throws ParseException
    {
        final StringBuilder part = new StringBuilder ("<part id=\"P1\">");
        for (int i = 0; i < barlines.length; i++)
            part.append ("<measure number=\"").append (i + 1).append ("\">").append (barlines[i]).append ("</measure>");
        part.append ("</part>");
        return MusicXmlParser.parse (part.toString ()).getChildNodes ("measure");
    }


    private static List<String> numbers (final List<Node> measures)
    {
        final List<String> numbers = new ArrayList<> ();
        for (final Node measure: measures)
            numbers.add (measure.getAttribute ("number").orElse ("?"));
        return numbers;
    }
}
