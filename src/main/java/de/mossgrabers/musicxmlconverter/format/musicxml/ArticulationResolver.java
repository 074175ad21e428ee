// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.format.musicxml.config.ConfigurationTables;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.IArticulationRule;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.NodeHelper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;


/**
 * Creates the articulation events of a note by applying the articulation rules to the notations
 * and play instructions of the note.
 *
 * @author Jürgen Moßgraber
 */
public class ArticulationResolver
{
    private static final Set<String>  SLIDE_NAMES       = Set.of ("slide", "slide-up", "slide-down");
    private static final Set<String>  GROUP_NAMES       = Set.of ("articulations", "technical");
    private static final String       FRET_PLACEHOLDER  = "%d";

    private final ConfigurationTables tables;


    /**
     * Constructor.
     *
     * @param tables The tables which contain the articulation rules
     */
    public ArticulationResolver (final ConfigurationTables tables)
    {
        this.tables = tables;
    }


    /**
     * Resolves all articulations of a note except slides. The order is: the children of
     * articulations, the children of technical, all other notations and finally the mute play
     * instructions.
     *
     * @param note The note element
     * @param fret The fret number to fill into the symbols
     * @return The resolved articulations in that order
     */
    public List<ResolvedArticulation> resolve (final Node note, final int fret)
    {
        final List<ResolvedArticulation> result = new ArrayList<> ();

        final List<Node> notationsList = note.getChildNodes ("notations");
        for (final Node notations: notationsList)
            notations.getChildNode ("articulations").ifPresent (articulations -> this.resolveChildren (articulations, fret, result));
        for (final Node notations: notationsList)
            notations.getChildNode ("technical").ifPresent (technical -> this.resolveChildren (technical, fret, result));

        for (final Node notations: notationsList)
        {
            for (final Node child: notations.getChildNodes ())
            {
                if (!child.isText () && !GROUP_NAMES.contains (child.getName ()) && !isSlide (child))
                    this.resolveElement (child, fret).ifPresent (result::add);
            }
        }

        final Optional<Node> play = note.getChildNode ("play");
        if (play.isPresent ())
        {
            for (final Node mute: play.get ().getChildNodes ("mute"))
                this.resolveElement (mute, fret).ifPresent (result::add);
        }

        return result;
    }


    /**
     * Resolves a slide notation.
     *
     * @param slide The slide element
     * @param fret The fret number to fill into the symbol
     * @return The resolved slide or empty if there is no rule for it
     */
    public Optional<ResolvedArticulation> resolveSlide (final Node slide, final int fret)
    {
        return this.resolveElement (slide, fret);
    }


    /**
     * Get all slide notations of a note.
     *
     * @param note The note element
     * @return The slide elements in document order
     */
    public static List<Node> getSlides (final Node note)
    {
        final List<Node> slides = new ArrayList<> ();
        for (final Node notations: note.getChildNodes ("notations"))
        {
            for (final Node child: notations.getChildNodes ())
            {
                if (isSlide (child))
                    slides.add (child);
            }
        }
        return slides;
    }


    /**
     * Is the element one of the slide notations?
     *
     * @param element The element
     * @return True if it is a slide
     */
    public static boolean isSlide (final Node element)
    {
        return !element.isText () && SLIDE_NAMES.contains (element.getName ());
    }


    private void resolveChildren (final Node group, final int fret, final List<ResolvedArticulation> result)
    {
        for (final Node child: group.getChildNodes ())
        {
            if (!child.isText ())
                this.resolveElement (child, fret).ifPresent (result::add);
        }
    }


    private Optional<ResolvedArticulation> resolveElement (final Node element, final int fret)
    {
        final Optional<IArticulationRule> ruleOpt = this.tables.getArticulationRule (element.getName ());
        if (ruleOpt.isEmpty ())
            return Optional.empty ();

        final IArticulationRule rule = ruleOpt.get ();
        int symbolFret = fret;
        if (element.getName ().contains ("harmonic"))
        {
            final OptionalInt harmonicFret = NodeHelper.getChildInteger (element, "fret");
            if (harmonicFret.isPresent ())
                symbolFret = harmonicFret.getAsInt ();
        }

        final String symbol = rule.getSymbol (element).replace (FRET_PLACEHOLDER, Integer.toString (symbolFret));
        return Optional.of (new ResolvedArticulation (rule.getType (element), symbol, rule.replacesLabel (element), rule.suppressesPrefix (element)));
    }
}
