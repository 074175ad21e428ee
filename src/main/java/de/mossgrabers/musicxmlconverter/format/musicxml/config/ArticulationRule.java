// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.config;

import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;


/**
 * An articulation rule with fixed values.
 *
 * @author Jürgen Moßgraber
 */
public class ArticulationRule implements IArticulationRule
{
    private final TextEventType type;
    private final String        symbol;
    private final boolean       replacesLabel;
    private final boolean       suppressesPrefix;


    /**
     * Constructor.
     *
     * @param type The kind of text event to create
     * @param symbol The symbol, %d is replaced by the fret number
     * @param replacesLabel True if the symbol replaces the label of the note
     * @param suppressesPrefix True to not prefix the symbol
     */
    public ArticulationRule (final TextEventType type, final String symbol, final boolean replacesLabel, final boolean suppressesPrefix)
    {
        this.type = type;
        this.symbol = symbol;
        this.replacesLabel = replacesLabel;
        this.suppressesPrefix = suppressesPrefix;
    }


    /**
     * Create a rule for an inline text.
     *
     * @param symbol The symbol
     * @return The rule
     */
    public static ArticulationRule text (final String symbol)
    {
        return new ArticulationRule (TextEventType.TEXT, symbol, false, false);
    }


    /**
     * Create a rule for a marker.
     *
     * @param symbol The symbol
     * @return The rule
     */
    public static ArticulationRule marker (final String symbol)
    {
        return new ArticulationRule (TextEventType.MARKER, symbol, false, false);
    }


    /**
     * Create a copy of the rule which replaces the label of the note.
     *
     * @return The new rule
     */
    public ArticulationRule replacingLabel ()
    {
        return new ArticulationRule (this.type, this.symbol, true, this.suppressesPrefix);
    }


    /**
     * Create a copy of the rule which does not prefix its' symbol.
     *
     * @return The new rule
     */
    public ArticulationRule withoutPrefix ()
    {
        return new ArticulationRule (this.type, this.symbol, this.replacesLabel, true);
    }


    /** {@inheritDoc} */
    @Override
    public TextEventType getType (final Node element)
    {
        return this.type;
    }


    /** {@inheritDoc} */
    @Override
    public String getSymbol (final Node element)
    {
        return this.symbol;
    }


    /** {@inheritDoc} */
    @Override
    public boolean replacesLabel (final Node element)
    {
        return this.replacesLabel;
    }


    /** {@inheritDoc} */
    @Override
    public boolean suppressesPrefix (final Node element)
    {
        return this.suppressesPrefix;
    }
}
