// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.core.TextEventType;


/**
 * An articulation of a note after its' rule was applied to the notation element.
 *
 * @author Jürgen Moßgraber
 */
public class ResolvedArticulation
{
    /** The prefix which marks a text event as a label of a note. */
    public static final String  LABEL_PREFIX = "_";

    private final TextEventType type;
    private final String        symbol;
    private final boolean       replacesLabel;
    private final boolean       suppressesPrefix;


    /**
     * Constructor.
     *
     * @param type The kind of text event to create
     * @param symbol The symbol with the fret number already filled in
     * @param replacesLabel True if the symbol replaces the label of the note
     * @param suppressesPrefix True to not prefix the symbol
     */
    public ResolvedArticulation (final TextEventType type, final String symbol, final boolean replacesLabel, final boolean suppressesPrefix)
    {
        this.type = type;
        this.symbol = symbol;
        this.replacesLabel = replacesLabel;
        this.suppressesPrefix = suppressesPrefix;
    }


    /**
     * Get the kind of text event.
     *
     * @return The type
     */
    public TextEventType getType ()
    {
        return this.type;
    }


    /**
     * Get the symbol.
     *
     * @return The symbol
     */
    public String getSymbol ()
    {
        return this.symbol;
    }


    /**
     * Does the symbol replace the label of the note?
     *
     * @return True if it replaces the label
     */
    public boolean isReplacesLabel ()
    {
        return this.replacesLabel;
    }


    /**
     * Get the text to insert into the timeline.
     *
     * @return The symbol, prefixed if required
     */
    public String getText ()
    {
        return this.suppressesPrefix ? this.symbol : LABEL_PREFIX + this.symbol;
    }


    /** {@inheritDoc} */
    @Override
    public String toString ()
    {
        return this.type + " " + this.getText ();
    }
}
