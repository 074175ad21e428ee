// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.config;

import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;


/**
 * The rule for the mute element of a play instruction. The text of the element selects the kind
 * of mute: a palm mute becomes a marker, a straight mute (dead note) replaces the fret number.
 *
 * @author Jürgen Moßgraber
 */
public class MuteRule implements IArticulationRule
{
    private static final String PALM     = "palm";
    private static final String STRAIGHT = "straight";


    /** {@inheritDoc} */
    @Override
    public TextEventType getType (final Node element)
    {
        return isStraight (element) ? TextEventType.TEXT : TextEventType.MARKER;
    }


    /** {@inheritDoc} */
    @Override
    public String getSymbol (final Node element)
    {
        final String variant = element.getText ().trim ();
        if (PALM.equals (variant))
            return "P.M___";
        if (STRAIGHT.equals (variant))
            return "_x";
        return "Mute";
    }


    /** {@inheritDoc} */
    @Override
    public boolean replacesLabel (final Node element)
    {
        return isStraight (element);
    }


    /** {@inheritDoc} */
    @Override
    public boolean suppressesPrefix (final Node element)
    {
        return true;
    }


    private static boolean isStraight (final Node element)
    {
        return STRAIGHT.equals (element.getText ().trim ());
    }
}
