// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.config;

import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;


/**
 * Shows the finger number of a fingering element. Falls back to the fret number if the element is
 * empty.
 *
 * @author Jürgen Moßgraber
 */
public class FingeringRule implements IArticulationRule
{
    /** {@inheritDoc} */
    @Override
    public TextEventType getType (final Node element)
    {
        return TextEventType.TEXT;
    }


    /** {@inheritDoc} */
    @Override
    public String getSymbol (final Node element)
    {
        final String finger = element.getText ().trim ();
        return finger.isEmpty () ? "%d" : finger;
    }


    /** {@inheritDoc} */
    @Override
    public boolean replacesLabel (final Node element)
    {
        return false;
    }


    /** {@inheritDoc} */
    @Override
    public boolean suppressesPrefix (final Node element)
    {
        return false;
    }
}
