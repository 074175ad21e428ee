// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.config;

import de.mossgrabers.musicxmlconverter.core.TextEventType;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;


/**
 * Describes how a notation element of a note (e.g. an accent or a hammer-on) is turned into a text
 * event. Each property can depend on the triggering element.
 *
 * @author Jürgen Moßgraber
 */
public interface IArticulationRule
{
    /**
     * Get the kind of text event to create.
     *
     * @param element The notation element
     * @return The type
     */
    TextEventType getType (Node element);


    /**
     * Get the symbol to display. A %d in the symbol is replaced by the fret number of the note.
     *
     * @param element The notation element
     * @return The symbol
     */
    String getSymbol (Node element);


    /**
     * Does the symbol replace the fret number (or drum name) label of the note?
     *
     * @param element The notation element
     * @return True if the label is replaced
     */
    boolean replacesLabel (Node element);


    /**
     * Should the symbol be inserted without the label prefix?
     *
     * @param element The notation element
     * @return True to not prefix the symbol
     */
    boolean suppressesPrefix (Node element);
}
