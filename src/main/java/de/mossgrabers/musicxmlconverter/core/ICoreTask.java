// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

/**
 * Base interface for source and destination formats.
 *
 * @author Jürgen Moßgraber
 */
public interface ICoreTask
{
    /**
     * Get the name of the format.
     *
     * @return The name
     */
    String getName ();
}
