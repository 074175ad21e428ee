// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import de.mossgrabers.musicxmlconverter.INotifier;


/**
 * Base class for source and destination formats.
 *
 * @author Jürgen Moßgraber
 */
public abstract class AbstractCoreTask implements ICoreTask
{
    protected final INotifier notifier;
    private final String      name;


    /**
     * Constructor.
     *
     * @param name The name of the format
     * @param notifier The notifier
     */
    protected AbstractCoreTask (final String name, final INotifier notifier)
    {
        this.name = name;
        this.notifier = notifier;
    }


    /** {@inheritDoc} */
    @Override
    public String getName ()
    {
        return this.name;
    }
}
