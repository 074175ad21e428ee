// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.INotifier;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;


/**
 * Pairs the start and stop of slides on the same staff and string. The label of a slide is placed
 * at the note in which the slide ends.
 *
 * @author Jürgen Moßgraber
 */
public class SlideTracker
{
    private static final String              TYPE_START = "start";
    private static final String              TYPE_STOP  = "stop";

    private final Map<StringKey, PendingSlide> pending  = new LinkedHashMap<> ();


    /**
     * Process a slide notation of a note.
     *
     * @param staff The staff of the note
     * @param string The string of the note
     * @param slideType The value of the type attribute of the slide, may be null
     * @param tick The position of the note
     * @param slide The resolved slide notation
     * @return The articulation to place at the position of the note, empty if the slide starts
     *         here
     */
    public Optional<ResolvedArticulation> process (final int staff, final int string, final String slideType, final double tick, final ResolvedArticulation slide)
    {
        final StringKey key = new StringKey (staff, string);

        if (TYPE_START.equals (slideType))
        {
            // Move a replaced start to the end of the order
            this.pending.remove (key);
            this.pending.put (key, new PendingSlide (tick, slide));
            return Optional.empty ();
        }

        if (TYPE_STOP.equals (slideType))
        {
            final PendingSlide start = this.pending.remove (key);
            return Optional.of (start == null ? slide : start.slide);
        }

        // Continuations and slides without a type are placed where they are
        return Optional.of (slide);
    }


    /**
     * Get the number of slides which were started but not yet stopped.
     *
     * @return The number of open slides
     */
    public int getOpenSlides ()
    {
        return this.pending.size ();
    }


    /**
     * Log each slide which was started but never stopped with the position of its start.
     *
     * @param notifier Where to log
     * @param partName The name of the part to which the slides belong
     */
    public void reportOpenSlides (final INotifier notifier, final String partName)
    {
        for (final Map.Entry<StringKey, PendingSlide> entry: this.pending.entrySet ())
        {
            final StringKey key = entry.getKey ();
            final PendingSlide start = entry.getValue ();
            notifier.log ("IDS_NOTIFY_OPEN_SLIDE", start.slide.getSymbol (), partName, Integer.toString (key.staff), Integer.toString (key.string), Long.toString (Math.round (start.tick)));
        }
    }


    private static class PendingSlide
    {
        final double               tick;
        final ResolvedArticulation slide;


        PendingSlide (final double tick, final ResolvedArticulation slide)
        {
            this.tick = tick;
            this.slide = slide;
        }
    }


    private static class StringKey
    {
        final int staff;
        final int string;


        StringKey (final int staff, final int string)
        {
            this.staff = staff;
            this.string = string;
        }


        /** {@inheritDoc} */
        @Override
        public int hashCode ()
        {
            return 31 * this.staff + this.string;
        }


        /** {@inheritDoc} */
        @Override
        public boolean equals (final Object obj)
        {
            if (this == obj)
                return true;
            if (!(obj instanceof final StringKey other))
                return false;
            return this.staff == other.staff && this.string == other.string;
        }
    }
}
