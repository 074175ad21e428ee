// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.NodeHelper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;


/**
 * Unfolds the repeat barlines of a part into a linear list of measures. The measure nodes are not
 * copied, a node is simply contained several times in the result.
 *
 * @author Jürgen Moßgraber
 */
public class RepeatExpander
{
    /** The number of passes if a repeat does not declare it. */
    public static final int  DEFAULT_REPEAT_COUNT  = 2;
    /** The maximum number of passes of a single repeat. */
    public static final int  MAX_REPEAT_COUNT      = 32;
    /** The maximum number of measures after expansion. */
    public static final int  MAX_EXPANDED_MEASURES = 10000;

    private int              unmatchedRepeats;
    private int              limitedRepeats;


    /**
     * Expands the repeats of the given measures. Nested repeats are expanded first. A backward
     * repeat without an opening forward repeat is ignored.
     *
     * @param measures The measures of a part in document order
     * @return The measures in playback order
     */
    public List<Node> expand (final List<Node> measures)
    {
        return this.expand (measures, false);
    }


    /**
     * Expands the repeats of the given measures.
     *
     * @param measures The measures
     * @param isSection True if the measures are the content of a repeat which is currently
     *            expanded, the repeat barlines which enclose the section are then skipped
     * @return The measures in playback order
     */
    private List<Node> expand (final List<Node> measures, final boolean isSection)
    {
        final int last = measures.size () - 1;
        final List<Node> expanded = new ArrayList<> ();
        final Deque<RepeatStart> openRepeats = new ArrayDeque<> ();

        for (int i = 0; i < measures.size (); i++)
        {
            final Node measure = measures.get (i);
            expanded.add (measure);

            // A forward repeat on the left side opens the repeat with this measure
            final Optional<Node> forward = findRepeat (measure, "forward");
            final boolean isLeftForward = forward.isPresent () && isLeft (forward.get ());
            if (isLeftForward && !(isSection && i == 0))
                openRepeats.push (new RepeatStart (i, getTimes (forward.get ())));

            final Optional<Node> backward = isSection && i == last ? Optional.empty () : findRepeat (measure, "backward");
            if (backward.isPresent ())
            {
                if (openRepeats.isEmpty ())
                    this.unmatchedRepeats++;
                else
                {
                    final RepeatStart start = openRepeats.pop ();
                    int passes = getTimes (backward.get ()).orElse (start.times.orElse (DEFAULT_REPEAT_COUNT));
                    final List<Node> section = this.expand (measures.subList (start.index, i + 1), true);
                    if (passes > MAX_REPEAT_COUNT || expanded.size () + (passes - 1L) * section.size () > MAX_EXPANDED_MEASURES)
                    {
                        this.limitedRepeats++;
                        passes = Math.min (passes, MAX_REPEAT_COUNT);
                    }
                    for (int pass = 1; pass < passes && expanded.size () + section.size () <= MAX_EXPANDED_MEASURES; pass++)
                        expanded.addAll (section);
                }
            }

            if (forward.isPresent () && !isLeftForward)
                openRepeats.push (new RepeatStart (i + 1, getTimes (forward.get ())));
        }

        return expanded;
    }


    /**
     * Get the number of backward repeats which had no matching forward repeat, summed over all
     * calls of expand.
     *
     * @return The number of ignored repeats
     */
    public int getUnmatchedRepeats ()
    {
        return this.unmatchedRepeats;
    }


    /**
     * Get the number of repeats which were played less often than declared since they exceeded
     * the maximum number of passes or the maximum number of measures, summed over all calls of
     * expand.
     *
     * @return The number of limited repeats
     */
    public int getLimitedRepeats ()
    {
        return this.limitedRepeats;
    }


    /**
     * Find the first repeat element with the given direction in the barlines of a measure.
     *
     * @param measure The measure
     * @param direction The direction, 'forward' or 'backward'
     * @return The barline which contains the repeat element
     */
    private static Optional<Node> findRepeat (final Node measure, final String direction)
    {
        for (final Node barline: measure.getChildNodes ("barline"))
        {
            final Optional<Node> repeat = barline.getChildNode ("repeat");
            if (repeat.isPresent () && direction.equals (repeat.get ().getAttribute ("direction").orElse (null)))
                return Optional.of (barline);
        }
        return Optional.empty ();
    }


    private static boolean isLeft (final Node barline)
    {
        return "left".equals (barline.getAttribute ("location").orElse (null));
    }


    private static OptionalInt getTimes (final Node barline)
    {
        final Optional<Node> repeat = barline.getChildNode ("repeat");
        if (repeat.isEmpty ())
            return OptionalInt.empty ();
        final OptionalInt times = NodeHelper.getAttributeInteger (repeat.get (), "times");
        return times.isPresent () && times.getAsInt () > 0 ? times : OptionalInt.empty ();
    }


    /** An opened repeat. */
    private static class RepeatStart
    {
        final int         index;
        final OptionalInt times;


        RepeatStart (final int index, final OptionalInt times)
        {
            this.index = index;
            this.times = times;
        }
    }
}
