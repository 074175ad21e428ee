// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;


/**
 * All notes and text events of one staff of a part.
 *
 * @author Jürgen Moßgraber
 */
public class StaffTimeline
{
    private final String          partID;
    private final String          name;
    private final int             staffNumber;
    private final boolean         isPercussion;
    private final List<NoteEvent> notes;
    private final List<TextEvent> texts;
    private final List<Integer>   tuning;
    private final boolean         isTuningDeclared;


    /**
     * Constructor. Notes and text events are sorted by their position, events at the same
     * position keep their order.
     *
     * @param partID The ID of the part to which the staff belongs
     * @param name The display name
     * @param staffNumber The number of the staff in the part (1-based)
     * @param isPercussion True if it is a drum staff
     * @param notes The notes
     * @param texts The text events
     * @param tuning The MIDI notes of the open strings, lowest string first
     * @param isTuningDeclared True if the tuning was read from the document, false if it is a
     *            default
     */
    public StaffTimeline (final String partID, final String name, final int staffNumber, final boolean isPercussion, final List<NoteEvent> notes, final List<TextEvent> texts, final List<Integer> tuning, final boolean isTuningDeclared)
    {
        this.partID = partID;
        this.name = name;
        this.staffNumber = staffNumber;
        this.isPercussion = isPercussion;
        this.isTuningDeclared = isTuningDeclared;

        final List<NoteEvent> sortedNotes = new ArrayList<> (notes);
        sortedNotes.sort (Comparator.comparingLong (NoteEvent::getStart));
        this.notes = Collections.unmodifiableList (sortedNotes);

        final List<TextEvent> sortedTexts = new ArrayList<> (texts);
        sortedTexts.sort (Comparator.comparingLong (TextEvent::getPosition));
        this.texts = Collections.unmodifiableList (sortedTexts);

        this.tuning = List.copyOf (tuning);
    }


    /**
     * Get the ID of the part.
     *
     * @return The ID
     */
    public String getPartID ()
    {
        return this.partID;
    }


    /**
     * Get the display name.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Get the number of the staff in its' part.
     *
     * @return The number, starting with 1
     */
    public int getStaffNumber ()
    {
        return this.staffNumber;
    }


    /**
     * Is it a drum staff?
     *
     * @return True if the staff contains percussion
     */
    public boolean isPercussion ()
    {
        return this.isPercussion;
    }


    /**
     * Get the notes sorted by their start.
     *
     * @return The notes
     */
    public List<NoteEvent> getNotes ()
    {
        return this.notes;
    }


    /**
     * Get the text events sorted by their position.
     *
     * @return The text events
     */
    public List<TextEvent> getTexts ()
    {
        return this.texts;
    }


    /**
     * Get the tuning. For drum staves this is the pitch of each of the drum channels.
     *
     * @return The MIDI notes of the open strings, lowest string first
     */
    public List<Integer> getTuning ()
    {
        return this.tuning;
    }


    /**
     * Was the tuning declared in the document?
     *
     * @return True if declared, false if it is a default tuning
     */
    public boolean isTuningDeclared ()
    {
        return this.isTuningDeclared;
    }
}
