// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.model;

/**
 * A text node between elements or the content of a CDATA section.
 *
 * @author Jürgen Moßgraber
 */
public class TextNode extends Node
{
    /** The name of all text nodes. Cannot clash with an element name. */
    public static final String TEXT_NAME = "#text";

    private final String       content;


    /**
     * Constructor.
     *
     * @param content The raw text
     */
    public TextNode (final String content)
    {
        super (TEXT_NAME);
        this.content = content;
    }


    /** {@inheritDoc} */
    @Override
    public boolean isText ()
    {
        return true;
    }


    /**
     * Get the text.
     *
     * @return The text
     */
    public String getContent ()
    {
        return this.content;
    }


    /** {@inheritDoc} */
    @Override
    public String getText ()
    {
        return this.content;
    }
}
