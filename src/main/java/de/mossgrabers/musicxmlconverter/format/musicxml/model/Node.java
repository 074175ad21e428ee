// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;


/**
 * An element in a MusicXML document. Keeps its attributes in document order and its child
 * elements interleaved with the text nodes found between them.
 *
 * @author Jürgen Moßgraber
 */
public class Node
{
    private final String              name;
    private final Map<String, String> attributes = new LinkedHashMap<> ();
    private final List<Node>          childNodes = new ArrayList<> ();


    /**
     * Constructor.
     *
     * @param name The name of the element
     */
    public Node (final String name)
    {
        this.name = name;
    }


    /**
     * Get the name of the element.
     *
     * @return The name
     */
    public String getName ()
    {
        return this.name;
    }


    /**
     * Is this a text node?
     *
     * @return True if it is a text node
     */
    public boolean isText ()
    {
        return false;
    }


    /**
     * Set an attribute. A second value for the same attribute replaces the first one.
     *
     * @param attributeName The name of the attribute
     * @param value The value
     */
    public void setAttribute (final String attributeName, final String value)
    {
        this.attributes.put (attributeName, value);
    }


    /**
     * Lookup an attribute.
     *
     * @param attributeName The name of the attribute
     * @return The value or empty if the attribute is not present
     */
    public Optional<String> getAttribute (final String attributeName)
    {
        return Optional.ofNullable (this.attributes.get (attributeName));
    }


    /**
     * Get all attributes in the order in which they appear in the document.
     *
     * @return The attributes
     */
    public Map<String, String> getAttributes ()
    {
        return Collections.unmodifiableMap (this.attributes);
    }


    /**
     * Add a child node to the element.
     *
     * @param node The node to add
     */
    public void addChildNode (final Node node)
    {
        this.childNodes.add (node);
    }


    /**
     * Get all child nodes of the element including the text nodes.
     *
     * @return The child nodes
     */
    public List<Node> getChildNodes ()
    {
        return Collections.unmodifiableList (this.childNodes);
    }


    /**
     * Lookup a child element with a certain name.
     *
     * @param childName The name of the element to look up
     * @return The first matching element or empty if not found
     */
    public Optional<Node> getChildNode (final String childName)
    {
        for (final Node childNode: this.childNodes)
        {
            if (!childNode.isText () && childName.equals (childNode.getName ()))
                return Optional.of (childNode);
        }
        return Optional.empty ();
    }


    /**
     * Lookup all child elements with a certain name.
     *
     * @param childName The name of the elements to look up
     * @return All matching elements, might be empty
     */
    public List<Node> getChildNodes (final String childName)
    {
        final List<Node> results = new ArrayList<> ();
        for (final Node childNode: this.childNodes)
        {
            if (!childNode.isText () && childName.equals (childNode.getName ()))
                results.add (childNode);
        }
        return results;
    }


    /**
     * Get the concatenated text of all direct text children.
     *
     * @return The text, empty if there is none
     */
    public String getText ()
    {
        final StringBuilder text = new StringBuilder ();
        for (final Node childNode: this.childNodes)
        {
            if (childNode instanceof final TextNode textNode)
                text.append (textNode.getContent ());
        }
        return text.toString ();
    }


    /**
     * Get the text of the first child element with the given name.
     *
     * @param childName The name of the child element
     * @return The text, empty if there is no such child
     */
    public String getChildText (final String childName)
    {
        final Optional<Node> child = this.getChildNode (childName);
        return child.isPresent () ? child.get ().getText () : "";
    }


    /**
     * Check if there is a child element with the given name.
     *
     * @param childName The name of the child element
     * @return True if present
     */
    public boolean hasChildNode (final String childName)
    {
        return this.getChildNode (childName).isPresent ();
    }
}
