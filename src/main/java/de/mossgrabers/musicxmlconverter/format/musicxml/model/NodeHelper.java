// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.model;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;


/**
 * Helper functions to read numbers from nodes. Text which is not a number is treated like a
 * missing value.
 *
 * @author Jürgen Moßgraber
 */
public class NodeHelper
{
    /**
     * Private due to helper class.
     */
    private NodeHelper ()
    {
        // Intentionally empty
    }


    /**
     * Convert a text to a number.
     *
     * @param text The text, might be null
     * @return The number or empty if the text is not a number
     */
    public static OptionalDouble toDouble (final String text)
    {
        if (text == null)
            return OptionalDouble.empty ();
        final String trimmed = text.trim ();
        if (trimmed.isEmpty ())
            return OptionalDouble.empty ();
        try
        {
            final double value = Double.parseDouble (trimmed);
            return Double.isFinite (value) ? OptionalDouble.of (value) : OptionalDouble.empty ();
        }
        catch (final NumberFormatException ex)
        {
            return OptionalDouble.empty ();
        }
    }


    /**
     * Convert a text to an integer. Fractional values are rounded.
     *
     * @param text The text, might be null
     * @return The number or empty if the text is not a number
     */
    public static OptionalInt toInteger (final String text)
    {
        final OptionalDouble value = toDouble (text);
        return value.isPresent () ? OptionalInt.of ((int) Math.round (value.getAsDouble ())) : OptionalInt.empty ();
    }


    /**
     * Get the text of a node as a number.
     *
     * @param node The node
     * @return The number or empty
     */
    public static OptionalDouble getDouble (final Node node)
    {
        return toDouble (node.getText ());
    }


    /**
     * Get the text of the first child element with the given name as a number.
     *
     * @param node The parent node
     * @param childName The name of the child
     * @return The number or empty if there is no such child or it is not a number
     */
    public static OptionalDouble getChildDouble (final Node node, final String childName)
    {
        final Optional<Node> child = node.getChildNode (childName);
        return child.isPresent () ? getDouble (child.get ()) : OptionalDouble.empty ();
    }


    /**
     * Get the text of the first child element with the given name as an integer.
     *
     * @param node The parent node
     * @param childName The name of the child
     * @return The number or empty if there is no such child or it is not a number
     */
    public static OptionalInt getChildInteger (final Node node, final String childName)
    {
        return toInteger (node.getChildText (childName));
    }


    /**
     * Get the value of an attribute as an integer.
     *
     * @param node The node
     * @param attributeName The name of the attribute
     * @return The number or empty if the attribute is missing or not a number
     */
    public static OptionalInt getAttributeInteger (final Node node, final String attributeName)
    {
        final Optional<String> value = node.getAttribute (attributeName);
        return value.isPresent () ? toInteger (value.get ()) : OptionalInt.empty ();
    }


    /**
     * Get the value of an attribute as a number.
     *
     * @param node The node
     * @param attributeName The name of the attribute
     * @return The number or empty if the attribute is missing or not a number
     */
    public static OptionalDouble getAttributeDouble (final Node node, final String attributeName)
    {
        final Optional<String> value = node.getAttribute (attributeName);
        return value.isPresent () ? toDouble (value.get ()) : OptionalDouble.empty ();
    }
}
