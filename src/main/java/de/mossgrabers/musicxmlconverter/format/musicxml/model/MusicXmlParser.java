// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml.model;

import java.text.ParseException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * A tolerant parser for (uncompressed) MusicXML documents. Reads the text in one pass and keeps
 * the open elements on a stack. Declarations, DOCTYPE blocks, processing instructions and comments
 * are dropped. Malformed tags are skipped instead of failing the whole document.
 *
 * @author Jürgen Moßgraber
 */
public class MusicXmlParser
{
    private static final Pattern TAG_PATTERN       = Pattern.compile ("([A-Za-z_:][^\\s/>]*)(.*)", Pattern.DOTALL);
    private static final Pattern ATTRIBUTE_PATTERN = Pattern.compile ("([\\w:.\\-]+)\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern ENTITY_PATTERN    = Pattern.compile ("&(#[0-9]+|#x[0-9a-fA-F]+|lt|gt|amp|quot|apos);");

    private static final String  CDATA_START       = "<![CDATA[";
    private static final String  CDATA_END         = "]]>";
    private static final String  COMMENT_START     = "<!--";
    private static final String  COMMENT_END       = "-->";
    private static final String  PI_START          = "<?";
    private static final String  PI_END            = "?>";


    /**
     * Constructor.
     */
    private MusicXmlParser ()
    {
        // Intentionally empty
    }


    /**
     * Parses the text of a MusicXML document into a tree of nodes.
     *
     * @param content The full text of the document
     * @return The root element
     * @throws ParseException The document is empty or contains no element at all
     */
    public static Node parse (final String content) throws ParseException
    {
        if (content == null || content.isBlank ())
            throw new ParseException ("The document is empty.", 0);

        final Deque<Node> stack = new ArrayDeque<> ();
        Node root = null;

        final int length = content.length ();
        int position = 0;
        while (position < length)
        {
            if (content.charAt (position) != '<')
            {
                int end = content.indexOf ('<', position);
                if (end < 0)
                    end = length;
                final String text = content.substring (position, end);
                if (!text.isBlank ())
                    addText (stack, decodeEntities (text));
                position = end;
                continue;
            }

            // Declaration or processing instruction
            if (content.startsWith (PI_START, position))
            {
                position = skipPast (content, PI_END, position + PI_START.length ());
                continue;
            }

            if (content.startsWith (COMMENT_START, position))
            {
                position = skipPast (content, COMMENT_END, position + COMMENT_START.length ());
                continue;
            }

            if (content.startsWith (CDATA_START, position))
            {
                final int start = position + CDATA_START.length ();
                int end = content.indexOf (CDATA_END, start);
                if (end < 0)
                    end = length;
                addText (stack, content.substring (start, end));
                position = Math.min (length, end + CDATA_END.length ());
                continue;
            }

            // DOCTYPE and other declarations
            if (content.startsWith ("<!", position))
            {
                position = skipDeclaration (content, position);
                continue;
            }

            // Closing tag
            if (content.startsWith ("</", position))
            {
                final int end = content.indexOf ('>', position);
                if (end < 0)
                    break;
                position = end + 1;

                // A closing tag without an open element is ignored
                if (stack.isEmpty ())
                    continue;
                final Node node = stack.pop ();
                if (stack.isEmpty ())
                    root = node;
                else
                    stack.peek ().addChildNode (node);
                continue;
            }

            // Opening or self-closing tag
            final int end = findTagEnd (content, position + 1);
            if (end < 0)
            {
                // Unbalanced quotes, skip to the next '>'
                final int next = content.indexOf ('>', position + 1);
                if (next < 0)
                    break;
                position = next + 1;
                continue;
            }

            String tagContent = content.substring (position + 1, end);
            position = end + 1;

            final boolean isSelfClosing = tagContent.endsWith ("/");
            if (isSelfClosing)
                tagContent = tagContent.substring (0, tagContent.length () - 1);

            final Matcher tagMatcher = TAG_PATTERN.matcher (tagContent);
            if (!tagMatcher.matches ())
                continue;

            final Node node = new Node (tagMatcher.group (1));
            parseAttributes (node, tagMatcher.group (2));

            if (!isSelfClosing)
                stack.push (node);
            else if (stack.isEmpty ())
                root = node;
            else
                stack.peek ().addChildNode (node);
        }

        // Close elements which were never closed (e.g. truncated document)
        while (!stack.isEmpty ())
        {
            final Node node = stack.pop ();
            if (!stack.isEmpty ())
                stack.peek ().addChildNode (node);
            else if (root == null)
                root = node;
        }

        if (root == null)
            throw new ParseException ("No root element found.", position);
        return root;
    }


    /**
     * Adds a text node to the element on top of the stack. Text outside of the root element is
     * dropped.
     *
     * @param stack The stack of open elements
     * @param text The text to add
     */
    private static void addText (final Deque<Node> stack, final String text)
    {
        if (!stack.isEmpty ())
            stack.peek ().addChildNode (new TextNode (text));
    }


    /**
     * Extracts all name="value" pairs from the attribute part of a tag.
     *
     * @param node The node to which to add the attributes
     * @param attributeText The text after the tag name
     */
    private static void parseAttributes (final Node node, final String attributeText)
    {
        if (attributeText.isBlank ())
            return;
        final Matcher matcher = ATTRIBUTE_PATTERN.matcher (attributeText);
        while (matcher.find ())
            node.setAttribute (matcher.group (1), decodeEntities (matcher.group (2)));
    }


    /**
     * Find the end of a tag. A '>' inside of a double-quoted attribute value does not end the tag.
     *
     * @param content The document text
     * @param start The position after the '<'
     * @return The position of the closing '>' or -1 if there is none
     */
    private static int findTagEnd (final String content, final int start)
    {
        boolean inQuotes = false;
        for (int i = start; i < content.length (); i++)
        {
            final char c = content.charAt (i);
            if (c == '"')
                inQuotes = !inQuotes;
            else if (c == '>' && !inQuotes)
                return i;
        }
        return -1;
    }


    /**
     * Skips a declaration like DOCTYPE. Nested brackets of an internal subset are counted.
     *
     * @param content The document text
     * @param start The position of the '<'
     * @return The position after the declaration
     */
    private static int skipDeclaration (final String content, final int start)
    {
        int level = 0;
        for (int i = start; i < content.length (); i++)
        {
            final char c = content.charAt (i);
            if (c == '<')
                level++;
            else if (c == '>')
            {
                level--;
                if (level == 0)
                    return i + 1;
            }
        }
        return content.length ();
    }


    private static int skipPast (final String content, final String end, final int start)
    {
        final int pos = content.indexOf (end, start);
        return pos < 0 ? content.length () : pos + end.length ();
    }


    /**
     * Replaces the predefined XML entities and numeric character references.
     *
     * @param text The text
     * @return The decoded text
     */
    static String decodeEntities (final String text)
    {
        if (text.indexOf ('&') < 0)
            return text;

        final Matcher matcher = ENTITY_PATTERN.matcher (text);
        final StringBuilder result = new StringBuilder ();
        while (matcher.find ())
        {
            final String entity = matcher.group (1);
            final String replacement;
            switch (entity)
            {
                case "lt":
                    replacement = "<";
                    break;
                case "gt":
                    replacement = ">";
                    break;
                case "amp":
                    replacement = "&";
                    break;
                case "quot":
                    replacement = "\"";
                    break;
                case "apos":
                    replacement = "'";
                    break;
                default:
                    replacement = decodeCharacterReference (entity, matcher.group ());
                    break;
            }
            matcher.appendReplacement (result, Matcher.quoteReplacement (replacement));
        }
        matcher.appendTail (result);
        return result.toString ();
    }


    private static String decodeCharacterReference (final String entity, final String original)
    {
        try
        {
            final int codePoint = entity.startsWith ("#x") ? Integer.parseInt (entity.substring (2), 16) : Integer.parseInt (entity.substring (1));
            return Character.isValidCodePoint (codePoint) ? new String (Character.toChars (codePoint)) : original;
        }
        catch (final NumberFormatException ex)
        {
            // Too large for an integer
            return original;
        }
    }
}
