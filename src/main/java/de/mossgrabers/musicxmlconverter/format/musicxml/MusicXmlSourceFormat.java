// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.format.musicxml;

import de.mossgrabers.musicxmlconverter.Functions;
import de.mossgrabers.musicxmlconverter.INotifier;
import de.mossgrabers.musicxmlconverter.core.AbstractCoreTask;
import de.mossgrabers.musicxmlconverter.core.ISourceFormat;
import de.mossgrabers.musicxmlconverter.core.TimelineContainer;
import de.mossgrabers.musicxmlconverter.format.musicxml.config.ConfigurationTables;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.MusicXmlParser;
import de.mossgrabers.musicxmlconverter.format.musicxml.model.Node;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.text.ParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;


/**
 * The MusicXML source format. Reads uncompressed MusicXML files (score-partwise).
 *
 * @author Jürgen Moßgraber
 */
public class MusicXmlSourceFormat extends AbstractCoreTask implements ISourceFormat
{
    private static final String[]     FILE_ENDINGS = { ".xml", ".musicxml" };
    private static final char         BOM          = '\uFEFF';
    private static final Pattern      ENCODING     = Pattern.compile ("<\\?xml[^>]*?encoding\\s*=\\s*[\"']([A-Za-z0-9._:-]+)[\"']");
    private static final int          HEADER_SIZE  = 256;

    private final ImportSettings      settings;
    private final ConfigurationTables tables;


    /**
     * Constructor. Uses the default settings and tables.
     *
     * @param notifier The notifier
     */
    public MusicXmlSourceFormat (final INotifier notifier)
    {
        this (notifier, ImportSettings.createDefault (), ConfigurationTables.createDefault ());
    }


    /**
     * Constructor.
     *
     * @param notifier The notifier
     * @param settings The import settings
     * @param tables The configuration tables
     */
    public MusicXmlSourceFormat (final INotifier notifier, final ImportSettings settings, final ConfigurationTables tables)
    {
        super ("MusicXML", notifier);

        this.settings = settings;
        this.tables = tables;
    }


    /** {@inheritDoc} */
    @Override
    public boolean supports (final File sourceFile)
    {
        final String name = sourceFile.getName ().toLowerCase (Locale.ROOT);
        for (final String ending: FILE_ENDINGS)
        {
            if (name.endsWith (ending))
                return true;
        }
        return false;
    }


    /** {@inheritDoc} */
    @Override
    public TimelineContainer read (final File sourceFile) throws IOException, ParseException
    {
        final byte [] content = Files.readAllBytes (sourceFile.toPath ());
        if (content.length == 0)
            throw new IOException ("The file is empty: " + sourceFile.getAbsolutePath ());
        return this.read (Functions.getNameWithoutType (sourceFile), decode (content));
    }


    /**
     * Converts the text of a MusicXML document.
     *
     * @param name The name for the result
     * @param content The text of the document
     * @return The timelines
     * @throws ParseException The document could not be parsed
     */
    public TimelineContainer read (final String name, final String content) throws ParseException
    {
        String text = content;
        if (!text.isEmpty () && text.charAt (0) == BOM)
            text = text.substring (1);

        final Node root = MusicXmlParser.parse (text);
        final TimelineSynthesizer synthesizer = new TimelineSynthesizer (this.tables, this.settings, this.notifier);
        final TimelineContainer container = synthesizer.synthesize (name, root);
        this.notifier.log ("IDS_NOTIFY_STAVES_CREATED", Integer.toString (container.getStaffTimelines ().size ()), Integer.toString (container.getTempoMarkers ().size ()), Integer.toString (container.getRegions ().size ()));
        return container;
    }


    /**
     * Decodes the content of a file. A byte order mark selects UTF-8 or UTF-16, otherwise the
     * encoding of the XML declaration is used. Without both the content is read as UTF-8.
     *
     * @param content The content of the file
     * @return The text
     * @throws IOException The declared encoding is not supported
     */
    static String decode (final byte [] content) throws IOException
    {
        if (content.length >= 2)
        {
            final int first = content[0] & 0xFF;
            final int second = content[1] & 0xFF;
            if (first == 0xFE && second == 0xFF)
                return new String (content, 2, content.length - 2, StandardCharsets.UTF_16BE);
            if (first == 0xFF && second == 0xFE)
                return new String (content, 2, content.length - 2, StandardCharsets.UTF_16LE);
        }

        // The declaration only contains ASCII characters
        final String header = new String (content, 0, Math.min (content.length, HEADER_SIZE), StandardCharsets.ISO_8859_1);
        final Matcher matcher = ENCODING.matcher (header);
        if (!matcher.find ())
            return new String (content, StandardCharsets.UTF_8);

        final String encoding = matcher.group (1);
        try
        {
            return new String (content, Charset.forName (encoding));
        }
        catch (final IllegalArgumentException ex)
        {
            throw new IOException ("Unsupported encoding: " + encoding, ex);
        }
    }
}
