// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2025
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.musicxmlconverter.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.mossgrabers.musicxmlconverter.INotifier;
import de.mossgrabers.musicxmlconverter.RecordingNotifier;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.io.IOException;
import java.text.ParseException;
import java.util.List;


class ConversionTaskTest
{
    private static final File       SOURCE   = new File ("Song.xml");
    private static final File       OUTPUT   = new File ("Song.timeline.json");

    private final RecordingNotifier notifier = new RecordingNotifier ();


    @Test
    void convertsTheFile ()
    {
        final TimelineContainer container = new TimelineContainer ("Song");
        final RecordingDestination destination = new RecordingDestination (this.notifier, false);
        final ConversionTask task = new ConversionTask (SOURCE, OUTPUT, new FixedSource (this.notifier, container, null), destination, this.notifier);

        assertTrue (task.call ().booleanValue ());
        assertSame (container, destination.written);
        assertSame (OUTPUT, destination.outputFile);
        assertEquals (List.of ("IDS_NOTIFY_PARSING_FILE", "IDS_NOTIFY_WRITING_FILE", "IDS_NOTIFY_CONVERSION_FINISHED"), this.notifier.getMessages ());
        assertTrue (this.notifier.getErrors ().isEmpty ());
    }


    @Test
    void reportsReadErrors ()
    {
        final RecordingDestination destination = new RecordingDestination (this.notifier, false);
        final ConversionTask task = new ConversionTask (SOURCE, OUTPUT, new FixedSource (this.notifier, null, new IOException ("Locked")), destination, this.notifier);

        assertFalse (task.call ().booleanValue ());
        assertEquals (List.of ("IDS_NOTIFY_COULD_NOT_READ"), this.notifier.getErrors ());
        assertNull (destination.written);
    }


    @Test
    void reportsParseErrors ()
    {
        final ConversionTask task = new ConversionTask (SOURCE, OUTPUT, new FixedSource (this.notifier, null, new ParseException ("No root", 0)), new RecordingDestination (this.notifier, false), this.notifier);

        assertFalse (task.call ().booleanValue ());
        assertEquals (List.of ("IDS_NOTIFY_COULD_NOT_PARSE"), this.notifier.getErrors ());
        assertFalse (this.notifier.getMessages ().contains ("IDS_NOTIFY_WRITING_FILE"));
    }


    @Test
    void reportsWriteErrors ()
    {
        final ConversionTask task = new ConversionTask (SOURCE, OUTPUT, new FixedSource (this.notifier, new TimelineContainer ("Song"), null), new RecordingDestination (this.notifier, true), this.notifier);

        assertFalse (task.call ().booleanValue ());
        assertEquals (List.of ("IDS_NOTIFY_COULD_NOT_WRITE_FILE"), this.notifier.getErrors ());
        assertFalse (this.notifier.getMessages ().contains ("IDS_NOTIFY_CONVERSION_FINISHED"));
    }


    /** Returns a fixed result or throws a fixed exception. */
    private static class FixedSource extends AbstractCoreTask implements ISourceFormat
    {
        private final TimelineContainer container;
        private final Exception         exception;


        FixedSource (final INotifier notifier, final TimelineContainer container, final Exception exception)
        {
            super ("Fixed", notifier);

            this.container = container;
            this.exception = exception;
        }


        /** {@inheritDoc} */
        @Override
        public TimelineContainer read (final File sourceFile) throws IOException, ParseException
        {
            if (this.exception instanceof final IOException ioException)
                throw ioException;
            if (this.exception instanceof final ParseException parseException)
                throw parseException;
            return this.container;
        }


        /** {@inheritDoc} */
        @Override
        public boolean supports (final File sourceFile)
        {
            return true;
        }
    }


    /** Remembers what was written. */
    private static class RecordingDestination extends AbstractCoreTask implements IDestinationFormat
    {
        private final boolean     fail;
        private TimelineContainer written;
        private File              outputFile;


        RecordingDestination (final INotifier notifier, final boolean fail)
        {
            super ("Recording", notifier);

            this.fail = fail;
        }


        /** {@inheritDoc} */
        @Override
        public void write (final TimelineContainer container, final File outputFile) throws IOException
        {
            if (this.fail)
                throw new IOException ("Disk full");
            this.written = container;
            this.outputFile = outputFile;
        }
    }
}
