package com.sensortwin.runner;

import com.sensortwin.core.model.LabeledSample;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes each sample as one JSON line.
 */
public class SampleWriter implements SampleSink, Closeable {

    private final Writer out;
    private final SampleSerializer serializer;
    private final boolean closeTarget;
    private long written;

    SampleWriter(Writer out, SampleSerializer serializer, boolean closeTarget) {
        this.out = Objects.requireNonNull(out, "Writer must not be null");
        this.serializer = Objects.requireNonNull(serializer, "Serializer must not be null");
        this.closeTarget = closeTarget;
    }

    /** Write to standard output, which is flushed but left open on close. */
    public static SampleWriter toStdout() {
        return new SampleWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)),
                new SampleSerializer(), false);
    }

    /** Write to {@code path}, replacing any existing file. */
    public static SampleWriter toFile(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new SampleWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8), new SampleSerializer(), true);
    }

    /** Write to an arbitrary writer, closed together with this writer. */
    public static SampleWriter to(Writer writer) {
        return new SampleWriter(writer, new SampleSerializer(), true);
    }

    @Override
    public void accept(LabeledSample sample) throws IOException {
        out.write(serializer.toJson(sample));
        out.write('\n');
        written++;
    }

    public long getWritten() {
        return written;
    }

    @Override
    public void close() throws IOException {
        if (closeTarget) {
            out.close();
        } else {
            out.flush();
        }
    }
}
