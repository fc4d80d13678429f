package com.vision.flow.io;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vision.flow.api.ResultSink;
import com.vision.flow.engine.RunOutcome;

import lombok.extern.log4j.Log4j2;

/**
 * Writes each run outcome as one JSON document per line (JSON Lines).
 * Safe for concurrent runs; every line is flushed as it is written.
 */
@Log4j2
public final class JsonResultSink implements ResultSink, Closeable {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Writer out;
    private long written;

    public JsonResultSink(Writer out) {
        this.out = out;
    }

    /** Appends to a file, creating it if needed. */
    public static JsonResultSink append(Path file) throws IOException {
        return new JsonResultSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE,
                StandardOpenOption.APPEND));
    }

    @Override
    public void accept(RunOutcome outcome) {
        String line;
        try {
            line = MAPPER.writeValueAsString(RunOutcomeDocument.from(outcome));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize outcome of run " + outcome.runId(), e);
        }
        synchronized (this) {
            try {
                out.write(line);
                out.write('\n');
                out.flush();
                written++;
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write outcome of run " + outcome.runId(), e);
            }
        }
        log.debug("Wrote outcome of run {}", outcome.runId());
    }

    public synchronized long written() {
        return written;
    }

    /** Parses documents previously written by a sink, one per non-blank line. */
    public static List<RunOutcomeDocument> read(Reader in) throws IOException {
        List<RunOutcomeDocument> docs = new ArrayList<>();
        BufferedReader reader = new BufferedReader(in);
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank())
                docs.add(MAPPER.readValue(line, RunOutcomeDocument.class));
        }
        return docs;
    }

    @Override
    public synchronized void close() throws IOException {
        out.close();
    }
}
