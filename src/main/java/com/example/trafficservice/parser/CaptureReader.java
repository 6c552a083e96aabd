package com.example.trafficservice.parser;

import com.example.trafficservice.exception.MalformedCaptureException;
import com.example.trafficservice.model.Diagnostic;
import com.example.trafficservice.model.RawExchange;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass sequence of the exchanges in one capture file. Only the current entry is held
 * in memory. Re-open the file to iterate again.
 *
 * <p>Entries that cannot be mapped are skipped and reported through {@link #getDiagnostics()}.
 * Broken JSON anywhere in the file is a container failure and surfaces as
 * {@link MalformedCaptureException} from {@link #hasNext()}.</p>
 */
@Slf4j
public class CaptureReader implements Iterator<RawExchange>, Closeable {

    private final String captureName;
    private final JsonParser parser;
    private final HarEntryMapper mapper;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int entriesRead;
    private RawExchange lookahead;
    private boolean exhausted;

    CaptureReader(String captureName, JsonParser parser, HarEntryMapper mapper) {
        this.captureName = captureName;
        this.parser = parser;
        this.mapper = mapper;
        try {
            positionAtEntries();
        } catch (IOException e) {
            closeQuietly();
            throw new MalformedCaptureException(captureName + ": " + e.getMessage(), e);
        } catch (MalformedCaptureException e) {
            closeQuietly();
            throw e;
        }
    }

    @Override
    public boolean hasNext() {
        while (lookahead == null && !exhausted) {
            lookahead = readNext();
        }
        return lookahead != null;
    }

    @Override
    public RawExchange next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RawExchange exchange = lookahead;
        lookahead = null;
        return exchange;
    }

    public Stream<RawExchange> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public String getCaptureName() {
        return captureName;
    }

    /**
     * Entries skipped so far.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public int getEntriesRead() {
        return entriesRead;
    }

    public int getSkippedEntries() {
        return diagnostics.size();
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    /**
     * Advance to the first token inside {@code log.entries}.
     */
    private void positionAtEntries() throws IOException {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
            throw new MalformedCaptureException(captureName + ": root is not a JSON object");
        }
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            if ("log".equals(field)) {
                if (value != JsonToken.START_OBJECT) {
                    throw new MalformedCaptureException(captureName + ": 'log' is not an object");
                }
                positionInLog();
                return;
            }
            parser.skipChildren();
        }
        throw new MalformedCaptureException(captureName + ": no 'log' object");
    }

    private void positionInLog() throws IOException {
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String field = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            if ("entries".equals(field)) {
                if (value != JsonToken.START_ARRAY) {
                    throw new MalformedCaptureException(captureName + ": 'log.entries' is not an array");
                }
                return;
            }
            parser.skipChildren();
        }
        throw new MalformedCaptureException(captureName + ": no 'log.entries' array");
    }

    /**
     * @return the next mapped exchange, or null when the entry was skipped or the array ended
     */
    private RawExchange readNext() {
        try {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                exhausted = true;
                return null;
            }
            if (token == null) {
                throw new MalformedCaptureException(captureName + ": unexpected end of file inside 'log.entries'");
            }

            int index = entriesRead++;
            JsonNode entry = parser.readValueAsTree();
            try {
                return mapper.map(index, entry);
            } catch (InvalidEntryException e) {
                log.warn("Skipping entry {} of {}: {}", index, captureName, e.getMessage());
                diagnostics.add(Diagnostic.skippedEntry(index, e.getMessage()));
                return null;
            }
        } catch (IOException e) {
            exhausted = true;
            throw new MalformedCaptureException(captureName + ": " + e.getMessage(), e);
        }
    }

    private void closeQuietly() {
        try {
            parser.close();
        } catch (IOException e) {
            log.debug("Failed to close parser for {}: {}", captureName, e.getMessage());
        }
    }
}
