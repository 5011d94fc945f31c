package com.legalgraph.service.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalgraph.dto.document.Document;
import com.legalgraph.exception.CitationGraphException;
import com.legalgraph.service.corpus.CorpusAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Streams corpus documents from a JSON Lines file (one document per line)
 * or a JSON array file.
 * <p>
 * Field names vary between scrapers, so each field is looked up under
 * several keys. Malformed lines, records that are not JSON objects and
 * documents without a resolvable id are skipped and counted.
 */
@Slf4j
@Service
public class DocumentSource {

    private static final List<String> ID_KEYS = List.of("id", "section_number", "case_id");
    private static final List<String> BODY_KEYS = List.of("paragraphs", "body", "text");
    private static final List<String> URL_KEYS = List.of("source_url", "url");
    private static final List<String> TITLE_KEYS = List.of("display_title", "title");
    private static final String HEADER_KEY = "header";
    private static final TypeReference<Map<String, Object>> RAW_RECORD = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Opens a corpus file. The returned stream is lazy; close it to release
     * the file.
     */
    public CorpusStream open(Path path, CorpusAdapter adapter) {
        Path file = path.toAbsolutePath();
        if (!Files.isRegularFile(file)) {
            throw new CitationGraphException("Corpus file not found: " + file);
        }
        log.info("Reading corpus | corpus={} | file={}", adapter.getId(), file);

        AtomicLong skipped = new AtomicLong();
        try {
            Stream<Document> documents = isJsonArray(file)
                    ? readArray(file, adapter, skipped)
                    : readLines(file, adapter, skipped);
            return new CorpusStream(documents, skipped);
        } catch (IOException e) {
            throw new CitationGraphException("Failed to open corpus file " + file, e);
        }
    }

    /**
     * Maps one raw record to a document, or empty when no id can be found.
     */
    public Optional<Document> toDocument(Map<String, Object> raw, CorpusAdapter adapter) {
        String header = stringValue(raw.get(HEADER_KEY));

        Optional<String> id = firstString(raw, ID_KEYS);
        if (id.isEmpty()) {
            id = adapter.resolveDocumentId(header);
        }
        if (id.isEmpty()) {
            return Optional.empty();
        }

        List<String> body = extractBody(raw);
        String title = firstString(raw, TITLE_KEYS).orElseGet(() -> titleFromHeader(header));

        return Optional.of(Document.builder()
                .id(id.get())
                .corpusId(adapter.getId())
                .sourceUrl(firstString(raw, URL_KEYS).orElse(null))
                .displayTitle(title)
                .body(body)
                .wordCount(Document.countWords(body))
                .build());
    }

    // ============================================================
    // Private Helper Methods
    // ============================================================

    private Stream<Document> readLines(Path file, CorpusAdapter adapter, AtomicLong skipped) throws IOException {
        BufferedReader reader = lenientReader(file);
        return reader.lines()
                .onClose(() -> closeQuietly(reader))
                .filter(line -> !line.isBlank())
                .map(line -> parseLine(line, adapter, skipped))
                .flatMap(Optional::stream);
    }

    private Optional<Document> parseLine(String line, CorpusAdapter adapter, AtomicLong skipped) {
        try {
            return keepOrCount(objectMapper.readTree(line), adapter, skipped);
        } catch (JsonProcessingException e) {
            skipped.incrementAndGet();
            log.warn("Skipping malformed corpus line: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Stream<Document> readArray(Path file, CorpusAdapter adapter, AtomicLong skipped) throws IOException {
        BufferedReader reader = lenientReader(file);
        MappingIterator<JsonNode> iterator;
        try {
            iterator = objectMapper.readerFor(JsonNode.class).readValues(reader);
        } catch (IOException e) {
            reader.close();
            throw e;
        }

        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false)
                .onClose(() -> closeQuietly(iterator))
                .map(node -> keepOrCount(node, adapter, skipped))
                .flatMap(Optional::stream);
    }

    private Optional<Document> keepOrCount(JsonNode node, CorpusAdapter adapter, AtomicLong skipped) {
        if (node == null || !node.isObject()) {
            skipped.incrementAndGet();
            log.warn("Skipping non-object corpus record | corpus={} | type={}",
                    adapter.getId(), node == null ? "MISSING" : node.getNodeType());
            return Optional.empty();
        }

        Map<String, Object> raw = objectMapper.convertValue(node, RAW_RECORD);
        Optional<Document> document = toDocument(raw, adapter);
        if (document.isEmpty()) {
            skipped.incrementAndGet();
            log.warn("Skipping document without id | corpus={} | header={}",
                    adapter.getId(), stringValue(raw.get(HEADER_KEY)));
        }
        return document;
    }

    private boolean isJsonArray(Path file) throws IOException {
        try (BufferedReader reader = lenientReader(file)) {
            int c;
            while ((c = reader.read()) != -1) {
                if (c == '\uFEFF' || Character.isWhitespace(c)) {
                    continue;
                }
                return c == '[';
            }
            return false;
        }
    }

    /**
     * Invalid UTF-8 sequences decode to U+FFFD instead of failing the read.
     */
    private static BufferedReader lenientReader(Path file) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(Files.newInputStream(file), decoder));
    }

    private List<String> extractBody(Map<String, Object> raw) {
        for (String key : BODY_KEYS) {
            Object value = raw.get(key);
            if (value instanceof List) {
                return ((List<?>) value).stream()
                        .filter(p -> p != null)
                        .map(String::valueOf)
                        .collect(Collectors.toCollection(ArrayList::new));
            }
            if (value instanceof String) {
                return Arrays.stream(((String) value).split("\\r?\\n"))
                        .filter(p -> !p.isBlank())
                        .collect(Collectors.toCollection(ArrayList::new));
            }
        }
        return new ArrayList<>();
    }

    private Optional<String> firstString(Map<String, Object> raw, List<String> keys) {
        for (String key : keys) {
            String value = stringValue(raw.get(key));
            if (value != null && !value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    private String titleFromHeader(String header) {
        if (header == null || !header.contains("|")) {
            return null;
        }
        String title = header.substring(header.indexOf('|') + 1).trim();
        return title.isEmpty() ? null : title;
    }

    private static String stringValue(Object value) {
        if (value instanceof String || value instanceof Number) {
            return String.valueOf(value);
        }
        return null;
    }

    private static void closeQuietly(Closeable resource) {
        try {
            resource.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Lazily parsed documents plus the running count of skipped records.
     */
    public static class CorpusStream implements AutoCloseable {

        private final Stream<Document> documents;
        private final AtomicLong skipped;

        CorpusStream(Stream<Document> documents, AtomicLong skipped) {
            this.documents = documents;
            this.skipped = skipped;
        }

        public Stream<Document> documents() {
            return documents;
        }

        /**
         * Records skipped so far; final once the stream is exhausted.
         */
        public long getSkipped() {
            return skipped.get();
        }

        @Override
        public void close() {
            documents.close();
        }
    }
}
