package com.entity.linker.io;

import com.entity.linker.core.model.AttributeKeys;
import com.entity.linker.core.model.AttributeKind;
import com.entity.linker.core.model.CollectionTag;
import com.entity.linker.core.model.Entity;
import com.entity.linker.core.model.PartialDate;
import com.entity.linker.normalization.DateNormalizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads entities from JSON Lines, one object per line:
 * <pre>
 * {"id": "Q1", "name": ["Charles Hartshorne"], "birth_date": ["1897-06-05"], "url": ["https://example.org/ch"]}
 * </pre>
 *
 * <p>{@code id} is required. Every other field becomes an attribute whose kind comes from
 * the configured kinds (see {@link AttributeKeys#defaultKinds()}), defaulting to text.
 * A field holds a string, a number or an array of them. Dates that cannot be parsed are
 * dropped. A malformed line is reported as a {@link ReadError} and reading continues.</p>
 */
public class JsonlEntityReader {
    private static final Logger log = LoggerFactory.getLogger(JsonlEntityReader.class);
    private static final int PROGRESS_INTERVAL = 1_000;
    private static final String ID_FIELD = "id";

    private final ObjectMapper objectMapper;
    private final CollectionTag collection;
    private final Map<String, AttributeKind> kinds;
    private final DateNormalizer dateNormalizer;

    public JsonlEntityReader(CollectionTag collection) {
        this(collection, AttributeKeys.defaultKinds(), new DateNormalizer());
    }

    public JsonlEntityReader(CollectionTag collection, Map<String, AttributeKind> kinds, DateNormalizer dateNormalizer) {
        this.objectMapper = new ObjectMapper();
        this.collection = collection;
        this.kinds = new HashMap<>(kinds);
        this.dateNormalizer = dateNormalizer;
    }

    public ReadResult<Entity> read(InputStream input, ProgressCallback callback) throws IOException {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8), callback);
    }

    public ReadResult<Entity> read(Reader reader, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<Entity> entities = new ArrayList<>();
        List<ReadError> errors = new ArrayList<>();

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    entities.add(parse(objectMapper.readTree(line)));
                } catch (JsonProcessingException e) {
                    errors.add(new ReadError(lineNumber, null, "Invalid JSON: " + e.getOriginalMessage()));
                } catch (IllegalArgumentException e) {
                    errors.add(new ReadError(lineNumber, idOf(line), e.getMessage()));
                }
                if (lineNumber % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(lineNumber, -1, "Read " + entities.size() + " entities");
                }
            }
        }

        ReadResult<Entity> result = new ReadResult<>(entities, errors);
        cb.onProgress(entities.size() + errors.size(), entities.size() + errors.size(), "Read completed");
        log.info("read.completed collection={} entities={} errors={}", collection, entities.size(), errors.size());
        return result;
    }

    private Entity parse(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Line is not a JSON object");
        }
        JsonNode idNode = node.get(ID_FIELD);
        if (idNode == null || !idNode.isValueNode() || idNode.asText().isBlank()) {
            throw new IllegalArgumentException("Missing '" + ID_FIELD + "'");
        }
        Entity.Builder builder = Entity.builder().id(idNode.asText()).collection(collection);

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ID_FIELD.equals(field.getKey())) {
                continue;
            }
            List<String> values = values(field.getKey(), field.getValue());
            if (values.isEmpty()) {
                continue;
            }
            AttributeKind kind = kinds.getOrDefault(field.getKey(), AttributeKind.TEXT);
            switch (kind) {
                case TEXT -> builder.text(field.getKey(), values);
                case LINK -> builder.links(field.getKey(), values.toArray(new String[0]));
                case TOKEN_SET -> builder.tokens(field.getKey(), values.toArray(new String[0]));
                case DATE -> builder.dates(field.getKey(), parseDates(values).toArray(new PartialDate[0]));
            }
        }
        return builder.build();
    }

    private List<PartialDate> parseDates(List<String> values) {
        List<PartialDate> dates = new ArrayList<>(values.size());
        for (String value : values) {
            dateNormalizer.parse(value).ifPresent(dates::add);
        }
        return dates;
    }

    private static List<String> values(String name, JsonNode value) {
        List<String> values = new ArrayList<>();
        if (value.isNull()) {
            return values;
        }
        if (value.isArray()) {
            for (JsonNode element : value) {
                if (element.isNull()) {
                    continue;
                }
                if (!element.isValueNode()) {
                    throw new IllegalArgumentException("Field '" + name + "' holds a nested structure");
                }
                values.add(element.asText());
            }
            return values;
        }
        if (!value.isValueNode()) {
            throw new IllegalArgumentException("Field '" + name + "' holds a nested structure");
        }
        values.add(value.asText());
        return values;
    }

    private String idOf(String line) {
        try {
            JsonNode id = objectMapper.readTree(line).get(ID_FIELD);
            return id != null && id.isValueNode() ? id.asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
