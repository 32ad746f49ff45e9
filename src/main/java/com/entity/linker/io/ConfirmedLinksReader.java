package com.entity.linker.io;

import com.entity.linker.core.model.CandidatePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads confirmed links from CSV rows {@code sourceId,targetId}. A header row starting
 * with {@code sourceId} is skipped. A source may be confirmed against one target only;
 * later rows for the same source are reported as errors.
 */
public class ConfirmedLinksReader {
    private static final Logger log = LoggerFactory.getLogger(ConfirmedLinksReader.class);

    public ReadResult<CandidatePair> read(Reader reader) throws IOException {
        List<CandidatePair> links = new ArrayList<>();
        List<ReadError> errors = new ArrayList<>();
        Map<String, String> seen = new HashMap<>();

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || (lineNumber == 1 && line.strip().startsWith("sourceId"))) {
                    continue;
                }
                List<String> fields;
                try {
                    fields = CsvLines.split(line);
                } catch (IllegalArgumentException e) {
                    errors.add(new ReadError(lineNumber, null, e.getMessage()));
                    continue;
                }
                if (fields.size() < 2 || fields.get(0).isBlank() || fields.get(1).isBlank()) {
                    errors.add(new ReadError(lineNumber, null, "Expected sourceId,targetId"));
                    continue;
                }
                String sourceId = fields.get(0).strip();
                String targetId = fields.get(1).strip();
                String previous = seen.putIfAbsent(sourceId, targetId);
                if (previous != null && !previous.equals(targetId)) {
                    errors.add(new ReadError(lineNumber, sourceId,
                            "Source already confirmed against " + previous));
                    continue;
                }
                if (previous == null) {
                    links.add(CandidatePair.of(sourceId, targetId));
                }
            }
        }
        log.info("links.read links={} errors={}", links.size(), errors.size());
        return new ReadResult<>(links, errors);
    }

    /**
     * Converts read links into the source-to-target map the linker trains on.
     */
    public static Map<String, String> asMap(List<CandidatePair> links) {
        Map<String, String> map = new LinkedHashMap<>();
        for (CandidatePair link : links) {
            map.putIfAbsent(link.sourceId(), link.targetId());
        }
        return map;
    }
}
