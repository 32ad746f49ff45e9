package com.entity.linker.io;

import com.entity.linker.core.model.LinkDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Writes link decisions as CSV:
 * <pre>
 * sourceId,targetId,label,confidence,strategy,superseded
 * Q1,T1,MATCH,1.000000,rule:perfect-name,
 * Q2,T7,MATCH,0.610000,classifier:naive_bayes,T3
 * </pre>
 * Confidence is empty for uncalibrated decisions; {@code superseded} holds the target
 * that won the conflict, if any.
 */
public class CsvDecisionExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvDecisionExporter.class);
    private static final int PROGRESS_INTERVAL = 10_000;

    public static final String HEADER = "sourceId,targetId,label,confidence,strategy,superseded";

    public long export(List<LinkDecision> decisions, OutputStream output, ProgressCallback callback) throws IOException {
        return export(decisions, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback);
    }

    public long export(List<LinkDecision> decisions, Writer writer, ProgressCallback callback) throws IOException {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        BufferedWriter out = new BufferedWriter(writer);
        out.write(HEADER);
        out.newLine();
        long written = 0;
        for (LinkDecision decision : decisions) {
            out.write(row(decision));
            out.newLine();
            written++;
            if (written % PROGRESS_INTERVAL == 0) {
                cb.onProgress(written, decisions.size(), "Exported " + written + " decisions");
            }
        }
        out.flush();
        cb.onProgress(written, decisions.size(), "Export completed");
        log.info("export.completed decisions={}", written);
        return written;
    }

    static String row(LinkDecision decision) {
        return String.join(",",
                CsvLines.escape(decision.sourceId()),
                CsvLines.escape(decision.targetId()),
                decision.label().name(),
                decision.confidence() != null ? String.format(Locale.ROOT, "%.6f", decision.confidence()) : "",
                CsvLines.escape(decision.strategyId()),
                CsvLines.escape(decision.supersededBy()));
    }
}
