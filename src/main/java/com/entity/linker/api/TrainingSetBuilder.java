package com.entity.linker.api;

import com.entity.linker.core.model.CandidatePair;
import com.entity.linker.core.model.LabeledPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Labels candidate pairs with confirmed links.
 *
 * <p>Every confirmed link whose entities both exist is a positive, even when blocking
 * missed it. Every other candidate of a confirmed source is a negative. Candidates of
 * sources without a confirmed link are left out, since nothing is known about them.</p>
 */
public class TrainingSetBuilder {
    private static final Logger log = LoggerFactory.getLogger(TrainingSetBuilder.class);

    /**
     * @param candidates blocked candidate pairs
     * @param confirmed  confirmed links, source id to target id
     * @param sourceIds  ids of the usable source entities
     * @param targetIds  ids of the usable target entities
     * @return labeled pairs sorted by pair
     */
    public List<LabeledPair> label(List<CandidatePair> candidates, Map<String, String> confirmed,
                                   Set<String> sourceIds, Set<String> targetIds) {
        Map<CandidatePair, Boolean> labels = new TreeMap<>();
        int skipped = 0;
        for (Map.Entry<String, String> link : confirmed.entrySet()) {
            if (sourceIds.contains(link.getKey()) && targetIds.contains(link.getValue())) {
                labels.put(CandidatePair.of(link.getKey(), link.getValue()), true);
            } else {
                skipped++;
            }
        }
        for (CandidatePair pair : candidates) {
            String confirmedTarget = confirmed.get(pair.sourceId());
            if (confirmedTarget != null && !confirmedTarget.equals(pair.targetId())) {
                labels.putIfAbsent(pair, false);
            }
        }

        List<LabeledPair> labeled = new ArrayList<>(labels.size());
        labels.forEach((pair, match) -> labeled.add(new LabeledPair(pair, match)));
        long positives = labeled.stream().filter(LabeledPair::match).count();
        log.info("training.set.built positives={} negatives={} skippedLinks={}",
                positives, labeled.size() - positives, skipped);
        return labeled;
    }
}
