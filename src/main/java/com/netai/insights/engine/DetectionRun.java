package com.netai.insights.engine;

import com.netai.insights.model.ModelBundle;
import com.netai.insights.model.ScoredRecord;

import java.util.List;

/**
 * Outcome of fitting a detector on a batch: the classified records and the bundle that produced them.
 */
public record DetectionRun(List<ScoredRecord> scoredRecords, ModelBundle bundle) {

    public long anomalyCount() {
        return scoredRecords.stream().filter(ScoredRecord::isAnomaly).count();
    }
}
