package dk.trustworks.pipeline.analytics.services;

import dk.trustworks.pipeline.model.enums.PipelineStage;

import java.util.Comparator;

/**
 * Sort order for stage-keyed results: the sales process order, closed outcomes, then
 * unknown labels alphabetically.
 */
final class StageOrdering {

    static final Comparator<String> BY_STAGE = Comparator
            .comparingInt((String label) -> PipelineStage.fromLabel(label).sortRank())
            .thenComparing(Comparator.naturalOrder());

    private StageOrdering() {
    }
}
