package dk.trustworks.pipeline.model;

import dk.trustworks.pipeline.model.enums.PipelineStage;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

/**
 * Dashboard filter set. Every empty dimension matches everything.
 */
@Value
@Builder
public class PipelineFilter {

    public static final PipelineFilter NONE = PipelineFilter.builder().build();

    @Singular
    Set<String> owners;

    @Singular
    Set<String> clientNames;

    /**
     * Stage labels the opportunity's current state must be in, matched like stage classification.
     */
    @Singular
    Set<String> stages;

    /**
     * Free text matched case-insensitively against opportunity and client name.
     */
    String search;

    public boolean isEmpty() {
        return owners.isEmpty() && clientNames.isEmpty() && stages.isEmpty() && (search == null || search.isBlank());
    }

    public boolean matches(Opportunity opportunity, OpportunitySnapshot currentState) {
        if (!owners.isEmpty() && !owners.contains(opportunity.getOwner())) return false;
        if (!clientNames.isEmpty() && !clientNames.contains(opportunity.getClientName())) return false;
        if (!stages.isEmpty() && (currentState == null || !matchesStage(currentState))) return false;
        if (search != null && !search.isBlank()) {
            String needle = search.trim().toLowerCase(Locale.ROOT);
            return contains(opportunity.getName(), needle) || contains(opportunity.getClientName(), needle);
        }
        return true;
    }

    private boolean matchesStage(OpportunitySnapshot state) {
        String current = state.getCanonicalStage();
        return stages.stream().anyMatch(s -> PipelineStage.canonicalLabel(s).equals(current));
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }
}
