package dk.trustworks.pipeline.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The fixed sales process stages. Snapshots store the raw stage label; this enum
 * classifies a label so aggregators can order stages and recognise closed outcomes.
 * Labels outside the known set map to {@link #UNKNOWN} and keep their own bucket.
 */
public enum PipelineStage {

    VALIDATION_INTRODUCTION("Validation/Introduction", 0, StageKind.PRE_SALES),
    DISCOVER("Discover", 1, StageKind.PIPELINE),
    DEVELOPING_CHAMPIONS("Developing Champions", 2, StageKind.PIPELINE),
    ROI_ANALYSIS_PRICING("ROI Analysis/Pricing", 3, StageKind.PIPELINE),
    NEGOTIATION_REVIEW("Negotiation/Review", 4, StageKind.PIPELINE),
    CLOSED_WON("Closed Won", -1, StageKind.CLOSED),
    CLOSED_LOST("Closed Lost", -1, StageKind.CLOSED),
    UNKNOWN("Unknown", -1, StageKind.UNKNOWN);

    private static final List<PipelineStage> ORDERED = Arrays.stream(values())
            .filter(PipelineStage::isOrdered)
            .toList();

    private final String label;
    private final int order;
    private final StageKind kind;

    PipelineStage(String label, int order, StageKind kind) {
        this.label = label;
        this.order = order;
        this.kind = kind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return position in the sales process, or -1 for closed and unknown stages
     */
    public int getOrder() {
        return order;
    }

    public StageKind getKind() {
        return kind;
    }

    public boolean isOrdered() {
        return order >= 0;
    }

    public boolean isClosed() {
        return kind == StageKind.CLOSED;
    }

    public boolean isWon() {
        return this == CLOSED_WON;
    }

    public boolean isLost() {
        return this == CLOSED_LOST;
    }

    /**
     * Open pipeline as counted by close rate and pipeline value: ordered stages past pre-sales.
     */
    public boolean isOpenPipeline() {
        return kind == StageKind.PIPELINE;
    }

    /**
     * Pre-sales and pipeline stages, everything a deal can still move out of.
     */
    public boolean isOpen() {
        return kind == StageKind.PRE_SALES || kind == StageKind.PIPELINE;
    }

    /**
     * Ordered stages, pre-sales first.
     */
    public static List<PipelineStage> ordered() {
        return ORDERED;
    }

    /**
     * Classifies a raw stage label. Matching is case-insensitive on the trimmed label.
     * Unrecognised labels containing "closed" together with "won" or "lost" are treated
     * as the matching closed outcome, which is how older CRM exports spelled them.
     */
    public static PipelineStage fromLabel(String label) {
        if (label == null || label.isBlank()) return UNKNOWN;
        String trimmed = label.trim();
        for (PipelineStage stage : values()) {
            if (stage != UNKNOWN && stage.label.equalsIgnoreCase(trimmed)) return stage;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.contains("closed")) {
            if (lower.contains("won")) return CLOSED_WON;
            if (lower.contains("lost")) return CLOSED_LOST;
        }
        return UNKNOWN;
    }

    /**
     * The label every output uses for a raw label: the known stage's own label, or the trimmed
     * raw text for unknown stages. Two raw labels name the same stage iff their canonical labels are equal.
     */
    public static String canonicalLabel(String label) {
        PipelineStage stage = fromLabel(label);
        if (stage != UNKNOWN) return stage.label;
        return label == null ? null : label.trim();
    }

    /**
     * Sort key used by every stage-keyed output: ordered stages first, then
     * closed outcomes, then unknown labels.
     */
    public int sortRank() {
        return switch (kind) {
            case PRE_SALES, PIPELINE -> order;
            case CLOSED -> this == CLOSED_WON ? 100 : 101;
            case UNKNOWN -> 200;
        };
    }
}
