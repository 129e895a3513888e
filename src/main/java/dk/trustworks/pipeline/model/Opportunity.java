package dk.trustworks.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A sales opportunity as ingested from the CRM export.
 * <p>
 * The engine never changes an opportunity. The active flag is flipped by the
 * ingestion process when the opportunity closes or is superseded.
 */
@Value
@Builder(toBuilder = true)
public class Opportunity {

    /**
     * Stable internal identifier. Snapshots reference this value.
     */
    String id;

    /**
     * Identifier in the external CRM (e.g. "OPP-001234").
     */
    String crmId;

    String name;

    String clientName;

    String owner;

    LocalDate createdDate;

    boolean active;
}
