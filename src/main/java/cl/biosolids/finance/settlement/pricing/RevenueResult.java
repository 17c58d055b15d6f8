package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.model.BillingConcept;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Amount billed to a client for one load. The breakdown always holds every
 * {@link BillingConcept}, with zero for concepts that were not charged.
 */
@JsonPropertyOrder({"totalUf", "totalClp", "conceptBreakdown"})
public record RevenueResult(BigDecimal totalUf, BigDecimal totalClp, Map<BillingConcept, BigDecimal> conceptBreakdown) {

    public RevenueResult {
        EnumMap<BillingConcept, BigDecimal> copy = new EnumMap<>(BillingConcept.class);
        for (BillingConcept concept : BillingConcept.values()) {
            copy.put(concept, BigDecimal.ZERO);
        }
        copy.putAll(conceptBreakdown);
        conceptBreakdown = Collections.unmodifiableMap(copy);
    }

    public BigDecimal amountFor(BillingConcept concept) {
        return conceptBreakdown.get(concept);
    }
}
