package cl.biosolids.finance.settlement.services;

import cl.biosolids.finance.settlement.model.BillingConcept;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Totals of one billing cycle. UF figures are exact sums; CLP figures are rounded for display.
 */
public record SettlementSummary(
        String periodKey,
        CycleWindow window,
        BigDecimal ufValue,
        BigDecimal fuelPrice,
        int tripCount,
        BigDecimal transportCostsUf,
        BigDecimal disposalCostsUf,
        BigDecimal totalCostsUf,
        BigDecimal revenueUf,
        Map<BillingConcept, BigDecimal> revenueByConcept,
        BigDecimal marginUf,
        BigDecimal totalCostsClp,
        BigDecimal revenueClp,
        BigDecimal marginClp
) {

    public SettlementSummary {
        revenueByConcept = Collections.unmodifiableMap(new EnumMap<>(revenueByConcept));
    }
}
