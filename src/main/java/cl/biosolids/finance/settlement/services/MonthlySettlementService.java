package cl.biosolids.finance.settlement.services;

import cl.biosolids.finance.settlement.config.SettlementConfig;
import cl.biosolids.finance.settlement.exceptions.InvalidEconomicCycleException;
import cl.biosolids.finance.settlement.model.BillingConcept;
import cl.biosolids.finance.settlement.model.EconomicCycle;
import cl.biosolids.finance.settlement.pricing.DisposalCostResult;
import cl.biosolids.finance.settlement.pricing.RevenueResult;
import cl.biosolids.finance.settlement.pricing.TripCostResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates the priced trips, disposals and loads of one economic cycle into a
 * settlement summary. All sums are kept in UF; CLP is derived once at the end.
 */
@JBossLog
@ApplicationScoped
public class MonthlySettlementService {

    private static final RoundingMode RM = RoundingMode.HALF_UP;

    @Inject SettlementConfig config;

    public SettlementSummary summarize(EconomicCycle cycle,
                                       List<TripCostResult> tripCosts,
                                       List<DisposalCostResult> disposalCosts,
                                       List<RevenueResult> revenues) {
        if (cycle == null) {
            throw new InvalidEconomicCycleException("An economic cycle is required to build a settlement");
        }
        List<TripCostResult> trips = tripCosts != null ? tripCosts : List.of();
        List<DisposalCostResult> disposals = disposalCosts != null ? disposalCosts : List.of();
        List<RevenueResult> incomes = revenues != null ? revenues : List.of();

        BigDecimal transportUf = trips.stream().map(TripCostResult::totalCostUf).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal disposalUf = disposals.stream().map(DisposalCostResult::totalUf).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalCostsUf = transportUf.add(disposalUf);

        Map<BillingConcept, BigDecimal> byConcept = new EnumMap<>(BillingConcept.class);
        for (BillingConcept concept : BillingConcept.values()) {
            byConcept.put(concept, incomes.stream().map(r -> r.amountFor(concept)).reduce(BigDecimal.ZERO, BigDecimal::add));
        }
        BigDecimal revenueUf = incomes.stream().map(RevenueResult::totalUf).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal marginUf = revenueUf.subtract(totalCostsUf);

        int scale = config.currency().clpScale();
        BigDecimal uf = cycle.ufValue();

        SettlementSummary summary = new SettlementSummary(
                cycle.periodKey(),
                new CycleWindow(cycle.startDate(), cycle.endDate()),
                uf,
                cycle.fuelPrice(),
                trips.size(),
                transportUf,
                disposalUf,
                totalCostsUf,
                revenueUf,
                byConcept,
                marginUf,
                totalCostsUf.multiply(uf).setScale(scale, RM),
                revenueUf.multiply(uf).setScale(scale, RM),
                marginUf.multiply(uf).setScale(scale, RM));

        log.infof("Settlement %s: %d trips, costs %s UF, revenue %s UF, margin %s UF",
                summary.periodKey(), trips.size(), totalCostsUf.toPlainString(), revenueUf.toPlainString(), marginUf.toPlainString());
        return summary;
    }
}
