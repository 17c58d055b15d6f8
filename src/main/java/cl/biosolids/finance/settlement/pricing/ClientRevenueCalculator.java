package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.InvalidConversionRateException;
import cl.biosolids.finance.settlement.exceptions.InvalidWeightException;
import cl.biosolids.finance.settlement.exceptions.MissingTariffException;
import cl.biosolids.finance.settlement.model.BillingConcept;
import cl.biosolids.finance.settlement.model.ClientTariff;
import cl.biosolids.finance.settlement.model.LoadProjection;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes what a client is billed for one load.
 *
 * Transport and disposal are always charged, treatment only when the load goes to a
 * treatment plant. Each concept uses the client tariff valid on the calculation date and
 * bills {@code rate x max(weight, minimum)}; concepts never influence each other.
 */
@JBossLog
@ApplicationScoped
public class ClientRevenueCalculator {

    @Inject MeterRegistry registry;

    public RevenueResult calculateLoadRevenue(LoadProjection load, List<ClientTariff> tariffs, BigDecimal ufValue) {
        return calculateLoadRevenue(load, tariffs, ufValue, LocalDate.now());
    }

    @Timed(value = "settlement.revenue.duration", description = "Client revenue calculation timing")
    public RevenueResult calculateLoadRevenue(LoadProjection load, List<ClientTariff> tariffs, BigDecimal ufValue, LocalDate calculationDate) {
        BigDecimal weight = load != null ? load.netWeightTons() : null;
        if (weight == null || weight.signum() <= 0) {
            log.warnf("Rejected revenue calculation, net weight %s", weight);
            throw new InvalidWeightException("Load net_weight_tons must be positive to calculate revenue, got " + weight);
        }
        if (ufValue == null || ufValue.signum() <= 0) {
            log.warnf("Rejected revenue calculation, uf value %s", ufValue);
            throw new InvalidConversionRateException("uf_value must be positive, got " + ufValue);
        }
        LocalDate date = calculationDate != null ? calculationDate : LocalDate.now();

        Map<BillingConcept, ClientTariff> active = activeByConcept(tariffs, date);

        Map<BillingConcept, BigDecimal> breakdown = new EnumMap<>(BillingConcept.class);
        BigDecimal totalUf = BigDecimal.ZERO;
        for (BillingConcept concept : BillingConcept.values()) {
            if (!concept.isMandatory() && !load.goesToTreatment()) {
                breakdown.put(concept, BigDecimal.ZERO);
                continue;
            }
            ClientTariff tariff = active.get(concept);
            if (tariff == null) {
                log.warnf("No valid %s tariff on %s", concept, date);
                throw new MissingTariffException(missingMessage(concept, date));
            }
            BigDecimal amount = tariff.ratePerTon().multiply(tariff.billableWeight(weight));
            breakdown.put(concept, amount);
            totalUf = totalUf.add(amount);
        }

        BigDecimal totalClp = totalUf.multiply(ufValue);
        registry.counter("settlement.revenue.calculated", "treatment", String.valueOf(load.goesToTreatment())).increment();
        log.debugf("Load revenue %s UF / %s CLP on %s", totalUf.toPlainString(), totalClp.toPlainString(), date);
        return new RevenueResult(totalUf, totalClp, breakdown);
    }

    private static Map<BillingConcept, ClientTariff> activeByConcept(List<ClientTariff> tariffs, LocalDate date) {
        Map<BillingConcept, ClientTariff> active = new EnumMap<>(BillingConcept.class);
        if (tariffs == null) return active;
        for (ClientTariff tariff : tariffs) {
            if (tariff != null && tariff.isActiveOn(date)) {
                active.putIfAbsent(tariff.concept(), tariff); // first match wins
            }
        }
        return active;
    }

    private static String missingMessage(BillingConcept concept, LocalDate date) {
        if (concept == BillingConcept.TRATAMIENTO) {
            return "Load goes to treatment but no TRATAMIENTO tariff is valid on " + date;
        }
        return "No " + concept + " tariff is valid on " + date;
    }
}
