package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.MissingTariffException;
import cl.biosolids.finance.settlement.model.DestinationKind;
import cl.biosolids.finance.settlement.model.DisposalSiteTariff;
import cl.biosolids.finance.settlement.model.LoadProjection;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cost paid to the disposal site receiving a load. Loads delivered to a treatment plant
 * have no site cost.
 */
@JBossLog
@ApplicationScoped
public class DisposalCostCalculator {

    @Inject MeterRegistry registry;

    @Timed(value = "settlement.disposal.duration", description = "Disposal cost calculation timing")
    public Optional<DisposalCostResult> calculateDisposalCost(LoadProjection load, List<DisposalSiteTariff> siteTariffs, LocalDate calculationDate) {
        Objects.requireNonNull(load, "load");
        Objects.requireNonNull(calculationDate, "calculationDate");
        if (load.destinationKind() != DestinationKind.DISPOSAL_SITE) {
            return Optional.empty();
        }

        long siteId = load.destinationId();
        DisposalSiteTariff tariff = siteTariffs == null ? null : siteTariffs.stream()
                .filter(Objects::nonNull)
                .filter(t -> t.siteId() == siteId && t.isActiveOn(calculationDate))
                .findFirst()
                .orElse(null);
        if (tariff == null) {
            log.warnf("No disposal tariff for site %d on %s", siteId, calculationDate);
            throw new MissingTariffException("No disposal tariff is valid for site " + siteId + " on " + calculationDate);
        }

        BigDecimal billable = load.weightOrZero().max(tariff.minWeightTons());
        BigDecimal total = tariff.ratePerTon().multiply(billable);
        registry.counter("settlement.disposal.calculated").increment();
        log.debugf("Disposal cost %s UF at site %d (%s t billed)", total.toPlainString(), siteId, billable.toPlainString());
        return Optional.of(new DisposalCostResult(siteId, billable, tariff.ratePerTon(), total));
    }
}
