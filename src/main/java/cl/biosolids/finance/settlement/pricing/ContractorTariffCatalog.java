package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.config.SettlementConfig;
import cl.biosolids.finance.settlement.exceptions.MissingTariffException;
import cl.biosolids.finance.settlement.model.TariffRule;
import cl.biosolids.finance.settlement.model.VehicleType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Builds contractor {@link TariffRule}s from the per-vehicle rates of a billing period.
 *
 * A period (proforma) defines one UF rate per ton-km for each vehicle configuration; the
 * guaranteed minimum weight comes from configuration so that it can change without
 * touching imported rate sheets.
 */
@JBossLog
@ApplicationScoped
public class ContractorTariffCatalog {

    @Inject SettlementConfig config;

    /**
     * @param ratesByVehicle UF per ton-km keyed by vehicle configuration
     * @param vehicleType    vehicle that performed the trip
     * @param baseFuelPrice  contractual reference fuel price
     * @throws MissingTariffException if the period has no rate for the vehicle type
     */
    public TariffRule select(Map<VehicleType, BigDecimal> ratesByVehicle, VehicleType vehicleType, BigDecimal baseFuelPrice) {
        if (vehicleType == null) {
            throw new MissingTariffException("A vehicle type is required to select a contractor tariff");
        }
        BigDecimal rate = ratesByVehicle != null ? ratesByVehicle.get(vehicleType) : null;
        if (rate == null) {
            log.warnf("No contractor rate configured for %s", vehicleType);
            throw new MissingTariffException("No contractor rate configured for vehicle type " + vehicleType);
        }
        BigDecimal minimum = config.minimumWeightFor(vehicleType);
        log.debugf("Selected %s rate %s UF/t-km with minimum %s t", vehicleType, rate.toPlainString(), minimum.toPlainString());
        return new TariffRule(rate, minimum, vehicleType, baseFuelPrice);
    }
}
