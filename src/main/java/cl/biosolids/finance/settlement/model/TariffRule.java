package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidFuelPriceException;
import cl.biosolids.finance.settlement.exceptions.InvalidTariffException;

import java.math.BigDecimal;

/**
 * A contractor's pricing rule for one vehicle configuration.
 *
 * @param baseRatePerTonKm contractual rate in UF per ton-kilometre
 * @param minWeightTons    guaranteed minimum billable weight
 * @param vehicleType      vehicle configuration the rule applies to
 * @param baseFuelPrice    reference fuel price the rate was agreed at
 */
public record TariffRule(
        BigDecimal baseRatePerTonKm,
        BigDecimal minWeightTons,
        VehicleType vehicleType,
        BigDecimal baseFuelPrice
) {

    public TariffRule {
        if (baseRatePerTonKm == null || baseRatePerTonKm.signum() <= 0) {
            throw new InvalidTariffException("base_rate_per_ton_km must be positive, got " + baseRatePerTonKm);
        }
        if (minWeightTons == null || minWeightTons.signum() < 0) {
            throw new InvalidTariffException("min_weight_tons must be zero or positive, got " + minWeightTons);
        }
        if (vehicleType == null) {
            throw new InvalidTariffException("vehicle_type is required");
        }
        if (baseFuelPrice == null || baseFuelPrice.signum() <= 0) {
            throw new InvalidFuelPriceException("base_fuel_price must be positive, got " + baseFuelPrice);
        }
    }

    public static TariffRule withDefaultMinimum(BigDecimal baseRatePerTonKm, VehicleType vehicleType, BigDecimal baseFuelPrice) {
        if (vehicleType == null) {
            throw new InvalidTariffException("vehicle_type is required");
        }
        return new TariffRule(baseRatePerTonKm, vehicleType.getDefaultMinWeightTons(), vehicleType, baseFuelPrice);
    }

    /**
     * Weight billed for an actual weight: never below the guaranteed minimum.
     * A missing weight counts as zero.
     */
    public BigDecimal billableWeight(BigDecimal actualWeightTons) {
        BigDecimal actual = actualWeightTons != null ? actualWeightTons : BigDecimal.ZERO;
        return actual.max(minWeightTons);
    }
}
