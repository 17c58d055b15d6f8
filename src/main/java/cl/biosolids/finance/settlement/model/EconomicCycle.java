package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidConversionRateException;
import cl.biosolids.finance.settlement.exceptions.InvalidEconomicCycleException;
import cl.biosolids.finance.settlement.exceptions.InvalidFuelPriceException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Economic snapshot of a billing period: UF value and fuel price in force.
 * {@code closed} is informational, the engine never changes behaviour on it.
 */
public record EconomicCycle(
        BigDecimal ufValue,
        BigDecimal fuelPrice,
        boolean closed,
        LocalDate startDate,
        LocalDate endDate
) {

    private static final DateTimeFormatter PERIOD_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    public EconomicCycle {
        if (ufValue == null || ufValue.signum() <= 0) {
            throw new InvalidConversionRateException("uf_value must be positive, got " + ufValue);
        }
        if (fuelPrice == null || fuelPrice.signum() <= 0) {
            throw new InvalidFuelPriceException("fuel_price must be positive, got " + fuelPrice);
        }
        if (startDate == null || endDate == null) {
            throw new InvalidEconomicCycleException("Economic cycle requires start and end dates");
        }
        if (endDate.isBefore(startDate)) {
            throw new InvalidEconomicCycleException(
                    "Economic cycle end_date " + endDate + " is before start_date " + startDate);
        }
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    /**
     * Period key of the cycle, e.g. {@code 2025-11} for the cycle ending 2025-11-18.
     */
    public String periodKey() {
        return endDate.format(PERIOD_KEY);
    }
}
