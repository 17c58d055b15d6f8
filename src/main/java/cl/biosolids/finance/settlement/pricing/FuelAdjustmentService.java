package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.InvalidFuelPriceException;
import jakarta.enterprise.context.ApplicationScoped;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Polynomial fuel adjustment of contractor tariffs.
 *
 * <pre>factor = 1 + (current - base) / base</pre>
 *
 * A factor above 1 means fuel got more expensive than the contractual reference and
 * costs scale up by the same proportion. The current price is not checked for
 * plausibility.
 */
@ApplicationScoped
public class FuelAdjustmentService {

    private static final MathContext MC = MathContext.DECIMAL128;

    public BigDecimal calculateFuelFactor(BigDecimal currentFuelPrice, BigDecimal baseFuelPrice) {
        if (baseFuelPrice == null || baseFuelPrice.signum() <= 0) {
            throw new InvalidFuelPriceException("base_fuel_price must be positive to compute the fuel factor, got " + baseFuelPrice);
        }
        if (currentFuelPrice == null) {
            throw new InvalidFuelPriceException("current_fuel_price is required to compute the fuel factor");
        }
        BigDecimal delta = currentFuelPrice.subtract(baseFuelPrice);
        return BigDecimal.ONE.add(delta.divide(baseFuelPrice, MC));
    }
}
