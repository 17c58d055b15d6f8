package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.InvalidConversionRateException;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * Cost paid to a disposal site for receiving one load.
 */
@JsonPropertyOrder({"siteId", "billableWeightTons", "ratePerTon", "totalUf"})
public record DisposalCostResult(long siteId, BigDecimal billableWeightTons, BigDecimal ratePerTon, BigDecimal totalUf) {

    public BigDecimal toCurrency(BigDecimal ufValue) {
        if (ufValue == null || ufValue.signum() <= 0) {
            throw new InvalidConversionRateException("uf_value must be positive to convert disposal cost for site " + siteId + ", got " + ufValue);
        }
        return totalUf.multiply(ufValue);
    }
}
