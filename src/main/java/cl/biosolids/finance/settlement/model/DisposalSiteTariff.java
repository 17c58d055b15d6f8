package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidTariffException;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * What a disposal site charges per ton received. Validity bounds are inclusive,
 * a null {@code validTo} never expires.
 */
public record DisposalSiteTariff(
        long siteId,
        BigDecimal ratePerTon,
        BigDecimal minWeightTons,
        LocalDate validFrom,
        LocalDate validTo
) {

    public DisposalSiteTariff {
        if (ratePerTon == null || ratePerTon.signum() <= 0) {
            throw new InvalidTariffException("Disposal rate_per_ton must be positive for site " + siteId + ", got " + ratePerTon);
        }
        if (minWeightTons == null || minWeightTons.signum() < 0) {
            throw new InvalidTariffException("Disposal min_weight_tons must be zero or positive for site " + siteId);
        }
        if (validFrom == null) {
            throw new InvalidTariffException("Disposal valid_from is required for site " + siteId);
        }
        if (validTo != null && validTo.isBefore(validFrom)) {
            throw new InvalidTariffException("Disposal valid_to " + validTo + " is before valid_from " + validFrom + " for site " + siteId);
        }
    }

    public boolean isActiveOn(LocalDate date) {
        return !date.isBefore(validFrom) && (validTo == null || !date.isAfter(validTo));
    }
}
