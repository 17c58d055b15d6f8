package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidTariffException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

/**
 * A client's price for one billing concept within a validity window.
 * {@code validTo} is null for an open-ended tariff; both bounds are inclusive.
 */
public record ClientTariff(
        long clientId,
        BillingConcept concept,
        BigDecimal ratePerTon,
        BigDecimal minWeightTons,
        LocalDate validFrom,
        LocalDate validTo
) {

    public ClientTariff {
        if (concept == null) {
            throw new InvalidTariffException("concept is required for client " + clientId);
        }
        if (ratePerTon == null || ratePerTon.signum() <= 0) {
            throw new InvalidTariffException(concept + " rate_per_ton must be positive for client " + clientId + ", got " + ratePerTon);
        }
        if (minWeightTons == null || minWeightTons.signum() < 0) {
            throw new InvalidTariffException(concept + " min_weight_tons must be zero or positive for client " + clientId);
        }
        if (validFrom == null) {
            throw new InvalidTariffException(concept + " valid_from is required for client " + clientId);
        }
        if (validTo != null && validTo.isBefore(validFrom)) {
            throw new InvalidTariffException(concept + " valid_to " + validTo + " is before valid_from " + validFrom);
        }
    }

    public Optional<LocalDate> validUntil() {
        return Optional.ofNullable(validTo);
    }

    public boolean isActiveOn(LocalDate date) {
        return !date.isBefore(validFrom) && (validTo == null || !date.isAfter(validTo));
    }

    public BigDecimal billableWeight(BigDecimal actualWeightTons) {
        return actualWeightTons.max(minWeightTons);
    }
}
