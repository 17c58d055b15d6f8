package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.InvalidConversionRateException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Cost owed to the contractor for one trip. Amounts are in UF.
 * {@code appliedWeightTons} is the heaviest leg weight (the main haul on linked trips).
 */
@JsonPropertyOrder({"totalCostUf", "adjustmentFactor", "appliedWeightTons", "segmentBreakdown"})
public record TripCostResult(
        BigDecimal totalCostUf,
        BigDecimal adjustmentFactor,
        BigDecimal appliedWeightTons,
        List<BreakdownLine> segmentBreakdown
) {

    public TripCostResult {
        segmentBreakdown = List.copyOf(segmentBreakdown);
    }

    public BigDecimal toCurrency(BigDecimal ufValue) {
        if (ufValue == null || ufValue.signum() <= 0) {
            throw new InvalidConversionRateException("uf_value must be positive to convert trip cost, got " + ufValue);
        }
        return totalCostUf.multiply(ufValue);
    }

    public Optional<BigDecimal> amountFor(SegmentKind kind) {
        return segmentBreakdown.stream()
                .filter(line -> line.kind() == kind)
                .map(BreakdownLine::value)
                .findFirst();
    }

    @JsonIgnore
    public boolean isLinked() {
        return amountFor(SegmentKind.PICKUP).isPresent();
    }
}
