package cl.biosolids.finance.settlement.model;

import java.math.BigDecimal;

/**
 * The fields of a logistics load the settlement engine reads.
 * Owned by the logistics module; the engine never writes back.
 *
 * @param netWeightTons   net weight in tons, may be null for loads not yet weighed
 * @param originId        origin facility or treatment plant id
 * @param destinationId   destination site or treatment plant id
 * @param goesToTreatment whether the biosolids pass through a treatment plant
 * @param destinationKind what kind of node {@code destinationId} refers to
 */
public record LoadProjection(
        BigDecimal netWeightTons,
        long originId,
        long destinationId,
        boolean goesToTreatment,
        DestinationKind destinationKind
) {

    public LoadProjection {
        if (destinationKind == null) {
            destinationKind = DestinationKind.DISPOSAL_SITE;
        }
    }

    public LoadProjection(BigDecimal netWeightTons, long originId, long destinationId, boolean goesToTreatment) {
        this(netWeightTons, originId, destinationId, goesToTreatment, DestinationKind.DISPOSAL_SITE);
    }

    public BigDecimal weightOrZero() {
        return netWeightTons != null ? netWeightTons : BigDecimal.ZERO;
    }
}
