package cl.biosolids.finance.settlement.model;

/**
 * Lookup key of the distance matrix.
 */
public record RouteKey(long originId, long destinationId, boolean segmentLink) {

    @Override
    public String toString() {
        return (segmentLink ? "link " : "direct ") + originId + "→" + destinationId;
    }
}
