package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidRouteException;

import java.math.BigDecimal;

/**
 * One edge of the distance matrix. A segment link is the intermediate pickup leg of a
 * linked trip, the other edges are terminal main-haul legs.
 */
public record DistanceRoute(long originId, long destinationId, BigDecimal distanceKm, boolean segmentLink) {

    public DistanceRoute {
        if (distanceKm == null || distanceKm.signum() <= 0) {
            throw new InvalidRouteException("distance_km must be positive for route "
                    + originId + "→" + destinationId + ", got " + distanceKm);
        }
    }

    public RouteKey key() {
        return new RouteKey(originId, destinationId, segmentLink);
    }
}
