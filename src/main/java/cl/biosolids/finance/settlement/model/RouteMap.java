package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidRouteException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Distance matrix indexed by {@link RouteKey}. Callers that price many trips against the
 * same matrix should build it once and reuse it.
 */
public final class RouteMap {

    private final Map<RouteKey, DistanceRoute> routes;

    private RouteMap(Map<RouteKey, DistanceRoute> routes) {
        this.routes = Collections.unmodifiableMap(routes);
    }

    /**
     * @throws InvalidRouteException on a null entry, or if two routes share origin, destination and segment flag
     */
    public static RouteMap of(Collection<DistanceRoute> routes) {
        Map<RouteKey, DistanceRoute> index = new LinkedHashMap<>();
        if (routes != null) {
            for (DistanceRoute route : routes) {
                if (route == null) {
                    throw new InvalidRouteException("Distance matrix contains a null route");
                }
                DistanceRoute previous = index.putIfAbsent(route.key(), route);
                if (previous != null) {
                    throw new InvalidRouteException("Duplicate route in distance matrix: " + route.key()
                            + " (" + previous.distanceKm() + " km and " + route.distanceKm() + " km)");
                }
            }
        }
        return new RouteMap(index);
    }

    public Optional<DistanceRoute> find(long originId, long destinationId, boolean segmentLink) {
        return Optional.ofNullable(routes.get(new RouteKey(originId, destinationId, segmentLink)));
    }

    public DistanceRoute require(long originId, long destinationId, boolean segmentLink) {
        return find(originId, destinationId, segmentLink).orElseThrow(() -> new InvalidRouteException(
                "No " + (segmentLink ? "link" : "direct") + " route from " + originId + " to " + destinationId
                        + " in the distance matrix"));
    }

    public int size() {
        return routes.size();
    }
}
