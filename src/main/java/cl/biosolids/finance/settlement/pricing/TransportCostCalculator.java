package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.EmptyLoadListException;
import cl.biosolids.finance.settlement.exceptions.InvalidEconomicCycleException;
import cl.biosolids.finance.settlement.exceptions.MissingTariffException;
import cl.biosolids.finance.settlement.exceptions.UnsupportedTripShapeException;
import cl.biosolids.finance.settlement.model.DistanceRoute;
import cl.biosolids.finance.settlement.model.EconomicCycle;
import cl.biosolids.finance.settlement.model.LoadProjection;
import cl.biosolids.finance.settlement.model.RouteMap;
import cl.biosolids.finance.settlement.model.TariffRule;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes what is owed to a transport contractor for one trip.
 *
 * A trip carrying one load is priced over its direct route. A trip carrying two loads is a
 * linked trip: the truck takes the first load to the second load's origin (pickup leg,
 * a segment link in the distance matrix) and then hauls both loads to the final
 * destination (main haul). Each leg bills {@code rate x km x max(weight, minimum) x fuel factor}.
 */
@JBossLog
@ApplicationScoped
public class TransportCostCalculator {

    static final int MAX_LINKED_LOADS = 2;

    @Inject FuelAdjustmentService fuelAdjustmentService;
    @Inject MeterRegistry registry;

    @Timed(value = "settlement.trip_cost.duration", description = "Transport cost calculation timing")
    public TripCostResult calculateTripCost(List<LoadProjection> loads, List<DistanceRoute> routes, TariffRule tariff, EconomicCycle cycle) {
        requirePriceable(loads, tariff, cycle);
        return price(loads, RouteMap.of(routes), tariff, cycle);
    }

    @Timed(value = "settlement.trip_cost.duration", description = "Transport cost calculation timing")
    public TripCostResult calculateTripCost(List<LoadProjection> loads, RouteMap routeMap, TariffRule tariff, EconomicCycle cycle) {
        requirePriceable(loads, tariff, cycle);
        return price(loads, routeMap, tariff, cycle);
    }

    private static void requirePriceable(List<LoadProjection> loads, TariffRule tariff, EconomicCycle cycle) {
        if (loads == null || loads.isEmpty()) {
            log.warn("Trip cost requested without loads");
            throw new EmptyLoadListException("A trip needs at least one load to be priced");
        }
        for (int i = 0; i < loads.size(); i++) {
            if (loads.get(i) == null) {
                log.warnf("Trip cost requested with a null load at index %d", i);
                throw new EmptyLoadListException("Load at index " + i + " of the trip is null");
            }
        }
        if (tariff == null) {
            log.warnf("Trip cost requested without tariff rule for %d load(s)", loads.size());
            throw new MissingTariffException("A contractor tariff rule is required to price the trip");
        }
        if (cycle == null) {
            log.warn("Trip cost requested without economic cycle");
            throw new InvalidEconomicCycleException("An economic cycle is required to price the trip");
        }
        if (loads.size() > MAX_LINKED_LOADS) {
            log.warnf("Rejected linked trip with %d loads", loads.size());
            throw new UnsupportedTripShapeException("Linked trips support at most " + MAX_LINKED_LOADS
                    + " loads (pickup + main haul), got " + loads.size());
        }
    }

    private TripCostResult price(List<LoadProjection> loads, RouteMap routeMap, TariffRule tariff, EconomicCycle cycle) {
        // one factor for every leg of the trip
        BigDecimal fuelFactor = fuelAdjustmentService.calculateFuelFactor(cycle.fuelPrice(), tariff.baseFuelPrice());

        TripCostResult result = loads.size() == 1
                ? singleTrip(loads.get(0), routeMap, tariff, fuelFactor)
                : linkedTrip(loads, routeMap, tariff, fuelFactor);

        registry.counter("settlement.trip_cost.calculated", "shape", loads.size() == 1 ? "single" : "linked").increment();
        log.debugf("Trip cost %s UF (%s, factor %s, weight %s t)",
                result.totalCostUf().toPlainString(), tariff.vehicleType().getDisplayName(), fuelFactor.toPlainString(),
                result.appliedWeightTons().toPlainString());
        return result;
    }

    private TripCostResult singleTrip(LoadProjection load, RouteMap routeMap, TariffRule tariff, BigDecimal fuelFactor) {
        DistanceRoute route = routeMap.require(load.originId(), load.destinationId(), false);
        BigDecimal weight = tariff.billableWeight(load.netWeightTons());
        BigDecimal cost = legCost(tariff, route, weight, fuelFactor);

        List<BreakdownLine> breakdown = List.of(new BreakdownLine(SegmentKind.DIRECT_HAUL,
                String.format("Tramo Único (%d→%d)", load.originId(), load.destinationId()), cost));
        return new TripCostResult(cost, fuelFactor, weight, breakdown);
    }

    private TripCostResult linkedTrip(List<LoadProjection> loads, RouteMap routeMap, TariffRule tariff, BigDecimal fuelFactor) {
        LoadProjection first = loads.get(0);
        LoadProjection second = loads.get(1);
        long finalDestination = loads.get(loads.size() - 1).destinationId();

        // pickup leg: only the first load is on the truck
        DistanceRoute pickupRoute = routeMap.require(first.originId(), second.originId(), true);
        BigDecimal pickupWeight = tariff.billableWeight(first.netWeightTons());
        BigDecimal pickupCost = legCost(tariff, pickupRoute, pickupWeight, fuelFactor);

        // main haul: every load rides together
        DistanceRoute mainRoute = routeMap.require(second.originId(), finalDestination, false);
        BigDecimal consolidated = loads.stream().map(LoadProjection::weightOrZero).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal mainWeight = tariff.billableWeight(consolidated);
        BigDecimal mainCost = legCost(tariff, mainRoute, mainWeight, fuelFactor);

        List<BreakdownLine> breakdown = new ArrayList<>();
        breakdown.add(new BreakdownLine(SegmentKind.PICKUP,
                String.format("Tramo 1: Pickup (%d→%d)", first.originId(), second.originId()), pickupCost));
        breakdown.add(new BreakdownLine(SegmentKind.MAIN_HAUL,
                String.format("Tramo 2: Main Haul (%d→%d)", second.originId(), finalDestination), mainCost));
        breakdown.add(new BreakdownLine(SegmentKind.TOTAL_DISTANCE_KM, "total_distance_km",
                pickupRoute.distanceKm().add(mainRoute.distanceKm())));
        breakdown.add(new BreakdownLine(SegmentKind.CONSOLIDATED_WEIGHT_TONS, "consolidated_weight_tons", mainWeight));

        return new TripCostResult(monetaryTotal(breakdown), fuelFactor, mainWeight, breakdown);
    }

    private static BigDecimal monetaryTotal(List<BreakdownLine> breakdown) {
        return breakdown.stream()
                .filter(line -> line.kind().isMonetary())
                .map(BreakdownLine::value)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal legCost(TariffRule tariff, DistanceRoute route, BigDecimal weight, BigDecimal fuelFactor) {
        return tariff.baseRatePerTonKm()
                .multiply(route.distanceKm())
                .multiply(weight)
                .multiply(fuelFactor);
    }
}
