package cl.biosolids.finance.settlement.pricing;

import cl.biosolids.finance.settlement.exceptions.EmptyLoadListException;
import cl.biosolids.finance.settlement.exceptions.InvalidConversionRateException;
import cl.biosolids.finance.settlement.exceptions.InvalidEconomicCycleException;
import cl.biosolids.finance.settlement.exceptions.InvalidRouteException;
import cl.biosolids.finance.settlement.exceptions.MissingTariffException;
import cl.biosolids.finance.settlement.exceptions.UnsupportedTripShapeException;
import cl.biosolids.finance.settlement.model.DistanceRoute;
import cl.biosolids.finance.settlement.model.EconomicCycle;
import cl.biosolids.finance.settlement.model.LoadProjection;
import cl.biosolids.finance.settlement.model.RouteMap;
import cl.biosolids.finance.settlement.model.TariffRule;
import cl.biosolids.finance.settlement.model.VehicleType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Transport cost for single and linked trips.
 *
 * Rates, distances and weights follow the contractor settlement examples:
 * 0.027 UF/t-km, fuel at 1200 against a 1000 reference (factor 1.2).
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransportCostCalculator")
class TransportCostCalculatorTest {

    @Spy
    private FuelAdjustmentService fuelAdjustmentService = new FuelAdjustmentService();

    @InjectMocks
    private TransportCostCalculator calculator;

    private SimpleMeterRegistry registry;

    private static final BigDecimal RATE = new BigDecimal("0.027");

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        calculator.registry = registry;
    }

    // ============================================================================
    // Test Data Builders
    // ============================================================================

    private static TariffRule tariff(String minWeight) {
        return new TariffRule(RATE, new BigDecimal(minWeight), VehicleType.BATEA, new BigDecimal("1000"));
    }

    private static EconomicCycle cycle(String fuelPrice) {
        return new EconomicCycle(new BigDecimal("37000"), new BigDecimal(fuelPrice), true,
                LocalDate.of(2025, 11, 19), LocalDate.of(2025, 12, 18));
    }

    private static LoadProjection load(String weight, long origin, long destination) {
        return new LoadProjection(weight == null ? null : new BigDecimal(weight), origin, destination, false);
    }

    private static DistanceRoute direct(long origin, long destination, String km) {
        return new DistanceRoute(origin, destination, new BigDecimal(km), false);
    }

    private static DistanceRoute link(long origin, long destination, String km) {
        return new DistanceRoute(origin, destination, new BigDecimal(km), true);
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    // ============================================================================
    // Single load
    // ============================================================================

    @Nested
    @DisplayName("single load")
    class SingleLoad {

        @Test
        @DisplayName("weight above minimum: 0.027 x 50 x 20 x 1.2 = 32.4 UF")
        void weightAboveMinimum() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("20", 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200"));

            assertAmount("32.4", result.totalCostUf());
            assertAmount("1.2", result.adjustmentFactor());
            assertAmount("20", result.appliedWeightTons());
            assertAmount("1198800", result.toCurrency(new BigDecimal("37000")));
        }

        @Test
        @DisplayName("weight below minimum bills the guaranteed 15 t: 24.3 UF")
        void weightBelowMinimumIsClamped() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("10", 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200"));

            assertAmount("24.3", result.totalCostUf());
            assertAmount("15", result.appliedWeightTons());
        }

        @Test
        void missingWeightBillsTheMinimum() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load(null, 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1000"));

            assertAmount("15", result.appliedWeightTons());
            assertAmount("20.25", result.totalCostUf());
        }

        @Test
        void breakdownHoldsTheDirectLeg() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("20", 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200"));

            assertEquals(1, result.segmentBreakdown().size());
            BreakdownLine line = result.segmentBreakdown().get(0);
            assertEquals(SegmentKind.DIRECT_HAUL, line.kind());
            assertEquals("Tramo Único (1→10)", line.label());
            assertAmount("32.4", line.value());
            assertFalse(result.isLinked());
        }

        @Test
        @DisplayName("a segment link with the same endpoints is not a direct route")
        void segmentLinkDoesNotServeDirectTrip() {
            InvalidRouteException ex = assertThrows(InvalidRouteException.class, () -> calculator.calculateTripCost(
                    List.of(load("20", 1, 10)), List.of(link(1, 10, "50")), tariff("15"), cycle("1200")));

            assertTrue(ex.getMessage().contains("1"));
            assertTrue(ex.getMessage().contains("10"));
            assertTrue(ex.getMessage().contains("direct"));
        }

        @Test
        void missingRouteNamesOriginAndDestination() {
            InvalidRouteException ex = assertThrows(InvalidRouteException.class, () -> calculator.calculateTripCost(
                    List.of(load("20", 7, 99)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200")));

            assertTrue(ex.getMessage().contains("from 7 to 99"));
        }
    }

    // ============================================================================
    // Linked trips
    // ============================================================================

    @Nested
    @DisplayName("linked trip")
    class LinkedTrip {

        private final List<DistanceRoute> routes = List.of(link(1, 2, "30"), direct(2, 20, "40"));

        @Test
        @DisplayName("pickup 10 t clamped to 15 t over 30 km + main haul 18 t over 40 km = 37.908 UF")
        void twoLegsWithFuelAdjustment() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("10", 1, 20), load("8", 2, 20)), routes, tariff("15"), cycle("1200"));

            assertAmount("14.58", result.amountFor(SegmentKind.PICKUP).orElseThrow());
            assertAmount("23.328", result.amountFor(SegmentKind.MAIN_HAUL).orElseThrow());
            assertAmount("37.908", result.totalCostUf());
            assertAmount("18", result.appliedWeightTons());
            assertTrue(result.isLinked());
        }

        @Test
        void twoLegsWithoutFuelChange() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("10", 1, 20), load("8", 2, 20)), routes, tariff("7"), cycle("1000"));

            assertAmount("8.1", result.amountFor(SegmentKind.PICKUP).orElseThrow());
            assertAmount("19.44", result.amountFor(SegmentKind.MAIN_HAUL).orElseThrow());
            assertAmount("27.54", result.totalCostUf());
        }

        @Test
        @DisplayName("total equals the sum of both legs")
        void totalIsAdditive() {
            for (String[] weights : new String[][]{{"3", "2"}, {"10", "8"}, {"22.5", "0.75"}, {"40", "35"}}) {
                TripCostResult result = calculator.calculateTripCost(
                        List.of(load(weights[0], 1, 20), load(weights[1], 2, 20)), routes, tariff("15"), cycle("1130"));

                BigDecimal legs = result.amountFor(SegmentKind.PICKUP).orElseThrow()
                        .add(result.amountFor(SegmentKind.MAIN_HAUL).orElseThrow());
                assertEquals(0, legs.compareTo(result.totalCostUf()));
            }
        }

        @Test
        @DisplayName("main haul weight is floored by the minimum too")
        void consolidatedWeightClamped() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("3", 1, 20), load("2", 2, 20)), routes, tariff("15"), cycle("1000"));

            assertAmount("15", result.appliedWeightTons());
            assertAmount("15", result.amountFor(SegmentKind.CONSOLIDATED_WEIGHT_TONS).orElseThrow());
        }

        @Test
        void breakdownOrderAndLabels() {
            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("10", 1, 20), load("8", 2, 20)), routes, tariff("15"), cycle("1200"));

            List<String> labels = new ArrayList<>();
            result.segmentBreakdown().forEach(line -> labels.add(line.label()));
            assertEquals(List.of("Tramo 1: Pickup (1→2)", "Tramo 2: Main Haul (2→20)",
                    "total_distance_km", "consolidated_weight_tons"), labels);
            assertAmount("70", result.amountFor(SegmentKind.TOTAL_DISTANCE_KM).orElseThrow());
        }

        @Test
        @DisplayName("final destination is taken from the last load")
        void destinationOfLastLoad() {
            List<DistanceRoute> toPlant = List.of(link(1, 2, "30"), direct(2, 20, "40"), direct(2, 30, "12"));

            TripCostResult result = calculator.calculateTripCost(
                    List.of(load("10", 1, 20), load("8", 2, 30)), toPlant, tariff("15"), cycle("1000"));

            assertEquals("Tramo 2: Main Haul (2→30)", result.segmentBreakdown().get(1).label());
            assertAmount("12", result.amountFor(SegmentKind.TOTAL_DISTANCE_KM).orElseThrow().subtract(new BigDecimal("30")));
        }

        @Test
        void missingPickupLinkFails() {
            InvalidRouteException ex = assertThrows(InvalidRouteException.class, () -> calculator.calculateTripCost(
                    List.of(load("10", 1, 20), load("8", 2, 20)), List.of(direct(1, 2, "30"), direct(2, 20, "40")),
                    tariff("15"), cycle("1200")));

            assertTrue(ex.getMessage().contains("link route from 1 to 2"));
        }

        @Test
        void missingMainHaulFails() {
            InvalidRouteException ex = assertThrows(InvalidRouteException.class, () -> calculator.calculateTripCost(
                    List.of(load("10", 1, 20), load("8", 2, 20)), List.of(link(1, 2, "30")), tariff("15"), cycle("1200")));

            assertTrue(ex.getMessage().contains("direct route from 2 to 20"));
        }

        @Test
        @DisplayName("three loads are rejected")
        void moreThanTwoLoadsRejected() {
            List<LoadProjection> loads = List.of(load("10", 1, 20), load("8", 2, 20), load("5", 3, 20));

            assertThrows(UnsupportedTripShapeException.class,
                    () -> calculator.calculateTripCost(loads, routes, tariff("15"), cycle("1200")));
        }
    }

    // ============================================================================
    // Preconditions and side effects
    // ============================================================================

    @Test
    void emptyLoadListFails() {
        assertThrows(EmptyLoadListException.class,
                () -> calculator.calculateTripCost(List.of(), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200")));
        assertThrows(EmptyLoadListException.class,
                () -> calculator.calculateTripCost(null, List.of(direct(1, 10, "50")), tariff("15"), cycle("1200")));
        verify(fuelAdjustmentService, never()).calculateFuelFactor(any(), any());
    }

    @Test
    void missingTariffFails() {
        assertThrows(MissingTariffException.class, () -> calculator.calculateTripCost(
                List.of(load("20", 1, 10)), List.of(direct(1, 10, "50")), null, cycle("1200")));
    }

    @Test
    @DisplayName("load and tariff checks run before the distance matrix is indexed")
    void inputChecksPrecedeRouteIndexing() {
        List<DistanceRoute> duplicated = List.of(direct(1, 10, "50"), direct(1, 10, "50"));
        List<DistanceRoute> withNull = Arrays.asList(direct(1, 10, "50"), null);

        assertThrows(EmptyLoadListException.class,
                () -> calculator.calculateTripCost(List.of(), duplicated, tariff("15"), cycle("1200")));
        assertThrows(MissingTariffException.class,
                () -> calculator.calculateTripCost(List.of(load("20", 1, 10)), withNull, null, cycle("1200")));
        assertThrows(InvalidEconomicCycleException.class,
                () -> calculator.calculateTripCost(List.of(load("20", 1, 10)), duplicated, tariff("15"), null));
    }

    @Test
    void nullRouteEntryRejected() {
        List<DistanceRoute> withNull = Arrays.asList(direct(1, 10, "50"), null);

        InvalidRouteException ex = assertThrows(InvalidRouteException.class,
                () -> calculator.calculateTripCost(List.of(load("20", 1, 10)), withNull, tariff("15"), cycle("1200")));
        assertTrue(ex.getMessage().contains("null route"));
    }

    @Test
    @DisplayName("a null load is rejected with its position")
    void nullLoadRejected() {
        List<LoadProjection> loads = Arrays.asList(load("10", 1, 20), null);

        EmptyLoadListException ex = assertThrows(EmptyLoadListException.class, () -> calculator.calculateTripCost(
                loads, List.of(link(1, 2, "30"), direct(2, 20, "40")), tariff("15"), cycle("1200")));
        assertTrue(ex.getMessage().contains("index 1"));
        verify(fuelAdjustmentService, never()).calculateFuelFactor(any(), any());
    }

    @Test
    @DisplayName("the linked total is the sum of the monetary breakdown lines only")
    void totalSumsMonetaryLines() {
        TripCostResult result = calculator.calculateTripCost(List.of(load("10", 1, 20), load("8", 2, 20)),
                List.of(link(1, 2, "30"), direct(2, 20, "40")), tariff("15"), cycle("1200"));

        BigDecimal monetary = result.segmentBreakdown().stream()
                .filter(line -> line.kind().isMonetary())
                .map(BreakdownLine::value)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertAmount(monetary.toPlainString(), result.totalCostUf());
        assertEquals(2, result.segmentBreakdown().stream().filter(line -> !line.kind().isMonetary()).count());
    }

    @Test
    @DisplayName("the fuel factor is computed once per linked trip")
    void fuelFactorComputedOnce() {
        calculator.calculateTripCost(List.of(load("10", 1, 20), load("8", 2, 20)),
                List.of(link(1, 2, "30"), direct(2, 20, "40")), tariff("15"), cycle("1200"));

        verify(fuelAdjustmentService, times(1)).calculateFuelFactor(new BigDecimal("1200"), new BigDecimal("1000"));
    }

    @Test
    void prebuiltRouteMapGivesSameResult() {
        RouteMap routeMap = RouteMap.of(List.of(direct(1, 10, "50")));

        TripCostResult fromMap = calculator.calculateTripCost(List.of(load("20", 1, 10)), routeMap, tariff("15"), cycle("1200"));
        TripCostResult fromList = calculator.calculateTripCost(List.of(load("20", 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200"));

        assertEquals(0, fromMap.totalCostUf().compareTo(fromList.totalCostUf()));
    }

    @Test
    @DisplayName("billable weight never drops below the tariff minimum")
    void minimumWeightFloor() {
        List<DistanceRoute> routes = List.of(direct(1, 10, "50"), link(1, 2, "30"), direct(2, 10, "40"));
        for (String min : new String[]{"0", "7", "15", "25"}) {
            for (String weight : new String[]{"0", "1.5", "7", "14.99", "15", "30"}) {
                TripCostResult single = calculator.calculateTripCost(List.of(load(weight, 1, 10)), routes, tariff(min), cycle("1000"));
                TripCostResult linked = calculator.calculateTripCost(
                        List.of(load(weight, 1, 10), load(weight, 2, 10)), routes, tariff(min), cycle("1000"));

                assertTrue(single.appliedWeightTons().compareTo(new BigDecimal(min)) >= 0);
                assertTrue(linked.appliedWeightTons().compareTo(new BigDecimal(min)) >= 0);
            }
        }
    }

    @Test
    void inputsAreLeftUntouched() {
        List<LoadProjection> loads = new ArrayList<>(List.of(load("10", 1, 20), load("8", 2, 20)));
        List<DistanceRoute> routes = new ArrayList<>(List.of(link(1, 2, "30"), direct(2, 20, "40")));
        List<LoadProjection> loadsBefore = List.copyOf(loads);
        List<DistanceRoute> routesBefore = List.copyOf(routes);

        calculator.calculateTripCost(loads, routes, tariff("15"), cycle("1200"));

        assertEquals(loadsBefore, loads);
        assertEquals(routesBefore, routes);
    }

    @Test
    void countsCalculationsByShape() {
        calculator.calculateTripCost(List.of(load("20", 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200"));
        calculator.calculateTripCost(List.of(load("10", 1, 20), load("8", 2, 20)),
                List.of(link(1, 2, "30"), direct(2, 20, "40")), tariff("15"), cycle("1200"));

        assertEquals(1.0, registry.get("settlement.trip_cost.calculated").tag("shape", "single").counter().count());
        assertEquals(1.0, registry.get("settlement.trip_cost.calculated").tag("shape", "linked").counter().count());
    }

    @Test
    void conversionRequiresPositiveUfValue() {
        TripCostResult result = calculator.calculateTripCost(
                List.of(load("20", 1, 10)), List.of(direct(1, 10, "50")), tariff("15"), cycle("1200"));

        assertThrows(InvalidConversionRateException.class, () -> result.toCurrency(BigDecimal.ZERO));
        assertThrows(InvalidConversionRateException.class, () -> result.toCurrency(new BigDecimal("-1")));
        assertThrows(InvalidConversionRateException.class, () -> result.toCurrency(null));
    }
}
