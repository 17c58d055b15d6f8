package cl.biosolids.finance.settlement.pricing;

import java.math.BigDecimal;

/**
 * One line of a trip cost breakdown.
 *
 * @param kind  what the line measures
 * @param label display label, e.g. {@code Tramo 1: Pickup (1→2)}
 * @param value UF for monetary kinds, km or tons otherwise
 */
public record BreakdownLine(SegmentKind kind, String label, BigDecimal value) {
}
