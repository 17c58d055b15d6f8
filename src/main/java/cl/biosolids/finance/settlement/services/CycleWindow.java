package cl.biosolids.finance.settlement.services;

import java.time.LocalDate;

/**
 * Inclusive date range of one billing cycle.
 */
public record CycleWindow(LocalDate startDate, LocalDate endDate) {
}
