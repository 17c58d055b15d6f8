package cl.biosolids.finance.settlement.services;

import cl.biosolids.finance.settlement.config.SettlementConfig;
import cl.biosolids.finance.settlement.exceptions.InvalidEconomicCycleException;
import cl.biosolids.finance.settlement.model.EconomicCycle;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Billing cycles run from the day after the closing day of the previous month up to the
 * closing day of the settlement month (19th to 18th with the default closing day).
 */
@ApplicationScoped
public class BillingCycleCalendar {

    static final int MAX_CLOSING_DAY = 28;

    @Inject SettlementConfig config;

    public CycleWindow windowFor(YearMonth period) {
        int closingDay = closingDay();
        LocalDate end = period.atDay(closingDay);
        LocalDate start = period.minusMonths(1).atDay(closingDay).plusDays(1);
        return new CycleWindow(start, end);
    }

    /**
     * Economic snapshot for a settlement month, spanning that month's cycle window.
     */
    public EconomicCycle cycleFor(YearMonth period, BigDecimal ufValue, BigDecimal fuelPrice, boolean closed) {
        CycleWindow window = windowFor(period);
        return new EconomicCycle(ufValue, fuelPrice, closed, window.startDate(), window.endDate());
    }

    public YearMonth periodContaining(LocalDate date) {
        YearMonth month = YearMonth.from(date);
        return date.getDayOfMonth() <= closingDay() ? month : month.plusMonths(1);
    }

    private int closingDay() {
        int day = config.cycle().closingDay();
        if (day < 1 || day > MAX_CLOSING_DAY) {
            throw new InvalidEconomicCycleException("settlement.cycle.closing-day must be between 1 and "
                    + MAX_CLOSING_DAY + ", got " + day);
        }
        return day;
    }
}
