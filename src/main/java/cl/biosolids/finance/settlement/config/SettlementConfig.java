package cl.biosolids.finance.settlement.config;

import cl.biosolids.finance.settlement.model.VehicleType;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.math.BigDecimal;

/**
 * Settlement engine configuration.
 *
 * Billing cycles close on {@code cycle.closing-day} of every month and open the day after
 * in the previous month. CLP amounts in settlement summaries are rounded to
 * {@code currency.clp-scale} decimals.
 */
@ConfigMapping(prefix = "settlement")
public interface SettlementConfig {

    CycleConfig cycle();

    CurrencyConfig currency();

    VehicleConfig vehicle();

    default BigDecimal minimumWeightFor(VehicleType type) {
        return switch (type) {
            case BATEA -> vehicle().bateaMinWeightTons();
            case AMPLIROLL_SIMPLE -> vehicle().amplirollSimpleMinWeightTons();
            case AMPLIROLL_CARRO -> vehicle().amplirollCarroMinWeightTons();
        };
    }

    interface CycleConfig {
        @WithDefault("18")
        int closingDay();
    }

    interface CurrencyConfig {
        @WithDefault("0")
        int clpScale();
    }

    interface VehicleConfig {
        /**
         * Guaranteed minimum weights per vehicle configuration, in tons
         */
        @WithDefault("15")
        BigDecimal bateaMinWeightTons();

        @WithDefault("7")
        BigDecimal amplirollSimpleMinWeightTons();

        @WithDefault("7")
        BigDecimal amplirollCarroMinWeightTons();
    }
}
