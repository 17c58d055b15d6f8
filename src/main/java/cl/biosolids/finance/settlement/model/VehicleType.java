package cl.biosolids.finance.settlement.model;

import cl.biosolids.finance.settlement.exceptions.InvalidTariffException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Vehicle configurations a contractor tariff can be defined for.
 */
public enum VehicleType {
    BATEA("Batea (carga directa)", new BigDecimal("15")),
    AMPLIROLL_SIMPLE("Ampliroll (camión solo)", new BigDecimal("7")),
    AMPLIROLL_CARRO("Ampliroll (camión + carro)", new BigDecimal("7"));

    private final String displayName;
    private final BigDecimal defaultMinWeightTons;

    VehicleType(String displayName, BigDecimal defaultMinWeightTons) {
        this.displayName = displayName;
        this.defaultMinWeightTons = defaultMinWeightTons;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Guaranteed minimum weight used when no override is configured.
     */
    public BigDecimal getDefaultMinWeightTons() {
        return defaultMinWeightTons;
    }

    /**
     * Resolves a stored vehicle code, ignoring case and surrounding blanks.
     *
     * @throws InvalidTariffException if the code is blank or unknown
     */
    public static VehicleType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidTariffException("Vehicle type code is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (VehicleType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new InvalidTariffException("Unknown vehicle type: " + code);
    }
}
