package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when a fuel price makes the adjustment formula undefined (base price zero or negative).
 */
public class InvalidFuelPriceException extends SettlementException {

    public InvalidFuelPriceException(String message) {
        super(message);
    }
}
