package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when an economic cycle or billing cycle window is missing or inconsistent.
 */
public class InvalidEconomicCycleException extends SettlementException {

    public InvalidEconomicCycleException(String message) {
        super(message);
    }
}
