package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when a tariff violates its construction invariants.
 */
public class InvalidTariffException extends SettlementException {

    public InvalidTariffException(String message) {
        super(message);
    }
}
