package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when a load has no positive net weight.
 */
public class InvalidWeightException extends SettlementException {

    public InvalidWeightException(String message) {
        super(message);
    }
}
