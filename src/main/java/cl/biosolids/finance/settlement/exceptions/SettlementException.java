package cl.biosolids.finance.settlement.exceptions;

/**
 * Base exception for the settlement engine.
 * Every failure is an input-validation or missing-configuration problem:
 * retrying with the same inputs always fails the same way.
 */
public class SettlementException extends RuntimeException {

    public SettlementException(String message) {
        super(message);
    }
}
