package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown for linked trips with more loads than the pickup/main-haul model supports.
 */
public class UnsupportedTripShapeException extends SettlementException {

    public UnsupportedTripShapeException(String message) {
        super(message);
    }
}
