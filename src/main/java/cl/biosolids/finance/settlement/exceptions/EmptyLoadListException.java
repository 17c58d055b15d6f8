package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when a trip cost is requested without any load.
 */
public class EmptyLoadListException extends SettlementException {

    public EmptyLoadListException(String message) {
        super(message);
    }
}
