package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when the distance matrix lacks a required route, or holds an invalid or duplicated one.
 */
public class InvalidRouteException extends SettlementException {

    public InvalidRouteException(String message) {
        super(message);
    }
}
