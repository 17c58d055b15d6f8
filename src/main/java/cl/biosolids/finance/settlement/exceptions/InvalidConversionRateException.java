package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when the UF value used for currency conversion is not positive.
 */
public class InvalidConversionRateException extends SettlementException {

    public InvalidConversionRateException(String message) {
        super(message);
    }
}
