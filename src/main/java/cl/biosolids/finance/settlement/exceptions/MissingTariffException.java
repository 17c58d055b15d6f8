package cl.biosolids.finance.settlement.exceptions;

/**
 * Thrown when no applicable tariff rule, client tariff or disposal site tariff exists for the calculation date.
 */
public class MissingTariffException extends SettlementException {

    public MissingTariffException(String message) {
        super(message);
    }
}
