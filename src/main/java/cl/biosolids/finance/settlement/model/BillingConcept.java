package cl.biosolids.finance.settlement.model;

/**
 * Concepts a client is billed for on each load.
 */
public enum BillingConcept {
    TRANSPORTE(true),
    DISPOSICION(true),
    TRATAMIENTO(false); // only for loads routed through a treatment plant

    private final boolean mandatory;

    BillingConcept(boolean mandatory) {
        this.mandatory = mandatory;
    }

    public boolean isMandatory() {
        return mandatory;
    }
}
