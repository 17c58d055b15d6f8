package cl.biosolids.finance.settlement.model;

public enum DestinationKind {
    DISPOSAL_SITE,
    TREATMENT_PLANT
}
