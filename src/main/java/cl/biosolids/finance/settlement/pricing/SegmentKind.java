package cl.biosolids.finance.settlement.pricing;

public enum SegmentKind {
    DIRECT_HAUL(true),
    PICKUP(true),
    MAIN_HAUL(true),
    TOTAL_DISTANCE_KM(false),
    CONSOLIDATED_WEIGHT_TONS(false);

    private final boolean monetary;

    SegmentKind(boolean monetary) {
        this.monetary = monetary;
    }

    /**
     * True when the line value is an amount in UF, false for metadata (km, tons).
     */
    public boolean isMonetary() {
        return monetary;
    }
}
