package org.nowstart.folio.data.type;

public enum CorporateActionType {
    SPLIT,
    REVERSE_SPLIT,
    MERGER,
    SPIN_OFF;

    public boolean isSplit() {
        return this == SPLIT || this == REVERSE_SPLIT;
    }
}
