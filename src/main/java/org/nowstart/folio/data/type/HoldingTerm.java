package org.nowstart.folio.data.type;

public enum HoldingTerm {
    ST,
    LT,
    UNKNOWN
}
