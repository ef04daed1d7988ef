package org.nowstart.folio.data.type;

public enum WashSaleStatus {
    APPLIED,
    FLAGGED
}
