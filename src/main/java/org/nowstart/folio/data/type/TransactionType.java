package org.nowstart.folio.data.type;

public enum TransactionType {
    BUY,
    SELL,
    TRANSFER,
    FEE,
    WITHHOLDING,
    DIVIDEND,
    OTHER
}
