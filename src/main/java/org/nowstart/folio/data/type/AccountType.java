package org.nowstart.folio.data.type;

public enum AccountType {
    TAXABLE,
    TAX_ADVANTAGED
}
