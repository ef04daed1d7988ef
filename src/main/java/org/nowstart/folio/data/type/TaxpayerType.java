package org.nowstart.folio.data.type;

public enum TaxpayerType {
    PERSONAL,
    TRUST
}
