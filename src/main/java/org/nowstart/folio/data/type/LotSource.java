package org.nowstart.folio.data.type;

public enum LotSource {
    RECONSTRUCTED,
    AUTHORITATIVE
}
