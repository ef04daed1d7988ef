package org.nowstart.folio.data.type;

public enum BenchmarkProviderType {
    STORED,
    YAHOO
}
