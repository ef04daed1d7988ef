package org.nowstart.folio.data.dto;

public record RiskStats(
        Double volatility,
        Double sharpe,
        Double sortino,
        Double maxDrawdown,
        Double beta,
        Double alpha,
        Double correlation
) {
    public static RiskStats empty() {
        return new RiskStats(null, null, null, null, null, null, null);
    }
}
