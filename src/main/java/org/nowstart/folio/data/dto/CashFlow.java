package org.nowstart.folio.data.dto;

import java.time.LocalDate;

/**
 * Dated cash amount. Portfolio perspective unless stated otherwise: positive is money into the portfolio.
 */
public record CashFlow(
        LocalDate date,
        double amount
) {
}
