package org.nowstart.folio.data.type;

public enum ReportScope {
    ALL,
    PERSONAL,
    TRUST,
    TAX_ADVANTAGED;

    public boolean includes(TaxpayerType taxpayerType, AccountType accountType) {
        return switch (this) {
            case ALL -> true;
            case TAX_ADVANTAGED -> accountType == AccountType.TAX_ADVANTAGED;
            case PERSONAL -> taxpayerType == TaxpayerType.PERSONAL && accountType != AccountType.TAX_ADVANTAGED;
            case TRUST -> taxpayerType == TaxpayerType.TRUST && accountType != AccountType.TAX_ADVANTAGED;
        };
    }
}
