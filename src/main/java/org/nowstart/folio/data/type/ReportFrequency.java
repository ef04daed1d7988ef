package org.nowstart.folio.data.type;

public enum ReportFrequency {
    DAILY(252.0),
    MONTH_END(12.0);

    private final double periodsPerYear;

    ReportFrequency(double periodsPerYear) {
        this.periodsPerYear = periodsPerYear;
    }

    public double periodsPerYear() {
        return periodsPerYear;
    }
}
