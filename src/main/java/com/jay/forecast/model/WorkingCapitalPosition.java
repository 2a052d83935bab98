package com.jay.forecast.model;

public record WorkingCapitalPosition(double accountsReceivable, double inventory, double accountsPayable) {

    public double netWorkingCapital() {
        return accountsReceivable + inventory - accountsPayable;
    }
}
