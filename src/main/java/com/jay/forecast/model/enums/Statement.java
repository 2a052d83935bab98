package com.jay.forecast.model.enums;

public enum Statement {
    INCOME_STATEMENT("income statement.csv"),
    BALANCE_SHEET("balance sheet.csv"),
    CASH_FLOW("cash flow.csv");

    private final String fileName;

    Statement(String fileName) {
        this.fileName = fileName;
    }

    public String fileName() { return fileName; }
}
