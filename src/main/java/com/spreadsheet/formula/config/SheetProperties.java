package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bounds of a sheet, bound from {@code sheet.*} properties.
 */
@ConfigurationProperties(prefix = "sheet")
public class SheetProperties {

    private int maxRows = 1000;
    private int maxColumns = 26;

    public int getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(int maxRows) {
        this.maxRows = maxRows;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public void setMaxColumns(int maxColumns) {
        this.maxColumns = maxColumns;
    }
}
