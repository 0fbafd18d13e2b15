package com.titan.prepress.report;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageSize {
    private double width;
    private double height;
    private String unit;

    public static PageSize points(double width, double height) {
        return new PageSize(width, height, "pt");
    }
}
