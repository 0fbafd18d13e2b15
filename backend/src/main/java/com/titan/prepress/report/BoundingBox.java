package com.titan.prepress.report;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Region on a page, each coordinate normalized to 0..1.
 */
@Value
@Builder
@Jacksonized
public class BoundingBox {
    double x;
    double y;
    double w;
    double h;
}
