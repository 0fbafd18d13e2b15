package com.titan.prepress.toolchain;

import com.titan.prepress.report.Issues;
import lombok.Value;

@Value
public class StructureCheck {
    boolean valid;
    Issues issues;
}
