package com.titan.prepress.report;

public enum Severity {
    BLOCKER,
    WARNING,
    INFO
}
