package com.dflow.diagram.diagnostic;

public enum Severity {
    ERROR,
    WARNING,
    INFO
}
