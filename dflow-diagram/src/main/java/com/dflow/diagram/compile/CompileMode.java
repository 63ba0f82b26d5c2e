package com.dflow.diagram.compile;

public enum CompileMode {
    /** Stop after the first phase that records an error. */
    FAIL_FAST,
    /** Run every phase and aggregate all diagnostics, for tooling. */
    COLLECT_ALL
}
