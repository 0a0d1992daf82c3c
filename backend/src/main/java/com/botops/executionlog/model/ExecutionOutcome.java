package com.botops.executionlog.model;

public enum ExecutionOutcome {
    SUCCESS,
    FAILURE
}
