package com.copytrading.engine.execution;

public record ExecutionStatistics(
    long signalsReceived,
    long submitted,
    long skipped,
    long failed,
    long positionsClosed,
    int openPositions) {}
