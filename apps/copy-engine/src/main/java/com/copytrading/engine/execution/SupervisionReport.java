package com.copytrading.engine.execution;

/** Tally of one {@code managePositions} pass. */
public record SupervisionReport(int evaluated, int unpriced, int closed, int closeFailed) {
  static final SupervisionReport EMPTY = new SupervisionReport(0, 0, 0, 0);
}
