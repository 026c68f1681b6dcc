package io.linkup.matchmaking.service;

/** 1 回の sweep の結果。aborted は計画したが claim できなかったペア数。 */
public record SweepResult(int scanned, int planned, int created, int aborted) {}
