package io.linkup.matchmaking.model;

public enum Decision {
  UNDECIDED,
  ACCEPT,
  REJECT
}
