package dev.codesearch.workspace;

/** Lifecycle of a {@link WorkspaceHandle}. Transitions only move forward. */
public enum HandleState {
  OPENING,
  READY,
  CLOSING,
  CLOSED
}
