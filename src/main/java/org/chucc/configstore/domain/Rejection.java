package org.chucc.configstore.domain;

/**
 * Expected reasons for an aggregate to refuse a command.
 */
public enum Rejection {
  /** The key was never set. */
  NOT_FOUND,
  /** The key is currently tombstoned. */
  ALREADY_DELETED
}
