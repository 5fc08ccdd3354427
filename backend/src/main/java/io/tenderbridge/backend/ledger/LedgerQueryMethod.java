package io.tenderbridge.backend.ledger;

import java.util.Locale;

/** How an award was read back from the ledger. */
public enum LedgerQueryMethod {
  CONTRACT_STORAGE,
  TRANSACTION_LOGS;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
