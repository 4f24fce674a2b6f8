package net.haproxy.dataplane.client.transaction;

/**
 * Text signature of an API failure caused by a concurrent change of the configuration.
 * All fragments must appear in the error text, matched case insensitively.
 */
public enum ErrorRule {
  TRANSACTION_OUTDATED("transaction", "is outdated and cannot be committed"),
  TRANSACTION_DOES_NOT_EXIST("transaction does not exist"),
  VERSION_MISMATCH("version mismatch"),
  VERSION_OR_TRANSACTION_NOT_SPECIFIED("version or transaction not specified"),
  /**
   * Seen when another writer changes the defaults section while this transaction validates.
   * It is not clear that every such validation error is transient, so this rule may mask real
   * configuration mistakes until attempts are exhausted.
   */
  TRANSIENT_DEFAULTS_VALIDATION("validation error", "defaults section");

  private final String[] fragments;

  private ErrorRule(String... fragments) {
    this.fragments = fragments;
  }

  /**
   * @param lowerCaseText error text, already lower cased
   */
  public boolean matches(String lowerCaseText) {
    for (String fragment : fragments) {
      if (!lowerCaseText.contains(fragment)) {
        return false;
      }
    }
    return true;
  }
}
