package io.intellixity.relata.persistence.exec;

/**
 * Started database transaction.
 *
 * <p>Whoever obtains it from {@link DataEngine#begin()} commits or rolls it back, exactly once.
 * Operations that receive one never finish it.</p>
 */
public interface Transaction {
  void commit();

  void rollback();

  /** False once committed or rolled back. */
  boolean isActive();
}
