package com.polymix.arb.core;

import com.polymix.arb.domain.Ledger;

import java.util.Optional;

/**
 * Persistence port for the ledger document. Reads and writes are always whole-document.
 */
public interface LedgerRepository {

    /**
     * @return empty when no ledger has been written yet
     * @throws LedgerPersistenceException when a stored ledger exists but cannot be read
     */
    Optional<Ledger> load();

    /**
     * @throws LedgerPersistenceException when the write did not complete
     */
    void save(Ledger ledger);
}
