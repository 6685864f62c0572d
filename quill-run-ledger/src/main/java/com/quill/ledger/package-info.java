/**
 * Run history and ledger: the append-only {@link com.quill.ledger.History} of
 * {@link com.quill.ledger.ExecutionRecord}s returned by each run, and the fail-safe
 * {@link com.quill.ledger.RunLedger} over a pluggable {@link com.quill.ledger.LedgerStore}.
 */
package com.quill.ledger;
