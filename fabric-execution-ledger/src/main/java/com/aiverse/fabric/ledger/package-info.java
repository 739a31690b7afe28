/**
 * Intent execution ledger: execution and unit records, the in-memory and PostgreSQL stores, the fail-safe
 * {@link com.aiverse.fabric.ledger.ExecutionLedger} facade and the {@link com.aiverse.fabric.ledger.LedgerFeature}
 * that records unit runs.
 */
package com.aiverse.fabric.ledger;
