package org.netpreserve.sweeper.config;

/**
 * Storage configuration.
 *
 * @param database ledger filename, relative to the job directory
 */
public record StorageConfig(
        String database
) {
}
