package com.flagship.wolf_goat_pig.ledger;

/**
 * Kind of round ledger entry. History is never edited; a mistake is fixed by
 * appending a compensating CORRECTION.
 */
public enum EntryType {
    HOLE,
    CORRECTION
}
