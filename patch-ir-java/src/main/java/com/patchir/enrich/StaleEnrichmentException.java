package com.patchir.enrich;

/**
 * Thrown when enrichment written against one graph hash is applied to a patch
 * whose structure has since changed.
 */
public class StaleEnrichmentException extends RuntimeException {

    private final String expectedHash;
    private final String actualHash;

    public StaleEnrichmentException(String patch, String expectedHash, String actualHash) {
        super("Enrichment for " + patch + " is stale: written for graph " + expectedHash
                + ", patch is now " + actualHash);
        this.expectedHash = expectedHash;
        this.actualHash = actualHash;
    }

    public String getExpectedHash() { return expectedHash; }
    public String getActualHash()   { return actualHash; }
}
