package com.chemfetch.sds.coordinator;

/**
 * @param totalWithSds      products with an SDS URL
 * @param totalWithMetadata of those, products with a metadata row
 * @param pending           products still waiting for a parse
 * @param processingRate    share of products with metadata, in percent
 */
public record BatchStats(long totalWithSds, long totalWithMetadata, long pending, double processingRate) {
}
