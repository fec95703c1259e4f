package com.chemfetch.sds.dto;

/**
 * @param success      always {@code true} once the batch is queued
 * @param pendingCount products queued for parsing
 */
public record BatchResponse(boolean success, int pendingCount) {
}
