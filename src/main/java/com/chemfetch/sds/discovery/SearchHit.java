package com.chemfetch.sds.discovery;

/**
 * One organic result returned by a search backend.
 *
 * @param url   absolute, already unwrapped target URL
 * @param title anchor text or result title, may be empty
 */
public record SearchHit(String url, String title) {
}
