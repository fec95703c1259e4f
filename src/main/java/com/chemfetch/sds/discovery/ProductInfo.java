package com.chemfetch.sds.discovery;

/**
 * Product facts scraped from the web for a barcode.
 *
 * @param url    page the facts were taken from, {@code null} when nothing was found
 * @param name   product name, may be empty
 * @param size   pack size such as {@code 500 mL}, may be empty
 * @param sdsUrl SDS link seen on the page, may be {@code null}
 */
public record ProductInfo(String url, String name, String size, String sdsUrl) {

    public static ProductInfo empty() {
        return new ProductInfo(null, "", "", null);
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
