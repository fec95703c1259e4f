package com.chemfetch.sds.capability;

/**
 * @param status {@code "ok"} when the capability accepts work
 * @param ocr    whether scanned documents can be read
 */
public record CapabilityHealth(String status, boolean ocr) {

    public static CapabilityHealth ok(final boolean ocr) {
        return new CapabilityHealth("ok", ocr);
    }

    public boolean isOk() {
        return "ok".equalsIgnoreCase(status);
    }
}
