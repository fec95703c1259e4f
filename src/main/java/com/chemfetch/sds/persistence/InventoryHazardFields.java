package com.chemfetch.sds.persistence;

/**
 * Hazard columns copied onto the per-user inventory rows of a product.
 */
public record InventoryHazardFields(boolean sdsAvailable,
                                    String issueDate,
                                    Boolean hazardousSubstance,
                                    Boolean dangerousGood,
                                    String dangerousGoodsClass,
                                    String packingGroup,
                                    String subsidiaryRisks) {

    /**
     * @param metadata stored metadata, placeholder or full
     * @return the inventory view of it
     */
    public static InventoryHazardFields from(final SdsMetadata metadata) {
        return new InventoryHazardFields(true, metadata.getIssueDate(), metadata.getHazardousSubstance(),
                metadata.getDangerousGood(), metadata.getDangerousGoodsClass(), metadata.getPackingGroup(),
                metadata.getSubsidiaryRisks());
    }
}
