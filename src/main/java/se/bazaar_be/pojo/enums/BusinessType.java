package se.bazaar_be.pojo.enums;

import java.util.EnumSet;
import java.util.Set;

public enum BusinessType {
    BRAND,
    CELEBRITY,
    ESTABLISHED_BUSINESS,
    VERIFIED_RETAILER;

    /**
     * Document types an admin expects before verifying a seller of this type.
     */
    public Set<DocumentType> requiredDocuments() {
        return switch (this) {
            case BRAND -> EnumSet.of(DocumentType.TRADE_LICENSE, DocumentType.TAX_CERTIFICATE,
                    DocumentType.BRAND_AUTHORIZATION, DocumentType.IDENTITY_PROOF);
            case CELEBRITY -> EnumSet.of(DocumentType.IDENTITY_PROOF, DocumentType.CELEBRITY_VERIFICATION,
                    DocumentType.TAX_CERTIFICATE);
            case ESTABLISHED_BUSINESS, VERIFIED_RETAILER -> EnumSet.of(DocumentType.TRADE_LICENSE,
                    DocumentType.TAX_CERTIFICATE, DocumentType.IDENTITY_PROOF);
        };
    }
}
