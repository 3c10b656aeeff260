package com.carelink.backend.modules.verification.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Known compliance document types with their display name, identity category and whether they are mandatory.
 */
public final class DocumentCatalog {

    private static final Map<String, DocumentDefinition> DEFINITIONS;

    static {
        Map<String, DocumentDefinition> definitions = new LinkedHashMap<>();
        // Identity
        register(definitions, "identity-passport", "Passport", DocumentCategory.PRIMARY, true);
        register(definitions, "identity-birth-certificate", "Birth Certificate", DocumentCategory.PRIMARY, true);
        register(definitions, "identity-drivers-license", "Driver's License", DocumentCategory.SECONDARY, true);
        register(definitions, "identity-medicare-card", "Medicare Card", DocumentCategory.SECONDARY, true);
        register(definitions, "identity-utility-bill", "Utility Bill", DocumentCategory.SECONDARY, true);
        register(definitions, "identity-bank-statement", "Bank Statement", DocumentCategory.SECONDARY, true);
        register(definitions, "identity-working-rights", "Right to Work Document", DocumentCategory.WORKING_RIGHTS, true);
        register(definitions, "driver-license-vehicle", "Driver's License (Vehicle)", DocumentCategory.SECONDARY, false);
        // Screening
        register(definitions, "police-check", "National Police Check", null, true);
        register(definitions, "working-with-children", "Working with Children Check", null, true);
        register(definitions, "ndis-worker-screening", "NDIS Worker Screening Check", null, true);
        register(definitions, "worker-screening-check", "NDIS Worker Screening Check", null, true);
        // Training
        register(definitions, "infection-control", "Infection Control Training", null, false);
        register(definitions, "ndis-worker-orientation", "NDIS Worker Orientation Module", null, false);
        register(definitions, "ndis-induction-module", "NDIS Induction Module", null, false);
        register(definitions, "effective-communication", "Effective Communication Module", null, false);
        register(definitions, "safe-enjoyable-meals", "Supporting Safe and Enjoyable Meals Module", null, false);
        register(definitions, "certificate", "Certificate", null, false);
        register(definitions, "other-requirement", "Other Requirement", null, false);
        DEFINITIONS = Collections.unmodifiableMap(definitions);
    }

    private DocumentCatalog() {
    }

    /**
     * Looks up a document type. Unknown types resolve to an optional, uncategorised document
     * named after {@code customName}, or the type itself when no name is given.
     */
    public static DocumentDefinition resolve(String requirementType, String customName) {
        DocumentDefinition known = DEFINITIONS.get(requirementType);
        if (known != null) {
            return known;
        }
        String name = customName != null && !customName.isBlank() ? customName.trim() : requirementType;
        return new DocumentDefinition(requirementType, name, null, false);
    }

    public static boolean isKnown(String requirementType) {
        return DEFINITIONS.containsKey(requirementType);
    }

    private static void register(Map<String, DocumentDefinition> target, String type, String name,
                                 DocumentCategory category, boolean required) {
        target.put(type, new DocumentDefinition(type, name, category, required));
    }

    public record DocumentDefinition(String type, String name, DocumentCategory category, boolean required) {
    }
}
