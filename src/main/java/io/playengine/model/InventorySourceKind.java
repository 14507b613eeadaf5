package io.playengine.model;

import java.util.Locale;

public enum InventorySourceKind {
    EC2,
    VMWARE,
    RACKSPACE,
    AZURE,
    AZURE_RM,
    GCE,
    OPENSTACK,
    SATELLITE6,
    CLOUDFORMS,
    CUSTOM;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static InventorySourceKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("inventory source cannot be empty");
        }
        String normalized = raw.trim().replace('-', '_');
        if ("rax".equalsIgnoreCase(normalized)) {
            return RACKSPACE;
        }
        for (InventorySourceKind value : values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown inventory source: " + raw);
    }
}
