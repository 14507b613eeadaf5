package io.playengine.model;

import io.playengine.credential.Credential;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record InventoryUpdate(
        long id,
        long inventoryId,
        long inventorySourceId,
        InventorySourceKind source,
        String sourcePath,
        String sourceRegions,
        Map<String, Object> sourceVars,
        Credential credential,
        boolean overwrite,
        boolean overwriteVars,
        int verbosity,
        long timeoutSeconds
) implements UnifiedJob {
    public InventoryUpdate {
        if (source == null) {
            throw new IllegalArgumentException("inventory update source cannot be empty: " + id);
        }
        if (source == InventorySourceKind.CUSTOM && (sourcePath == null || sourcePath.isBlank())) {
            throw new IllegalArgumentException("custom inventory update needs a source script: " + id);
        }
        sourceVars = sourceVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sourceVars));
    }

    public static InventoryUpdate of(long id, long inventoryId, InventorySourceKind source, Credential credential) {
        return new InventoryUpdate(id, inventoryId, id, source, null, null, Map.of(), credential, false, false, 1, 0L);
    }

    @Override
    public String kind() {
        return "inventory_update";
    }

    @Override
    public Map<String, Object> extraVars() {
        return Map.of();
    }

    @Override
    public List<Credential> credentials() {
        return credential == null ? List.of() : List.of(credential);
    }

    public InventoryUpdate withSourceVars(Map<String, Object> value) {
        return new InventoryUpdate(id, inventoryId, inventorySourceId, source, sourcePath, sourceRegions, value,
                credential, overwrite, overwriteVars, verbosity, timeoutSeconds);
    }

    public InventoryUpdate withSourceRegions(String value) {
        return new InventoryUpdate(id, inventoryId, inventorySourceId, source, sourcePath, value, sourceVars,
                credential, overwrite, overwriteVars, verbosity, timeoutSeconds);
    }
}
