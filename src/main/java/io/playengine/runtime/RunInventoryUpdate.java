package io.playengine.runtime;

import io.playengine.credential.InjectionContext;
import io.playengine.model.InventorySourceKind;
import io.playengine.model.InventoryUpdate;
import io.playengine.process.PasswordPromptMap;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Imports hosts and groups from a cloud or custom inventory source. */
public final class RunInventoryUpdate extends BaseRunTask<InventoryUpdate> {

    public RunInventoryUpdate(RunDependencies deps) {
        super(deps);
    }

    @Override
    protected PreparedRun prepare(InventoryUpdate update, InjectionContext injection) throws IOException {
        deps.injector().injectInventorySource(update.source(), update.credential(), update.sourceVars(),
                update.sourceRegions(), injection);

        List<String> args = new ArrayList<>(deps.settings().inventoryImportCommand());
        args.add("--inventory-id");
        args.add(String.valueOf(update.inventoryId()));
        args.add("--source");
        args.add(sourceScript(update));
        if (update.overwrite()) {
            args.add("--overwrite");
        }
        if (update.overwriteVars()) {
            args.add("--overwrite-vars");
        }
        args.add("-v" + Math.max(0, Math.min(2, update.verbosity())));
        args.addAll(injection.extraArgs());

        return new PreparedRun(args, Map.of(), deps.config().inventoryPluginsRoot(), PasswordPromptMap.empty(), List.of());
    }

    @Override
    protected Map<String, String> reservedEnv(InventoryUpdate update) {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("INVENTORY_UPDATE_ID", String.valueOf(update.id()));
        env.put("INVENTORY_SOURCE_ID", String.valueOf(update.inventorySourceId()));
        env.put("INVENTORY_ID", String.valueOf(update.inventoryId()));
        return env;
    }

    private String sourceScript(InventoryUpdate update) {
        if (update.source() == InventorySourceKind.CUSTOM) {
            return update.sourcePath();
        }
        String plugin = update.source() == InventorySourceKind.RACKSPACE ? "rax" : update.source().value();
        return deps.config().inventoryPluginsRoot().resolve(plugin + ".py").toString();
    }
}
