package io.playengine.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.playengine.credential.Credential;
import io.playengine.credential.CredentialKind;
import io.playengine.credential.CredentialType;
import io.playengine.credential.FieldDefinition;
import io.playengine.credential.InjectorSpec;
import io.playengine.model.InventorySourceKind;
import io.playengine.model.InventoryUpdate;
import io.playengine.model.Job;
import io.playengine.model.JobType;
import io.playengine.model.ProjectUpdate;
import io.playengine.model.ScmType;
import io.playengine.model.UnifiedJob;
import io.playengine.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a job definition file. The {@code kind} field selects {@code job}, {@code project_update} or
 * {@code inventory_update}; the remaining fields use the same snake_case names as the persisted
 * records. A credential is {@code {"type": "<namespace>", "inputs": {...}}}, or carries an inline
 * type object for user-defined credential types. Relative project paths resolve against the
 * projects directory.
 */
public final class JobFileLoader {
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private final Path projectsRoot;

    public JobFileLoader(Path projectsRoot) {
        this.projectsRoot = projectsRoot;
    }

    public UnifiedJob load(Path file) {
        try {
            return parse(Jsons.mapper().readTree(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new RuntimeException("Failed to read job file: " + file, e);
        }
    }

    public UnifiedJob parse(JsonNode node) {
        String kind = node.path("kind").asText("job");
        long id = node.path("id").asLong(0L);
        if (id <= 0L) {
            throw new IllegalArgumentException("job file needs a positive id");
        }
        return switch (kind) {
            case "job" -> parseJob(id, node);
            case "project_update" -> parseProjectUpdate(id, node);
            case "inventory_update" -> parseInventoryUpdate(id, node);
            default -> throw new IllegalArgumentException("Unknown job kind: " + kind);
        };
    }

    private Job parseJob(long id, JsonNode node) {
        return new Job(
                id,
                JobType.fromString(text(node, "job_type")),
                text(node, "playbook"),
                projectPath(node),
                text(node, "inventory"),
                credential(node.get("credential")),
                credential(node.get("cloud_credential")),
                credential(node.get("network_credential")),
                objectMap(node.get("extra_vars")),
                text(node, "limit"),
                node.path("verbosity").asInt(0),
                node.path("forks").asInt(0),
                text(node, "job_tags"),
                text(node, "skip_tags"),
                text(node, "start_at_task"),
                node.path("become_enabled").asBoolean(false),
                node.path("diff_mode").asBoolean(false),
                stringMap(node.get("launch_passwords")),
                node.path("timeout").asLong(0L)
        );
    }

    private ProjectUpdate parseProjectUpdate(long id, JsonNode node) {
        return new ProjectUpdate(
                id,
                ScmType.fromString(text(node, "scm_type")),
                text(node, "scm_url"),
                text(node, "scm_branch"),
                node.path("scm_clean").asBoolean(false),
                node.path("scm_delete_on_update").asBoolean(false),
                node.path("scm_accept_hostkey").asBoolean(false),
                projectPath(node),
                credential(node.get("credential")),
                objectMap(node.get("extra_vars")),
                node.path("verbosity").asInt(0),
                node.path("timeout").asLong(0L)
        );
    }

    private InventoryUpdate parseInventoryUpdate(long id, JsonNode node) {
        return new InventoryUpdate(
                id,
                node.path("inventory_id").asLong(0L),
                node.path("inventory_source_id").asLong(id),
                InventorySourceKind.fromString(text(node, "source")),
                text(node, "source_path"),
                text(node, "source_regions"),
                objectMap(node.get("source_vars")),
                credential(node.get("credential")),
                node.path("overwrite").asBoolean(false),
                node.path("overwrite_vars").asBoolean(false),
                node.path("verbosity").asInt(1),
                node.path("timeout").asLong(0L)
        );
    }

    private Path projectPath(JsonNode node) {
        String raw = text(node, "project_path");
        if (raw == null) {
            return null;
        }
        Path path = Path.of(raw);
        return path.isAbsolute() ? path : projectsRoot.resolve(path).toAbsolutePath().normalize();
    }

    static Credential credential(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || typeNode.isNull()) {
            throw new IllegalArgumentException("credential needs a type");
        }
        CredentialType type = typeNode.isTextual()
                ? CredentialType.defaults(typeNode.asText())
                : customType(typeNode);
        return new Credential(text(node, "name"), type, objectMap(node.get("inputs")));
    }

    private static CredentialType customType(JsonNode node) {
        List<FieldDefinition> fields = new ArrayList<>();
        for (JsonNode field : node.path("fields")) {
            fields.add(new FieldDefinition(
                    text(field, "id"),
                    text(field, "label"),
                    text(field, "type"),
                    field.path("secret").asBoolean(false)
            ));
        }
        JsonNode injectors = node.path("injectors");
        JsonNode file = injectors.path("file");
        String fileTemplate = file.isTextual() ? file.asText() : text(file, "template");
        InjectorSpec spec = new InjectorSpec(
                stringMap(injectors.get("env")),
                fileTemplate,
                stringMap(injectors.get("extra_vars"))
        );
        CredentialKind kind = CredentialKind.fromString(node.path("kind").asText("cloud"));
        return CredentialType.custom(kind, text(node, "name"), fields, spec);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.asText();
    }

    private static Map<String, Object> objectMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(node, OBJECT_MAP);
    }

    private static Map<String, String> stringMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return Jsons.mapper().convertValue(node, STRING_MAP);
    }
}
