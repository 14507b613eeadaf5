package io.playengine.credential;

public record FieldDefinition(String id, String label, String type, boolean secret) {
    public FieldDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("credential field id cannot be empty");
        }
        label = label == null || label.isBlank() ? id : label;
        type = type == null || type.isBlank() ? "string" : type;
    }

    public static FieldDefinition string(String id, String label) {
        return new FieldDefinition(id, label, "string", false);
    }

    public static FieldDefinition secret(String id, String label) {
        return new FieldDefinition(id, label, "string", true);
    }

    public static FieldDefinition bool(String id, String label) {
        return new FieldDefinition(id, label, "boolean", false);
    }

    public boolean isBoolean() {
        return "boolean".equals(type);
    }
}
