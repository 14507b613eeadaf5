package io.playengine.credential;

import java.util.List;
import java.util.Optional;

/**
 * Either one of the closed set of {@link ManagedCredentialType}s, with fixed injection behaviour, or a
 * user-defined type whose {@link InjectorSpec} is rendered by the template injector.
 */
public record CredentialType(
        ManagedCredentialType managed,
        CredentialKind kind,
        String name,
        List<FieldDefinition> fields,
        InjectorSpec injectors
) {
    public CredentialType {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("credential type name cannot be empty");
        }
        kind = kind == null ? CredentialKind.CLOUD : kind;
        fields = fields == null ? List.of() : List.copyOf(fields);
        injectors = injectors == null ? InjectorSpec.empty() : injectors;
    }

    public static CredentialType defaults(String namespace) {
        return of(ManagedCredentialType.fromNamespace(namespace));
    }

    public static CredentialType of(ManagedCredentialType managed) {
        return new CredentialType(managed, managed.kind(), managed.displayName(), managed.fields(), InjectorSpec.empty());
    }

    public static CredentialType custom(CredentialKind kind, String name, List<FieldDefinition> fields, InjectorSpec injectors) {
        return new CredentialType(null, kind, name, fields, injectors);
    }

    public Optional<ManagedCredentialType> managedType() {
        return Optional.ofNullable(managed);
    }

    public boolean isManaged() {
        return managed != null;
    }

    public Optional<FieldDefinition> field(String id) {
        for (FieldDefinition field : fields) {
            if (field.id().equals(id)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public boolean isSecretField(String id) {
        return field(id).map(FieldDefinition::secret).orElse(false);
    }
}
