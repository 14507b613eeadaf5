package io.playengine.credential;

import java.util.List;
import java.util.Locale;

public enum ManagedCredentialType {
    SSH("ssh", CredentialKind.MACHINE, "Machine", List.of(
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password"),
            FieldDefinition.secret("ssh_key_data", "SSH Private Key"),
            FieldDefinition.secret("ssh_key_unlock", "Private Key Passphrase"),
            FieldDefinition.string("become_method", "Privilege Escalation Method"),
            FieldDefinition.string("become_username", "Privilege Escalation Username"),
            FieldDefinition.secret("become_password", "Privilege Escalation Password"),
            FieldDefinition.secret("vault_password", "Vault Password")
    )),
    SCM("scm", CredentialKind.SCM, "Source Control", List.of(
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password"),
            FieldDefinition.secret("ssh_key_data", "SCM Private Key"),
            FieldDefinition.secret("ssh_key_unlock", "Private Key Passphrase")
    )),
    NET("net", CredentialKind.NETWORK, "Network", List.of(
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password"),
            FieldDefinition.secret("ssh_key_data", "SSH Private Key"),
            FieldDefinition.secret("ssh_key_unlock", "Private Key Passphrase"),
            FieldDefinition.bool("authorize", "Authorize"),
            FieldDefinition.secret("authorize_password", "Authorize Password")
    )),
    AWS("aws", CredentialKind.CLOUD, "Amazon Web Services", List.of(
            FieldDefinition.string("username", "Access Key"),
            FieldDefinition.secret("password", "Secret Key"),
            FieldDefinition.secret("security_token", "STS Token")
    )),
    RACKSPACE("rackspace", CredentialKind.CLOUD, "Rackspace", List.of(
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password")
    )),
    VMWARE("vmware", CredentialKind.CLOUD, "VMware vCenter", List.of(
            FieldDefinition.string("host", "VCenter Host"),
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password")
    )),
    SATELLITE6("satellite6", CredentialKind.CLOUD, "Red Hat Satellite 6", List.of(
            FieldDefinition.string("host", "Satellite 6 URL"),
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password")
    )),
    CLOUDFORMS("cloudforms", CredentialKind.CLOUD, "Red Hat CloudForms", List.of(
            FieldDefinition.string("host", "CloudForms URL"),
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password")
    )),
    GCE("gce", CredentialKind.CLOUD, "Google Compute Engine", List.of(
            FieldDefinition.string("username", "Service Account Email Address"),
            FieldDefinition.string("project", "Project"),
            FieldDefinition.secret("ssh_key_data", "RSA Private Key")
    )),
    AZURE("azure", CredentialKind.CLOUD, "Microsoft Azure Classic", List.of(
            FieldDefinition.string("username", "Subscription ID"),
            FieldDefinition.secret("ssh_key_data", "Management Certificate")
    )),
    AZURE_RM("azure_rm", CredentialKind.CLOUD, "Microsoft Azure Resource Manager", List.of(
            FieldDefinition.string("subscription", "Subscription ID"),
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password"),
            FieldDefinition.string("client", "Client ID"),
            FieldDefinition.secret("secret", "Client Secret"),
            FieldDefinition.string("tenant", "Tenant ID")
    )),
    OPENSTACK("openstack", CredentialKind.CLOUD, "OpenStack", List.of(
            FieldDefinition.string("username", "Username"),
            FieldDefinition.secret("password", "Password (API Key)"),
            FieldDefinition.string("host", "Host (Authentication URL)"),
            FieldDefinition.string("project", "Project (Tenant Name)"),
            FieldDefinition.string("domain", "Domain Name")
    ));

    private final String namespace;
    private final CredentialKind kind;
    private final String displayName;
    private final List<FieldDefinition> fields;

    ManagedCredentialType(String namespace, CredentialKind kind, String displayName, List<FieldDefinition> fields) {
        this.namespace = namespace;
        this.kind = kind;
        this.displayName = displayName;
        this.fields = fields;
    }

    public String namespace() {
        return namespace;
    }

    public CredentialKind kind() {
        return kind;
    }

    public String displayName() {
        return displayName;
    }

    public List<FieldDefinition> fields() {
        return fields;
    }

    public static ManagedCredentialType fromNamespace(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("credential type namespace cannot be empty");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        if ("rax".equals(normalized)) {
            return RACKSPACE;
        }
        for (ManagedCredentialType value : values()) {
            if (value.namespace.equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown managed credential type: " + raw);
    }
}
