package io.playengine.credential;

import io.playengine.model.InventorySourceKind;
import io.playengine.security.SecretCipher;
import io.playengine.template.TemplateException;
import io.playengine.template.TemplateRenderer;
import io.playengine.util.IniDocument;
import io.playengine.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns the credentials attached to a run into environment variables, private files, extra
 * arguments and prompt answers. Managed types have fixed behaviour; user-defined types go through
 * their {@link InjectorSpec} templates.
 */
public final class CredentialInjector {
    private static final Logger LOG = LoggerFactory.getLogger(CredentialInjector.class);

    public static final String ASK = "ASK";

    /** Variables owned by the engine. Injectors never set these. */
    public static final Set<String> RESERVED_ENV = Set.of(
            "JOB_ID", "PROJECT_UPDATE_ID", "INVENTORY_UPDATE_ID", "INVENTORY_SOURCE_ID", "INVENTORY_ID",
            "PATH", "PYTHONPATH", "VIRTUAL_ENV", "PROOT_TMP_DIR", "REST_API_URL", "REST_API_TOKEN",
            "CALLBACK_QUEUE", "CALLBACK_CONNECTION"
    );

    private final SecretCipher cipher;
    private final TemplateRenderer renderer;

    public CredentialInjector(SecretCipher cipher, TemplateRenderer renderer) {
        this.cipher = cipher;
        this.renderer = renderer;
    }

    public static boolean isReservedEnv(String key) {
        return RESERVED_ENV.contains(key);
    }

    public MachineLogin injectMachine(Credential credential, Map<String, String> launchPasswords, InjectionContext ctx)
            throws IOException {
        if (credential == null) {
            return MachineLogin.none();
        }
        requireManaged(credential, ManagedCredentialType.SSH);
        Map<String, String> launch = launchPasswords == null ? Map.of() : launchPasswords;
        machinePassword(credential, "password", "ssh_password", launch, ctx);
        machinePassword(credential, "ssh_key_unlock", "ssh_key_unlock", launch, ctx);
        machinePassword(credential, "become_password", "become_password", launch, ctx);
        machinePassword(credential, "vault_password", "vault_password", launch, ctx);
        String key = input(credential, "ssh_key_data", ctx);
        if (!key.isEmpty()) {
            ctx.sshKeyFile(ctx.privateData().writeSecret("credential", key));
        }
        return new MachineLogin(
                blankToNull(input(credential, "username", ctx)),
                blankToNull(input(credential, "become_method", ctx)),
                blankToNull(input(credential, "become_username", ctx))
        );
    }

    public ScmLogin injectScm(Credential credential, InjectionContext ctx) throws IOException {
        if (credential == null) {
            return ScmLogin.none();
        }
        ManagedCredentialType type = credential.type().managedType()
                .filter(t -> t == ManagedCredentialType.SCM || t == ManagedCredentialType.SSH)
                .orElseThrow(() -> new IllegalArgumentException(
                        "source control update cannot use credential type: " + credential.type().name()));
        String username = input(credential, "username", ctx);
        String password = input(credential, "password", ctx);
        ctx.putPassword("scm_username", username);
        ctx.putPassword("scm_password", password);
        ctx.putPassword("scm_key_unlock", input(credential, "ssh_key_unlock", ctx));
        String key = input(credential, "ssh_key_data", ctx);
        if (!key.isEmpty()) {
            ctx.sshKeyFile(ctx.privateData().writeSecret("scm_credential", key));
        }
        LOG.debug("Injected {} credential for source control", type.namespace());
        return new ScmLogin(blankToNull(username), blankToNull(password), !key.isEmpty());
    }

    public void injectNetwork(Credential credential, InjectionContext ctx) throws IOException {
        if (credential == null) {
            return;
        }
        if (!credential.type().isManaged()) {
            injectCustom(credential, ctx);
            return;
        }
        requireManaged(credential, ManagedCredentialType.NET);
        ctx.putEnv("ANSIBLE_NET_USERNAME", input(credential, "username", ctx));
        ctx.putEnv("ANSIBLE_NET_PASSWORD", input(credential, "password", ctx));
        String key = input(credential, "ssh_key_data", ctx);
        if (!key.isEmpty()) {
            Path keyFile = ctx.privateData().writeSecret("network_credential", key);
            ctx.putEnv("ANSIBLE_NET_SSH_KEYFILE", keyFile.toString());
        }
        if (credential.flag("authorize")) {
            ctx.putEnv("ANSIBLE_NET_AUTHORIZE", "1");
            ctx.putEnv("ANSIBLE_NET_AUTH_PASS", input(credential, "authorize_password", ctx));
        }
    }

    /** Cloud credential attached to a playbook run. */
    public void injectCloud(Credential credential, InjectionContext ctx) throws IOException {
        if (credential == null) {
            return;
        }
        if (!credential.type().isManaged()) {
            injectCustom(credential, ctx);
            return;
        }
        ManagedCredentialType type = credential.type().managed();
        switch (type) {
            case AWS -> {
                ctx.putEnv("AWS_ACCESS_KEY", input(credential, "username", ctx));
                ctx.putEnv("AWS_SECRET_KEY", input(credential, "password", ctx));
                String token = input(credential, "security_token", ctx);
                if (!token.isEmpty()) {
                    ctx.putEnv("AWS_SECURITY_TOKEN", token);
                }
            }
            case RACKSPACE -> {
                ctx.putEnv("RAX_USERNAME", input(credential, "username", ctx));
                ctx.putEnv("RAX_API_KEY", input(credential, "password", ctx));
                ctx.putEnv("CLOUD_VERIFY_SSL", "False");
            }
            case GCE -> injectGce(credential, ctx);
            case AZURE -> {
                ctx.putEnv("AZURE_SUBSCRIPTION_ID", input(credential, "username", ctx));
                Path cert = ctx.privateData().writeSecret("cloud_credential", input(credential, "ssh_key_data", ctx));
                ctx.putEnv("AZURE_CERT_PATH", cert.toString());
            }
            case AZURE_RM -> injectAzureRm(credential, ctx);
            case VMWARE -> injectVmwareEnv(credential, ctx);
            case OPENSTACK -> injectOpenstack(credential, true, ctx);
            case SATELLITE6 -> injectSatellite6(credential, ctx);
            case CLOUDFORMS -> injectCloudforms(credential, ctx);
            default -> throw new IllegalArgumentException("not a cloud credential type: " + type.namespace());
        }
    }

    /** Credential attached to an inventory update, interpreted for the given source. */
    public void injectInventorySource(
            InventorySourceKind source,
            Credential credential,
            Map<String, Object> sourceVars,
            String sourceRegions,
            InjectionContext ctx
    ) throws IOException {
        Map<String, Object> vars = sourceVars == null ? Map.of() : sourceVars;
        if (source == InventorySourceKind.CUSTOM) {
            for (Map.Entry<String, Object> entry : vars.entrySet()) {
                if (isReservedEnv(entry.getKey())) {
                    LOG.warn("Ignoring reserved variable {} in custom inventory source vars", entry.getKey());
                    continue;
                }
                ctx.putEnv(entry.getKey(), iniValue(entry.getValue()));
            }
            injectCloud(credential, ctx);
            return;
        }
        if (credential != null) {
            ManagedCredentialType expected = expectedCredentialType(source);
            if (credential.type().managed() != expected) {
                throw new IllegalArgumentException("inventory source " + source.value()
                        + " cannot use credential type: " + credential.type().name());
            }
        }
        switch (source) {
            case EC2 -> injectEc2(credential, vars, sourceRegions, ctx);
            case VMWARE -> {
                if (credential != null) {
                    injectVmwareEnv(credential, ctx);
                    IniDocument ini = new IniDocument()
                            .set("vmware", "username", input(credential, "username", ctx))
                            .set("vmware", "password", input(credential, "password", ctx))
                            .set("vmware", "server", input(credential, "host", ctx))
                            .set("vmware", "cache_max_age", 0);
                    ctx.putEnv("VMWARE_INI_PATH", ctx.privateData().writeSecret("vmware.ini", ini.render()).toString());
                }
            }
            case OPENSTACK -> {
                if (credential != null) {
                    injectOpenstack(credential, privateFlag(vars.get("private")), ctx);
                }
            }
            case GCE -> {
                if (credential != null) {
                    injectGce(credential, ctx);
                }
                if (sourceRegions != null && !sourceRegions.isBlank() && !"all".equalsIgnoreCase(sourceRegions)) {
                    ctx.putEnv("GCE_ZONE", sourceRegions);
                }
            }
            default -> injectCloud(credential, ctx);
        }
    }

    /** Renders a user-defined injector: file first, then env, then extra vars. */
    public void injectCustom(Credential credential, InjectionContext ctx) throws IOException {
        CredentialType type = credential.type();
        InjectorSpec spec = type.injectors();
        Map<String, Object> scope = new LinkedHashMap<>();
        Set<String> secretFields = new HashSet<>();
        for (FieldDefinition field : type.fields()) {
            Object raw = credential.rawInput(field.id());
            if (field.isBoolean()) {
                scope.put(field.id(), credential.has(field.id()) && credential.flag(field.id()));
                continue;
            }
            scope.put(field.id(), input(credential, field.id(), ctx));
            if (field.secret() || (raw instanceof String s && SecretCipher.isEncrypted(s))) {
                secretFields.add(field.id());
            }
        }
        Map<String, Object> tower = new LinkedHashMap<>();
        scope.put("tower", tower);
        try {
            if (spec.hasFile()) {
                String content = renderTracked(spec.fileTemplate(), scope, secretFields, ctx);
                Path file = ctx.privateData().writeSecretTempFile("cred_", content);
                tower.put("filename", file.toString());
            }
            for (Map.Entry<String, String> entry : spec.env().entrySet()) {
                if (isReservedEnv(entry.getKey())) {
                    LOG.warn("Credential type '{}' cannot set reserved variable {}; ignoring", type.name(), entry.getKey());
                    continue;
                }
                ctx.putEnv(entry.getKey(), renderTracked(entry.getValue(), scope, secretFields, ctx));
            }
            if (!spec.extraVars().isEmpty()) {
                Map<String, Object> extraVars = new LinkedHashMap<>();
                for (Map.Entry<String, String> entry : spec.extraVars().entrySet()) {
                    extraVars.put(entry.getKey(), renderTracked(entry.getValue(), scope, secretFields, ctx));
                }
                ctx.addExtraArgs("-e", Jsons.toCompactJson(extraVars));
            }
        } catch (TemplateException e) {
            throw new CredentialInjectionException(
                    "Failed to render injector for credential type '" + type.name() + "': " + e.getMessage(), e);
        }
    }

    private String renderTracked(String template, Map<String, Object> scope, Collection<String> secretFields,
                                 InjectionContext ctx) throws TemplateException {
        String rendered = renderer.render(template, scope);
        for (String name : renderer.referencedVariables(template)) {
            if (secretFields.contains(name)) {
                ctx.trackSecret(rendered);
                break;
            }
        }
        return rendered;
    }

    private void injectEc2(Credential credential, Map<String, Object> vars, String regions, InjectionContext ctx)
            throws IOException {
        Path cacheDir = Files.createDirectories(ctx.privateData().resolve("ec2_cache"));
        IniDocument ini = new IniDocument()
                .set("ec2", "regions", regions == null || regions.isBlank() ? "all" : regions)
                .set("ec2", "regions_exclude", "us-gov-west-1,cn-north-1")
                .set("ec2", "destination_variable", "public_dns_name")
                .set("ec2", "vpc_destination_variable", "ip_address")
                .set("ec2", "route53", "False")
                .set("ec2", "all_instances", "True")
                .set("ec2", "all_rds_instances", "False")
                .set("ec2", "rds", "False")
                .set("ec2", "nested_groups", "True")
                .set("ec2", "elasticache", "False")
                .set("ec2", "cache_path", cacheDir.toString())
                .set("ec2", "cache_max_age", 300);
        for (Map.Entry<String, Object> entry : vars.entrySet()) {
            ini.set("ec2", entry.getKey(), iniValue(entry.getValue()));
        }
        if (credential != null) {
            ctx.putEnv("AWS_ACCESS_KEY_ID", input(credential, "username", ctx));
            ctx.putEnv("AWS_SECRET_ACCESS_KEY", input(credential, "password", ctx));
            String token = input(credential, "security_token", ctx);
            if (!token.isEmpty()) {
                ctx.putEnv("AWS_SECURITY_TOKEN", token);
            }
        }
        ctx.putEnv("EC2_INI_PATH", ctx.privateData().writeSecret("ec2.ini", ini.render()).toString());
    }

    private void injectGce(Credential credential, InjectionContext ctx) throws IOException {
        ctx.putEnv("GCE_EMAIL", input(credential, "username", ctx));
        ctx.putEnv("GCE_PROJECT", input(credential, "project", ctx));
        Path pem = ctx.privateData().writeSecret("cloud_credential", input(credential, "ssh_key_data", ctx));
        ctx.putEnv("GCE_PEM_FILE_PATH", pem.toString());
    }

    private void injectAzureRm(Credential credential, InjectionContext ctx) {
        String client = input(credential, "client", ctx);
        String tenant = input(credential, "tenant", ctx);
        ctx.putEnv("AZURE_SUBSCRIPTION_ID", input(credential, "subscription", ctx));
        if (!client.isEmpty() && !tenant.isEmpty()) {
            ctx.putEnv("AZURE_CLIENT_ID", client);
            ctx.putEnv("AZURE_TENANT", tenant);
            ctx.putEnv("AZURE_SECRET", input(credential, "secret", ctx));
        } else {
            ctx.putEnv("AZURE_AD_USER", input(credential, "username", ctx));
            ctx.putEnv("AZURE_PASSWORD", input(credential, "password", ctx));
        }
    }

    private void injectVmwareEnv(Credential credential, InjectionContext ctx) {
        ctx.putEnv("VMWARE_USER", input(credential, "username", ctx));
        ctx.putEnv("VMWARE_PASSWORD", input(credential, "password", ctx));
        ctx.putEnv("VMWARE_HOST", input(credential, "host", ctx));
    }

    private void injectOpenstack(Credential credential, boolean privateNetwork, InjectionContext ctx)
            throws IOException {
        Map<String, Object> auth = new TreeMap<>();
        auth.put("auth_url", input(credential, "host", ctx));
        auth.put("username", input(credential, "username", ctx));
        auth.put("password", input(credential, "password", ctx));
        auth.put("project_name", input(credential, "project", ctx));
        String domain = input(credential, "domain", ctx);
        if (!domain.isEmpty()) {
            auth.put("domain_name", domain);
        }
        Map<String, Object> devstack = new LinkedHashMap<>();
        devstack.put("auth", auth);
        devstack.put("private", privateNetwork);
        Map<String, Object> document = Map.of("clouds", Map.of("devstack", devstack));
        Path file = ctx.privateData().writeSecret("cloud_credential", Jsons.toYaml(document));
        ctx.putEnv("OS_CLIENT_CONFIG_FILE", file.toString());
    }

    private void injectSatellite6(Credential credential, InjectionContext ctx) throws IOException {
        IniDocument ini = new IniDocument()
                .set("foreman", "url", input(credential, "host", ctx))
                .set("foreman", "user", input(credential, "username", ctx))
                .set("foreman", "password", input(credential, "password", ctx))
                .set("foreman", "ssl_verify", "False");
        ctx.putEnv("FOREMAN_INI_PATH", ctx.privateData().writeSecret("foreman.ini", ini.render()).toString());
    }

    private void injectCloudforms(Credential credential, InjectionContext ctx) throws IOException {
        Path cacheDir = Files.createDirectories(ctx.privateData().resolve("cloudforms_cache"));
        IniDocument ini = new IniDocument()
                .set("cloudforms", "url", input(credential, "host", ctx))
                .set("cloudforms", "username", input(credential, "username", ctx))
                .set("cloudforms", "password", input(credential, "password", ctx))
                .set("cloudforms", "ssl_verify", "false")
                .set("cache", "max_age", 0)
                .set("cache", "path", cacheDir.toString());
        ctx.putEnv("CLOUDFORMS_INI_PATH", ctx.privateData().writeSecret("cloudforms.ini", ini.render()).toString());
    }

    private void machinePassword(Credential credential, String field, String key, Map<String, String> launch,
                                 InjectionContext ctx) {
        String stored = input(credential, field, ctx);
        String value = stored.isEmpty() || ASK.equals(stored) ? launch.get(key) : stored;
        if (value != null && !value.isEmpty() && !ASK.equals(value)) {
            ctx.trackSecret(value);
            ctx.putPassword(key, value);
        }
    }

    /** Decrypted input value, or "" when absent. Secret values are registered for redaction. */
    private String input(Credential credential, String field, InjectionContext ctx) {
        Object raw = credential.rawInput(field);
        if (raw == null) {
            return "";
        }
        String value = String.valueOf(raw);
        boolean encrypted = SecretCipher.isEncrypted(value);
        if (encrypted) {
            value = cipher.decryptIfNeeded(value);
        }
        if ((encrypted || credential.type().isSecretField(field)) && !ASK.equals(value)) {
            ctx.trackSecret(value);
        }
        return value;
    }

    private static void requireManaged(Credential credential, ManagedCredentialType expected) {
        if (credential.type().managed() != expected) {
            throw new IllegalArgumentException("expected a " + expected.namespace()
                    + " credential, got: " + credential.type().name());
        }
    }

    private static ManagedCredentialType expectedCredentialType(InventorySourceKind source) {
        return switch (source) {
            case EC2 -> ManagedCredentialType.AWS;
            case VMWARE -> ManagedCredentialType.VMWARE;
            case RACKSPACE -> ManagedCredentialType.RACKSPACE;
            case AZURE -> ManagedCredentialType.AZURE;
            case AZURE_RM -> ManagedCredentialType.AZURE_RM;
            case GCE -> ManagedCredentialType.GCE;
            case OPENSTACK -> ManagedCredentialType.OPENSTACK;
            case SATELLITE6 -> ManagedCredentialType.SATELLITE6;
            case CLOUDFORMS -> ManagedCredentialType.CLOUDFORMS;
            case CUSTOM -> throw new IllegalArgumentException("custom inventory sources accept any credential");
        };
    }

    static boolean privateFlag(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            return !"false".equalsIgnoreCase(s.trim());
        }
        return true;
    }

    private static String iniValue(Object value) {
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof Collection<?> items) {
            StringBuilder sb = new StringBuilder();
            for (Object item : items) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(item);
            }
            return sb.toString();
        }
        return value == null ? "" : String.valueOf(value);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
