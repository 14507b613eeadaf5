package io.playengine.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.playengine.credential.Credential;
import io.playengine.credential.CredentialKind;
import io.playengine.credential.ManagedCredentialType;
import io.playengine.model.InventorySourceKind;
import io.playengine.model.InventoryUpdate;
import io.playengine.model.Job;
import io.playengine.model.JobType;
import io.playengine.model.ProjectUpdate;
import io.playengine.model.ScmType;
import io.playengine.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

final class JobFileLoaderTest {
    private final JobFileLoader loader = new JobFileLoader(Path.of("/srv/projects"));

    @Test
    void parsesPlaybookJobWithRelativeProject() throws Exception {
        Job job = (Job) loader.parse(json("""
                {
                  "id": 12,
                  "job_type": "check",
                  "playbook": "site.yml",
                  "project_path": "demo",
                  "inventory": "hosts.ini",
                  "credential": {"type": "ssh", "inputs": {"username": "deploy", "password": "ASK"}},
                  "extra_vars": {"release": "1.2"},
                  "forks": 5,
                  "become_enabled": true,
                  "launch_passwords": {"ssh_password": "s3cret"},
                  "timeout": 30
                }
                """));

        Assertions.assertEquals(12L, job.id());
        Assertions.assertEquals(JobType.CHECK, job.jobType());
        Assertions.assertEquals(Path.of("/srv/projects/demo"), job.projectPath());
        Assertions.assertEquals("hosts.ini", job.inventory());
        Assertions.assertEquals(ManagedCredentialType.SSH, job.credential().type().managed());
        Assertions.assertEquals("deploy", job.credential().rawInput("username"));
        Assertions.assertEquals(Map.of("release", "1.2"), job.extraVars());
        Assertions.assertEquals(5, job.forks());
        Assertions.assertTrue(job.becomeEnabled());
        Assertions.assertEquals("s3cret", job.launchPasswords().get("ssh_password"));
        Assertions.assertEquals(30L, job.timeoutSeconds());
    }

    @Test
    void parsesProjectAndInventoryUpdates() throws Exception {
        ProjectUpdate update = (ProjectUpdate) loader.parse(json("""
                {"kind": "project_update", "id": 3, "scm_type": "svn", "scm_url": "svn://example.com/repo",
                 "project_path": "/var/lib/projects/p3", "scm_clean": true}
                """));
        Assertions.assertEquals(ScmType.SVN, update.scmType());
        Assertions.assertEquals("HEAD", update.scmBranch());
        Assertions.assertEquals(Path.of("/var/lib/projects/p3"), update.projectPath());
        Assertions.assertTrue(update.scmClean());

        InventoryUpdate inventory = (InventoryUpdate) loader.parse(json("""
                {"kind": "inventory_update", "id": 4, "inventory_id": 9, "source": "rax",
                 "credential": {"type": "rax", "inputs": {"username": "u", "password": "p"}}}
                """));
        Assertions.assertEquals(InventorySourceKind.RACKSPACE, inventory.source());
        Assertions.assertEquals(9L, inventory.inventoryId());
        Assertions.assertEquals(4L, inventory.inventorySourceId());
        Assertions.assertEquals(1, inventory.verbosity());
    }

    @Test
    void parsesInlineCustomCredentialType() throws Exception {
        Credential credential = JobFileLoader.credential(json("""
                {
                  "name": "api",
                  "type": {
                    "name": "Service API",
                    "kind": "cloud",
                    "fields": [{"id": "api_token", "label": "Token", "secret": true}],
                    "injectors": {
                      "env": {"API_TOKEN": "{{ api_token }}"},
                      "file": {"template": "token={{ api_token }}"},
                      "extra_vars": {"api_config": "{{ tower.filename }}"}
                    }
                  },
                  "inputs": {"api_token": "abc"}
                }
                """));

        Assertions.assertFalse(credential.type().isManaged());
        Assertions.assertEquals(CredentialKind.CLOUD, credential.type().kind());
        Assertions.assertTrue(credential.type().isSecretField("api_token"));
        Assertions.assertEquals("token={{ api_token }}", credential.type().injectors().fileTemplate());
        Assertions.assertEquals("{{ api_token }}", credential.type().injectors().env().get("API_TOKEN"));
        Assertions.assertEquals("api", credential.name());
    }

    @Test
    void rejectsMissingIdAndUnknownKind() throws Exception {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> loader.parse(json("{\"playbook\": \"site.yml\", \"project_path\": \"demo\"}")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> loader.parse(json("{\"kind\": \"workflow\", \"id\": 1}")));
    }

    private static JsonNode json(String text) throws Exception {
        return Jsons.mapper().readTree(text);
    }
}
