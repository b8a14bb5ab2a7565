package com.buildscheduler.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.buildscheduler.exception.BuildServerAuthenticationException;
import com.buildscheduler.exception.BuildServerUnavailableException;
import com.buildscheduler.exception.BuildTargetNotFoundException;
import com.buildscheduler.model.enums.ParameterKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

class JenkinsClientTest {

    private MockWebServer server;
    private JenkinsClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new JenkinsClient(new RestTemplate(), new ObjectMapper(),
                server.url("/").toString(), "ci-bot", "s3cr3t");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void shouldListJobsRecursivelyThroughFolders() throws Exception {
        server.enqueue(json("""
                {"jobs": [
                  {"_class": "hudson.model.FreeStyleProject", "name": "lint", "url": "http://ci/job/lint/"},
                  {"_class": "com.cloudbees.hudson.plugins.folder.Folder", "name": "team"}
                ]}
                """));
        server.enqueue(json("""
                {"jobs": [
                  {"_class": "org.jenkinsci.plugins.workflow.job.WorkflowJob", "name": "deploy", "displayName": "Deploy"}
                ]}
                """));

        List<BuildServerJob> jobs = client.listJobs();

        assertThat(jobs).extracting(BuildServerJob::fullPath).containsExactly("lint", "team/deploy");
        assertThat(jobs.get(1).displayName()).isEqualTo("Deploy");
        assertThat(jobs.get(1).kind()).isEqualTo("WorkflowJob");

        RecordedRequest root = server.takeRequest();
        assertThat(root.getPath()).isEqualTo("/api/json");
        assertThat(root.getHeader("Authorization")).startsWith("Basic ");
        assertThat(server.takeRequest().getPath()).isEqualTo("/job/team/api/json");
    }

    @Test
    void shouldReadParameterDefinitions() throws Exception {
        server.enqueue(json("""
                {"property": [
                  {"_class": "hudson.model.ParametersDefinitionProperty",
                   "parameterDefinitions": [
                     {"_class": "hudson.model.StringParameterDefinition", "name": "BRANCH",
                      "defaultParameterValue": {"value": "main"}},
                     {"_class": "hudson.model.BooleanParameterDefinition", "name": "DRY_RUN",
                      "defaultParameterValue": {"value": false}},
                     {"_class": "hudson.model.ChoiceParameterDefinition", "name": "ENV",
                      "choices": ["staging", "production"]}
                   ]}
                ]}
                """));

        List<ParameterDefinition> params = client.getParameterDefinitions("folder/job/A");

        assertThat(params).extracting(ParameterDefinition::name).containsExactly("BRANCH", "DRY_RUN", "ENV");
        assertThat(params.get(0).defaultValue()).isEqualTo("main");
        assertThat(params.get(1).kind()).isEqualTo(ParameterKind.BOOLEAN);
        assertThat(params.get(1).defaultValue()).isEqualTo(false);
        assertThat(params.get(2).choices()).containsExactly("staging", "production");
        assertThat(server.takeRequest().getPath()).isEqualTo("/job/folder/job/A/api/json");
    }

    @Test
    void shouldUseBuildWithParametersAndCrumb() throws Exception {
        server.enqueue(json("{\"crumbRequestField\": \"Jenkins-Crumb\", \"crumb\": \"abc123\"}"));
        server.enqueue(new MockResponse().setResponseCode(201)
                .setHeader("Location", server.url("/queue/item/17/").toString()));

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("X", "1");
        params.put("FLAG", true);
        params.put("UNSET", null);
        String location = client.triggerBuild("folder/job/A", params);

        assertThat(location).endsWith("/queue/item/17/");
        assertThat(server.takeRequest().getPath()).isEqualTo("/crumbIssuer/api/json");
        RecordedRequest trigger = server.takeRequest();
        assertThat(trigger.getMethod()).isEqualTo("POST");
        assertThat(trigger.getPath()).isEqualTo("/job/folder/job/A/buildWithParameters");
        assertThat(trigger.getHeader("Jenkins-Crumb")).isEqualTo("abc123");
        String body = trigger.getBody().readUtf8();
        assertThat(body).contains("X=1").contains("FLAG=true").doesNotContain("UNSET");
    }

    @Test
    void shouldUsePlainBuildWithoutParametersOrCrumb() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(201));

        String location = client.triggerBuild("lint", Map.of());

        assertThat(location).endsWith("/job/lint/build");
        server.takeRequest();
        RecordedRequest trigger = server.takeRequest();
        assertThat(trigger.getPath()).isEqualTo("/job/lint/build");
        assertThat(trigger.getHeader("Jenkins-Crumb")).isNull();
    }

    @Test
    void shouldTranslateUnauthorized() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(() -> client.getParameterDefinitions("lint"))
                .isInstanceOf(BuildServerAuthenticationException.class)
                .hasMessageContaining("401");
    }

    @Test
    void shouldTranslateForbidden() {
        server.enqueue(new MockResponse().setResponseCode(403));

        assertThatThrownBy(() -> client.listJobs())
                .isInstanceOf(BuildServerAuthenticationException.class)
                .hasMessageContaining("403");
    }

    @Test
    void shouldTranslateMissingTarget() {
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> client.triggerBuild("missing", Map.of()))
                .isInstanceOf(BuildTargetNotFoundException.class);
    }

    @Test
    void shouldTranslateServerError() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> client.listJobs())
                .isInstanceOf(BuildServerUnavailableException.class)
                .hasMessageContaining("503");
    }

    @Test
    void shouldTranslateUnreachableServer() {
        JenkinsClient offline = new JenkinsClient(new RestTemplate(), new ObjectMapper(),
                "http://127.0.0.1:1", null, null);

        assertThatThrownBy(offline::listJobs).isInstanceOf(BuildServerUnavailableException.class);
    }
}
