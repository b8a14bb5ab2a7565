package com.buildscheduler.connector;

import com.buildscheduler.exception.BuildServerAuthenticationException;
import com.buildscheduler.exception.BuildServerException;
import com.buildscheduler.exception.BuildServerUnavailableException;
import com.buildscheduler.exception.BuildTargetNotFoundException;
import com.buildscheduler.model.enums.ParameterKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.HttpRetryException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link BuildServerClient} for the Jenkins remote access API.
 */
@Slf4j
public class JenkinsClient implements BuildServerClient {

    static final String PARAMETERS_PROPERTY = "hudson.model.ParametersDefinitionProperty";

    static final Set<String> CONTAINER_CLASSES = Set.of(
            "com.cloudbees.hudson.plugins.folder.Folder",
            "jenkins.branch.OrganizationFolder",
            "org.jenkinsci.plugins.workflow.multibranch.WorkflowMultiBranchProject");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String username;
    private final String apiToken;

    public JenkinsClient(RestTemplate restTemplate, ObjectMapper objectMapper,
                         String baseUrl, String username, String apiToken) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.username = username;
        this.apiToken = apiToken;
    }

    // ── Listing ───────────────────────────────────────────────────────────

    @Override
    public List<BuildServerJob> listJobs() {
        List<BuildServerJob> jobs = new ArrayList<>();
        collectJobs(JenkinsJobPath.of(List.of()), jobs);
        return jobs;
    }

    // No cycle guard: folder trees reported by the server are finite
    private void collectJobs(JenkinsJobPath folder, List<BuildServerJob> out) {
        String describe = folder.isRoot() ? "job listing" : "folder " + folder.fullName();
        JsonNode root = getJson(baseUrl + folder.toUrlPath() + "/api/json", describe);

        for (JsonNode item : root.path("jobs")) {
            String name = item.path("name").asText("");
            if (name.isEmpty()) {
                continue;
            }
            String classTag = item.path("_class").asText("");
            JenkinsJobPath path = folder.child(name);
            if (CONTAINER_CLASSES.contains(classTag)) {
                collectJobs(path, out);
            } else {
                out.add(new BuildServerJob(
                        path.fullName(),
                        item.path("displayName").asText(name),
                        classTag.substring(classTag.lastIndexOf('.') + 1),
                        item.path("url").asText(null)));
            }
        }
    }

    // ── Parameters ────────────────────────────────────────────────────────

    @Override
    public List<ParameterDefinition> getParameterDefinitions(String targetId) {
        JenkinsJobPath path = JenkinsJobPath.parse(targetId);
        JsonNode job = getJson(baseUrl + path.toUrlPath() + "/api/json", "job " + path.fullName());

        List<ParameterDefinition> definitions = new ArrayList<>();
        for (JsonNode property : job.path("property")) {
            if (!PARAMETERS_PROPERTY.equals(property.path("_class").asText())) {
                continue;
            }
            for (JsonNode definition : property.path("parameterDefinitions")) {
                definitions.add(toDefinition(definition));
            }
        }
        return definitions;
    }

    private ParameterDefinition toDefinition(JsonNode node) {
        ParameterKind kind = ParameterKind.fromClassTag(node.path("_class").asText(null));
        if (kind == ParameterKind.OTHER) {
            kind = ParameterKind.fromClassTag(node.path("type").asText(null));
        }

        JsonNode defaultNode = node.path("defaultParameterValue").path("value");
        Object defaultValue = null;
        if (defaultNode.isBoolean()) {
            defaultValue = defaultNode.booleanValue();
        } else if (!defaultNode.isMissingNode() && !defaultNode.isNull()) {
            defaultValue = defaultNode.asText();
        }

        List<String> choices = new ArrayList<>();
        for (JsonNode choice : node.path("choices")) {
            choices.add(choice.asText());
        }

        return new ParameterDefinition(
                node.path("name").asText(),
                kind,
                node.path("description").asText(null),
                defaultValue,
                choices);
    }

    // ── Triggering ────────────────────────────────────────────────────────

    @Override
    public String triggerBuild(String targetId, Map<String, Object> parameters) {
        JenkinsJobPath path = JenkinsJobPath.parse(targetId);
        boolean parameterized = parameters != null && !parameters.isEmpty();
        String url = baseUrl + path.toUrlPath() + (parameterized ? "/buildWithParameters" : "/build");

        HttpHeaders headers = authHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        attachCrumb(headers);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (parameterized) {
            parameters.forEach((name, value) -> {
                if (value != null) {
                    form.add(name, value.toString());
                }
            });
        }

        log.info("Triggering build {} ({} parameters) on {}", path.fullName(), form.size(), baseUrl);
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.POST, new HttpEntity<>(form, headers), String.class);
            URI location = response.getHeaders().getLocation();
            return location != null ? location.toString() : url;
        } catch (HttpStatusCodeException e) {
            throw translate(e, "job " + path.fullName());
        } catch (RestClientException e) {
            throw translate(e, "job " + path.fullName());
        }
    }

    private void attachCrumb(HttpHeaders headers) {
        try {
            JsonNode crumb = getJson(baseUrl + "/crumbIssuer/api/json", "crumb issuer");
            String field = crumb.path("crumbRequestField").asText("");
            String value = crumb.path("crumb").asText("");
            if (!field.isEmpty() && !value.isEmpty()) {
                headers.set(field, value);
            }
        } catch (BuildServerException e) {
            log.debug("CSRF crumb unavailable on {}, continuing without it: {}", baseUrl, e.getMessage());
        }
    }

    // ── HTTP helpers ──────────────────────────────────────────────────────

    private JsonNode getJson(String url, String describe) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    URI.create(url), HttpMethod.GET, new HttpEntity<>(authHeaders()), String.class);
            String body = response.getBody();
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (HttpStatusCodeException e) {
            throw translate(e, describe);
        } catch (RestClientException e) {
            throw translate(e, describe);
        } catch (JsonProcessingException e) {
            throw new BuildServerUnavailableException(
                    "Build server returned an unreadable response for " + describe, e);
        }
    }

    private HttpHeaders authHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (username != null && !username.isEmpty() && apiToken != null && !apiToken.isEmpty()) {
            headers.setBasicAuth(username, apiToken);
        }
        return headers;
    }

    private BuildServerException translate(HttpStatusCodeException e, String describe) {
        int status = e.getStatusCode().value();
        return switch (status) {
            case 401 -> new BuildServerAuthenticationException(
                    "Build server rejected the credentials (401) for " + describe, e);
            case 403 -> new BuildServerAuthenticationException(
                    "Build server denied access (403) to " + describe
                            + "; check the user's permissions and API token", e);
            case 404 -> new BuildTargetNotFoundException(
                    "Build server has no " + describe + " (404)", e);
            default -> new BuildServerUnavailableException(
                    "Build server returned HTTP " + status + " for " + describe, e);
        };
    }

    private BuildServerException translate(RestClientException e, String describe) {
        // HttpURLConnection reports a 401 on a streamed POST as HttpRetryException
        if (e.getMostSpecificCause() instanceof HttpRetryException retry && retry.responseCode() == 401) {
            return new BuildServerAuthenticationException(
                    "Build server rejected the credentials (401) for " + describe, e);
        }
        return new BuildServerUnavailableException(
                "Build server " + baseUrl + " unreachable for " + describe + ": " + e.getMessage(), e);
    }
}
