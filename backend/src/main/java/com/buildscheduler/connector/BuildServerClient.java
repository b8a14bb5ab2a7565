package com.buildscheduler.connector;

import java.util.List;
import java.util.Map;

/**
 * Talks to one build server instance. Implementations are stateless apart from the
 * server coordinates they were created with.
 *
 * <p>Every method throws a {@link com.buildscheduler.exception.BuildServerException}
 * subtype when the server cannot be reached, rejects the credentials, or does not know
 * the requested job.
 */
public interface BuildServerClient {

    /** Lists all leaf jobs, descending depth-first into folders. */
    List<BuildServerJob> listJobs();

    List<ParameterDefinition> getParameterDefinitions(String targetId);

    /**
     * Queues a build of {@code targetId}. A non-empty {@code parameters} map selects the
     * parameterized trigger; {@code null} values are left out so the server applies the
     * declared default.
     *
     * @return location of the queued build as reported by the server
     */
    String triggerBuild(String targetId, Map<String, Object> parameters);
}
