package com.buildscheduler.connector;

/**
 * A triggerable job found while walking the build server's folder tree.
 *
 * @param fullPath    folder-qualified name, segments joined with '/'
 * @param displayName name shown by the build server for the leaf job
 * @param kind        simple name of the job's type tag, e.g. {@code FreeStyleProject}
 * @param url         the job's own URL as reported by the server
 */
public record BuildServerJob(String fullPath, String displayName, String kind, String url) {
}
