package com.buildscheduler.model.enums;

import java.util.Map;

/**
 * Build parameter types the scheduler understands. The build server tags each
 * parameter definition with a class name; anything unrecognized is {@link #OTHER}.
 */
public enum ParameterKind {
    STRING,
    TEXT,
    CHOICE,
    BOOLEAN,
    GIT_REF,
    OTHER;

    // Keyed by simple class name so both "hudson.model.X" tags and bare "type" values match
    private static final Map<String, ParameterKind> BY_SIMPLE_NAME = Map.of(
            "StringParameterDefinition", STRING,
            "TextParameterDefinition", TEXT,
            "ChoiceParameterDefinition", CHOICE,
            "BooleanParameterDefinition", BOOLEAN,
            "GitParameterDefinition", GIT_REF
    );

    public static ParameterKind fromClassTag(String classTag) {
        if (classTag == null || classTag.isBlank()) {
            return OTHER;
        }
        String simpleName = classTag.substring(classTag.lastIndexOf('.') + 1);
        return BY_SIMPLE_NAME.getOrDefault(simpleName, OTHER);
    }
}
