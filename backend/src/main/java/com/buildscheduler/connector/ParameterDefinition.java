package com.buildscheduler.connector;

import com.buildscheduler.model.enums.ParameterKind;

import java.util.List;

/**
 * Parameter declared by a build target.
 *
 * @param defaultValue {@link Boolean} for boolean parameters, {@link String} or {@code null} otherwise
 * @param choices      allowed values for {@link ParameterKind#CHOICE}, empty for other kinds
 */
public record ParameterDefinition(
        String name,
        ParameterKind kind,
        String description,
        Object defaultValue,
        List<String> choices
) {

    public ParameterDefinition {
        kind = kind == null ? ParameterKind.OTHER : kind;
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    /**
     * Turns a submitted value (or the declared default when {@code submitted} is null) into
     * the value stored in a job configuration for this parameter.
     *
     * @throws IllegalArgumentException if a choice parameter receives a value it does not offer
     */
    public Object collect(Object submitted) {
        Object value = submitted != null ? submitted : defaultValue;
        return switch (kind) {
            case BOOLEAN -> {
                if (value instanceof Boolean b) {
                    yield b;
                }
                yield value != null && Boolean.parseBoolean(value.toString());
            }
            case CHOICE -> {
                String choice = value != null ? value.toString() : (choices.isEmpty() ? null : choices.get(0));
                if (choice != null && !choices.isEmpty() && !choices.contains(choice)) {
                    throw new IllegalArgumentException(
                            "Value '" + choice + "' is not a valid choice for parameter " + name);
                }
                yield choice;
            }
            case STRING, TEXT, GIT_REF, OTHER -> value != null ? value.toString() : null;
        };
    }
}
