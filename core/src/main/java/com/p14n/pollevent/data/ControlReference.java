package com.p14n.pollevent.data;

/**
 * Identifies one remote control, either as a bare control name ({@code gain})
 * or as {@code component.control}.
 *
 * <p>
 * A reference with a separator must contain exactly one separator and both
 * segments must be non-empty. Leading or trailing whitespace is not allowed.
 * </p>
 *
 * @param component the owning component, or {@code null} for a bare name
 * @param control   the control name
 */
public record ControlReference(String component, String control) {

    /** Separator between the component and control segments. */
    public static final char SEPARATOR = '.';

    public ControlReference {
        if (control == null || control.isEmpty()) {
            throw new IllegalArgumentException("Control name cannot be null or empty");
        }
        if (component != null && component.isEmpty()) {
            throw new IllegalArgumentException("Component name cannot be empty");
        }
    }

    /**
     * Parses a reference in either accepted form.
     *
     * @param path the raw reference
     * @return the parsed reference
     * @throws IllegalArgumentException if the path breaks the naming rule
     */
    public static ControlReference parse(String path) {
        String problem = validate(path);
        if (problem != null) {
            throw new IllegalArgumentException(problem);
        }
        int sep = path.indexOf(SEPARATOR);
        if (sep < 0) {
            return new ControlReference(null, path);
        }
        return new ControlReference(path.substring(0, sep), path.substring(sep + 1));
    }

    /**
     * Checks a raw reference against the naming rule.
     *
     * @param path the raw reference
     * @return a description of the problem, or {@code null} when the path is valid
     */
    public static String validate(String path) {
        if (path == null || path.isBlank()) {
            return "Control reference cannot be null or blank";
        }
        if (!path.strip().equals(path)) {
            return "Control reference cannot have surrounding whitespace: '" + path + "'";
        }
        int first = path.indexOf(SEPARATOR);
        if (first < 0) {
            return null;
        }
        if (first != path.lastIndexOf(SEPARATOR)) {
            return "Control reference must contain at most one '" + SEPARATOR + "': '" + path + "'";
        }
        if (first == 0 || first == path.length() - 1) {
            return "Control reference segments cannot be empty: '" + path + "'";
        }
        return null;
    }

    public boolean hasComponent() {
        return component != null;
    }

    /**
     * @return the reference in its textual form
     */
    public String path() {
        return component == null ? control : component + SEPARATOR + control;
    }

    @Override
    public String toString() {
        return path();
    }
}
