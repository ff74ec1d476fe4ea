package io.seatwatch.model;

public record Target(
        String department,
        String courseCode,
        SectionKind kind,
        String label
) {
    public Target {
        if (isBlank(department) || isBlank(courseCode) || isBlank(label) || kind == null) {
            throw new IllegalArgumentException("department, courseCode, kind and label are required");
        }
        department = department.trim();
        courseCode = courseCode.trim();
        label = label.trim();
    }

    public static Target lecture(String department, String courseCode, String label) {
        return new Target(department, courseCode, SectionKind.LECTURE, label);
    }

    public static Target discussion(String department, String courseCode, String label) {
        return new Target(department, courseCode, SectionKind.DISCUSSION, label);
    }

    public String key(String term) {
        return department + "_" + courseCode + "_" + label + "_" + term;
    }

    public String displayName() {
        return department + " " + courseCode + " section " + label;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
