package work.canopy.primitive;

public record ReportedWarning(String level, String message) {}
