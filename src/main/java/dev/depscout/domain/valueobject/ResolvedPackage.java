package dev.depscout.domain.valueobject;

public record ResolvedPackage(String name, String version) {}
