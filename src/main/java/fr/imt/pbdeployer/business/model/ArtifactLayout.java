package fr.imt.pbdeployer.business.model;

/**
 * What a validated release archive contains at its root.
 */
public record ArtifactLayout(String binaryName,
                             boolean hasMigrations,
                             boolean hasHooks,
                             int entryCount,
                             long sizeBytes) {
}
