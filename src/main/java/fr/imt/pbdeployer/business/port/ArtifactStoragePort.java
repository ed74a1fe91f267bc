package fr.imt.pbdeployer.business.port;

/**
 * Read access to uploaded release archives.
 */
public interface ArtifactStoragePort {

    /**
     * @throws fr.imt.pbdeployer.exception.ResourceNotFoundException when no artifact has this id
     */
    byte[] load(String artifactId);
}
