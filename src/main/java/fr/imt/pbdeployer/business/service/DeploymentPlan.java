package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.business.model.ArtifactLayout;
import fr.imt.pbdeployer.business.model.BootstrapCredentials;
import fr.imt.pbdeployer.business.model.DeploymentKind;
import fr.imt.pbdeployer.infrastructure.persistence.AppVersion;
import fr.imt.pbdeployer.infrastructure.persistence.DeploymentRecord;
import fr.imt.pbdeployer.infrastructure.persistence.ManagedApplication;
import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;

/**
 * Everything a deployment run needs, resolved and validated before the run starts.
 *
 * @param credentials only set for a first deploy
 */
public record DeploymentPlan(DeploymentRecord record,
                             ManagedApplication application,
                             AppVersion version,
                             ServerTarget server,
                             byte[] artifact,
                             ArtifactLayout layout,
                             boolean firstDeploy,
                             BootstrapCredentials credentials,
                             DeploymentKind kind) {
}
