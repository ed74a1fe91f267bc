package fr.imt.pbdeployer.business.model;

public enum DeploymentKind {
    DEPLOY,
    ROLLBACK
}
