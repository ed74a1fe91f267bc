package fr.imt.pbdeployer.business.model;

/**
 * Local fixes that the auto-fix pass is allowed to apply without a human.
 */
public enum SafeRemediation {
    CREATE_SSH_DIRECTORY,
    FIX_SSH_DIRECTORY_PERMISSIONS,
    FIX_KEY_PERMISSIONS,
    ACCEPT_HOST_KEY
}
