package fr.imt.pbdeployer.infrastructure.ssh;

import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;

/**
 * Opens authenticated sessions. Each call makes exactly one connection attempt.
 */
public interface SessionFactory {

    /**
     * @throws fr.imt.pbdeployer.exception.ConnectionException     host unreachable or refused
     * @throws fr.imt.pbdeployer.exception.AuthenticationException credentials rejected
     */
    RemoteSession open(ServerTarget target, String username);

    /**
     * Records the host key presented by {@code host} in the local known_hosts file.
     */
    void acceptHostKey(String host, int port);
}
