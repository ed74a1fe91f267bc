package fr.imt.pbdeployer.infrastructure.ssh;

import fr.imt.pbdeployer.infrastructure.persistence.ServerTarget;

public record ConnectionKey(String host, int port, String username) {

    public static ConnectionKey of(ServerTarget target, boolean asPrivileged) {
        return new ConnectionKey(target.getHost(), target.getPort(), target.usernameFor(asPrivileged));
    }

    @Override
    public String toString() {
        return username + "@" + host + ":" + port;
    }
}
