package fr.imt.pbdeployer.business.service;

import fr.imt.pbdeployer.exception.ValidationException;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.TreeSet;

/**
 * ufw command lines shared by setup and lockdown.
 */
@UtilityClass
class FirewallRules {

    static final String ENSURE_UFW = "command -v ufw >/dev/null 2>&1 || "
            + "DEBIAN_FRONTEND=noninteractive apt-get install -y -q ufw";

    /**
     * Opens the given ports without touching existing rules, then enables the firewall.
     */
    static String allow(int sshPort, Collection<Integer> ports) {
        return ENSURE_UFW + " && " + allowRules(sshPort, ports) + " && ufw --force enable";
    }

    /**
     * Drops every rule, denies incoming traffic by default and allows only the given ports.
     * The SSH port is always part of the allow-list.
     */
    static String replaceWithAllowList(int sshPort, Collection<Integer> ports) {
        return ENSURE_UFW
                + " && ufw --force reset"
                + " && ufw default deny incoming"
                + " && ufw default allow outgoing"
                + " && " + allowRules(sshPort, ports)
                + " && ufw --force enable"
                + " && ufw status | grep -q 'Status: active'";
    }

    private static String allowRules(int sshPort, Collection<Integer> ports) {
        TreeSet<Integer> allowed = new TreeSet<>(ports);
        allowed.add(sshPort);
        StringBuilder rules = new StringBuilder();
        for (Integer port : allowed) {
            if (port < 1 || port > 65535) {
                throw new ValidationException("Invalid firewall port: " + port);
            }
            if (rules.length() > 0) {
                rules.append(" && ");
            }
            rules.append("ufw allow ").append(port).append("/tcp");
        }
        return rules.toString();
    }
}
