package fr.imt.pbdeployer.business.model;

/**
 * Administrator account created on the first deploy of an application. Never persisted.
 */
public record BootstrapCredentials(String email, String password) {

    public boolean isComplete() {
        return email != null && !email.isBlank() && password != null && !password.isBlank();
    }

    @Override
    public String toString() {
        return "BootstrapCredentials[email=" + email + ", password=***]";
    }
}
