package fr.imt.pbdeployer.business.model;

public record CommandResult(String stdout, String stderr, int exitCode) {

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public String trimmedStdout() {
        return stdout == null ? "" : stdout.strip();
    }
}
