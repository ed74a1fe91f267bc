package fr.imt.pbdeployer.infrastructure.ssh;

public enum ConnectionState {
    IDLE,
    IN_USE,
    // failed health checks or too old, closed and never handed out again
    CONDEMNED
}
