package fr.imt.pbdeployer.infrastructure.ssh;

import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.exception.CommandTimeoutException;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.RemoteCommandException;

import java.time.Duration;

/**
 * One authenticated shell session on a remote host.
 * Sessions are not safe for concurrent use; the pool hands each one to a single caller at a time.
 */
public interface RemoteSession {

    /**
     * Runs a command and waits for it to exit.
     *
     * @param command the command line passed to the remote login shell
     * @param timeout maximum time to wait for the command to exit
     * @return the captured output and exit code, whatever the exit code is
     * @throws CommandTimeoutException if the command did not exit in time; the session stays usable
     * @throws ConnectionException     if the transport failed; the session must be discarded
     */
    CommandResult exec(String command, Duration timeout);

    /**
     * Writes a file over SFTP, replacing any existing one.
     *
     * @throws RemoteCommandException if the remote side refused the write
     * @throws ConnectionException    if the transport failed
     */
    void upload(byte[] content, String remotePath);

    /**
     * Reads a whole remote file over SFTP.
     *
     * @throws RemoteCommandException if the file cannot be read
     * @throws ConnectionException    if the transport failed
     */
    byte[] download(String remotePath);

    boolean isConnected();

    /**
     * Closes the session. Never throws.
     */
    void close();
}
