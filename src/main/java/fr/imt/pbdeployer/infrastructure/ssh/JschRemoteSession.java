package fr.imt.pbdeployer.infrastructure.ssh;

import com.jcraft.jsch.ChannelExec;
import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import fr.imt.pbdeployer.business.model.CommandResult;
import fr.imt.pbdeployer.exception.CommandTimeoutException;
import fr.imt.pbdeployer.exception.ConnectionException;
import fr.imt.pbdeployer.exception.OperationCancelledException;
import fr.imt.pbdeployer.exception.RemoteCommandException;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Slf4j
class JschRemoteSession implements RemoteSession {

    private static final int CHANNEL_CONNECT_TIMEOUT_MS = 15_000;
    private static final long POLL_INTERVAL_MS = 30;

    private final Session session;

    JschRemoteSession(Session session) {
        this.session = session;
    }

    @Override
    public CommandResult exec(String command, Duration timeout) {
        ChannelExec channel = (ChannelExec) openChannel("exec");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        channel.setCommand(command);
        channel.setInputStream(null);
        channel.setOutputStream(out);
        channel.setErrStream(err);
        try {
            channel.connect(CHANNEL_CONNECT_TIMEOUT_MS);
            long deadline = System.nanoTime() + timeout.toNanos();
            while (!channel.isClosed()) {
                if (System.nanoTime() - deadline > 0) {
                    throw new CommandTimeoutException("Remote command on " + session.getHost(), timeout);
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
            return new CommandResult(out.toString(StandardCharsets.UTF_8),
                    err.toString(StandardCharsets.UTF_8),
                    channel.getExitStatus());
        } catch (JSchException e) {
            throw new ConnectionException("Exec channel failed on " + session.getHost(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while waiting for remote command");
        } finally {
            channel.disconnect();
        }
    }

    @Override
    public void upload(byte[] content, String remotePath) {
        ChannelSftp channel = connectSftp();
        try {
            channel.put(new ByteArrayInputStream(content), remotePath);
        } catch (SftpException e) {
            throw new RemoteCommandException("Upload to " + remotePath, e.id, e.getMessage());
        } finally {
            channel.disconnect();
        }
    }

    @Override
    public byte[] download(String remotePath) {
        ChannelSftp channel = connectSftp();
        try {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            channel.get(remotePath, out);
            return out.toByteArray();
        } catch (SftpException e) {
            throw new RemoteCommandException("Download of " + remotePath, e.id, e.getMessage());
        } finally {
            channel.disconnect();
        }
    }

    @Override
    public boolean isConnected() {
        return session.isConnected();
    }

    @Override
    public void close() {
        session.disconnect();
    }

    private ChannelSftp connectSftp() {
        ChannelSftp channel = (ChannelSftp) openChannel("sftp");
        try {
            channel.connect(CHANNEL_CONNECT_TIMEOUT_MS);
            return channel;
        } catch (JSchException e) {
            channel.disconnect();
            throw new ConnectionException("SFTP channel failed on " + session.getHost(), e);
        }
    }

    private Object openChannel(String type) {
        try {
            return session.openChannel(type);
        } catch (JSchException e) {
            throw new ConnectionException("Cannot open " + type + " channel on " + session.getHost(), e);
        }
    }
}
