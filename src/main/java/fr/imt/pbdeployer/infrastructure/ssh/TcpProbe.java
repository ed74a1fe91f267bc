package fr.imt.pbdeployer.infrastructure.ssh;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Raw TCP checks made before any SSH handshake.
 */
@Component
public class TcpProbe {

    /**
     * @param refused     the host answered with a reset, as opposed to a timeout or routing error
     * @param banner      first line sent by the server, null when not read or not received
     * @param localAddress address this side used, null when the connection failed
     */
    public record Result(boolean reachable, boolean refused, Duration latency, String banner,
                         String localAddress, String error) {
    }

    public Result connect(String host, int port, Duration timeout) {
        return probe(host, port, timeout, false);
    }

    /**
     * Connects and reads the identification line the SSH daemon sends first.
     */
    public Result readBanner(String host, int port, Duration timeout) {
        return probe(host, port, timeout, true);
    }

    private Result probe(String host, int port, Duration timeout, boolean readBanner) {
        int timeoutMs = (int) timeout.toMillis();
        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            Duration latency = Duration.ofNanos(System.nanoTime() - start);
            String local = socket.getLocalAddress().getHostAddress();
            if (!readBanner) {
                return new Result(true, false, latency, null, local, null);
            }
            return withBanner(socket, timeoutMs, latency, local);
        } catch (SocketTimeoutException e) {
            return new Result(false, false, Duration.ofNanos(System.nanoTime() - start), null, null,
                    "timed out after " + timeout.toSeconds() + "s");
        } catch (ConnectException e) {
            return new Result(false, true, Duration.ofNanos(System.nanoTime() - start), null, null,
                    e.getMessage());
        } catch (IOException e) {
            return new Result(false, isReset(e), Duration.ofNanos(System.nanoTime() - start), null, null,
                    e.getMessage());
        }
    }

    private static Result withBanner(Socket socket, int timeoutMs, Duration latency, String local) {
        try {
            socket.setSoTimeout(timeoutMs);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            String banner = reader.readLine();
            return new Result(true, false, latency, banner == null ? null : banner.strip(), local,
                    banner == null ? "connection closed before the banner" : null);
        } catch (IOException e) {
            return new Result(true, isReset(e), latency, null, local, "no banner: " + e.getMessage());
        }
    }

    private static boolean isReset(IOException e) {
        String message = e.getMessage();
        return message != null && message.toLowerCase().contains("connection reset");
    }
}
