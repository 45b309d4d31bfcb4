package io.github.drompincen.strata.runtime.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Line-oriented pipes to one process: a reader thread framing stdout into lines, a thread
 * draining stderr, and serialized newline-terminated writes to stdin.
 */
public class LineTransport {

    private static final Logger log = LoggerFactory.getLogger(LineTransport.class);

    private final Process process;
    private final String name;
    private final Consumer<String> lineHandler;
    private final Runnable endOfStream;
    private final OutputStream stdin;
    private final Object writeLock = new Object();

    public LineTransport(Process process, String name, Consumer<String> lineHandler, Runnable endOfStream) {
        this.process = process;
        this.name = name;
        this.lineHandler = lineHandler;
        this.endOfStream = endOfStream;
        this.stdin = process.getOutputStream();
    }

    public void start() {
        Thread reader = new Thread(this::readStdout, name + "-stdout");
        reader.setDaemon(true);
        Thread drain = new Thread(this::drainStderr, name + "-stderr");
        drain.setDaemon(true);
        reader.start();
        drain.start();
    }

    /** Writes one line and flushes it. Concurrent callers never interleave. */
    public void writeLine(String line) throws IOException {
        byte[] bytes = line.getBytes(StandardCharsets.UTF_8);
        synchronized (writeLock) {
            stdin.write(bytes);
            stdin.write('\n');
            stdin.flush();
        }
    }

    /** Closes stdin so the process sees end of input. */
    public void close() {
        synchronized (writeLock) {
            try {
                stdin.close();
            } catch (IOException e) {
                log.debug("Closing stdin of {} failed: {}", name, e.getMessage());
            }
        }
    }

    private void readStdout() {
        LineFramer framer = new LineFramer();
        byte[] buffer = new byte[8192];
        try (InputStream in = process.getInputStream()) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                for (String line : framer.feed(buffer, 0, n)) {
                    lineHandler.accept(line);
                }
            }
        } catch (IOException e) {
            log.debug("Stdout of {} closed: {}", name, e.getMessage());
        } finally {
            if (framer.pendingBytes() > 0) {
                log.debug("Discarding {} bytes of unterminated output from {}", framer.pendingBytes(), name);
            }
            endOfStream.run();
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.trace("[{} stderr] {}", name, line);
            }
        } catch (IOException e) {
            log.debug("Stderr of {} closed: {}", name, e.getMessage());
        }
    }
}
