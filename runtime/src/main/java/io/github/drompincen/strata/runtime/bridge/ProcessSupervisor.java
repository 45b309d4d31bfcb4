package io.github.drompincen.strata.runtime.bridge;

import io.github.drompincen.strata.protocol.codec.CommandEncoder;
import io.github.drompincen.strata.protocol.codec.EventDecoder;
import io.github.drompincen.strata.protocol.command.BridgeCommand;
import io.github.drompincen.strata.protocol.command.CancelCommand;
import io.github.drompincen.strata.protocol.command.CompactCommand;
import io.github.drompincen.strata.protocol.command.PermissionResponseCommand;
import io.github.drompincen.strata.protocol.command.QueryCommand;
import io.github.drompincen.strata.protocol.event.BridgeEvent;
import io.github.drompincen.strata.protocol.event.ErrorEvent;
import io.github.drompincen.strata.protocol.event.ResultEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Owns the bridge process of one session: launches it lazily, authenticates it, writes
 * commands to it and reports what it says to a {@link BridgeListener} through the dispatcher.
 * <p>
 * Lifecycle fields are guarded by {@code lock}. Callbacks of a process that has since been
 * shut down or replaced are recognized by instance and ignored.
 */
public class ProcessSupervisor implements BridgeChannel {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    private static final AtomicInteger LAUNCHES = new AtomicInteger();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final BridgeLocator locator;
    private final Path workingDirectory;
    private final Executor dispatcher;
    private final ScheduledExecutorService scheduler;
    private final Duration retryDelay;
    private final int malformedWarnThreshold;
    private final Supplier<Map<String, String>> ambientEnvironment;
    private final EventDecoder decoder = new EventDecoder();
    private final CommandEncoder encoder = new CommandEncoder();

    private final Object lock = new Object();
    private volatile BridgeListener listener;
    private Process process;
    private LineTransport transport;
    private boolean inFlight;

    public ProcessSupervisor(BridgeLocator locator, Path workingDirectory, Executor dispatcher,
                             ScheduledExecutorService scheduler, Duration retryDelay, int malformedWarnThreshold) {
        this(locator, workingDirectory, dispatcher, scheduler, retryDelay, malformedWarnThreshold, System::getenv);
    }

    ProcessSupervisor(BridgeLocator locator, Path workingDirectory, Executor dispatcher,
                      ScheduledExecutorService scheduler, Duration retryDelay, int malformedWarnThreshold,
                      Supplier<Map<String, String>> ambientEnvironment) {
        this.locator = locator;
        this.workingDirectory = workingDirectory;
        this.dispatcher = dispatcher;
        this.scheduler = scheduler;
        this.retryDelay = retryDelay;
        this.malformedWarnThreshold = malformedWarnThreshold;
        this.ambientEnvironment = ambientEnvironment;
    }

    @Override
    public void setListener(BridgeListener listener) {
        this.listener = listener;
    }

    /**
     * Launches the process unless one is alive.
     *
     * @throws LaunchException if the interpreter or script is missing or the spawn fails
     */
    public void start() {
        synchronized (lock) {
            if (process != null && process.isAlive()) return;

            LaunchSpec spec = locator.locate(workingDirectory);
            String nonce = newNonce();
            ProcessBuilder pb = new ProcessBuilder(spec.command())
                    .directory(spec.directory().toFile())
                    .redirectErrorStream(false);
            EnvironmentSanitizer.apply(pb.environment(), ambientEnvironment.get(), nonce);

            Process started;
            try {
                started = pb.start();
            } catch (IOException e) {
                throw new LaunchException("Failed to start bridge process: " + e.getMessage(), e);
            }

            AuthenticationGate gate = new AuthenticationGate(nonce, decoder, malformedWarnThreshold);
            LineTransport lines = new LineTransport(started, "bridge-" + LAUNCHES.incrementAndGet(),
                    line -> handleLine(started, gate, line),
                    () -> handleExit(started));
            process = started;
            transport = lines;
            lines.start();
            log.info("Started bridge process pid={} script={}", started.pid(), spec.script());
        }
    }

    @Override
    public void send(BridgeCommand command) {
        boolean request = startsRequest(command);
        synchronized (lock) {
            if (request && inFlight) {
                throw new BusyException("A request is already in progress.");
            }
            if (process != null && process.isAlive()) {
                if (request) inFlight = true;
                write(command, request);
                return;
            }
            if (request) inFlight = true;
        }

        try {
            start();
        } catch (LaunchException e) {
            log.warn("Bridge launch failed: {}", e.getMessage());
            clearInFlight(null);
            report(e);
            return;
        }
        scheduler.schedule(() -> retryWrite(command, request), retryDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void cancel() {
        synchronized (lock) {
            inFlight = false;
            if (process == null || !process.isAlive()) return;
            write(CancelCommand.INSTANCE, false);
        }
    }

    @Override
    public void respondToPermission(String requestId, boolean allow, String message) {
        PermissionResponseCommand response = allow
                ? PermissionResponseCommand.allow(requestId)
                : PermissionResponseCommand.deny(requestId, message);
        synchronized (lock) {
            if (process == null || !process.isAlive()) {
                log.debug("No bridge process to receive permission response {}", requestId);
                return;
            }
            write(response, false);
        }
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return process != null && process.isAlive();
        }
    }

    public boolean isRequestInFlight() {
        synchronized (lock) {
            return inFlight;
        }
    }

    @Override
    public void shutdown() {
        Process stopped;
        LineTransport closing;
        synchronized (lock) {
            stopped = process;
            closing = transport;
            process = null;
            transport = null;
            inFlight = false;
        }
        if (closing != null) closing.close();
        if (stopped != null) {
            stopped.destroy();
            log.info("Stopped bridge process pid={}", stopped.pid());
        }
    }

    private void retryWrite(BridgeCommand command, boolean request) {
        synchronized (lock) {
            if (process != null && process.isAlive()) {
                write(command, request);
                return;
            }
        }
        if (request) clearInFlight(null);
        report(new LaunchException("Bridge process failed to start."));
    }

    /** Caller holds {@code lock}. */
    private void write(BridgeCommand command, boolean request) {
        try {
            transport.writeLine(encoder.encode(command));
        } catch (IOException e) {
            log.warn("Write to bridge process failed: {}", e.getMessage());
            if (request) {
                inFlight = false;
                report(new ProcessTerminatedException("Bridge process terminated unexpectedly.", e));
            }
        }
    }

    private void handleLine(Process source, AuthenticationGate gate, String line) {
        synchronized (lock) {
            if (source != process) return;
        }

        BridgeEvent event;
        try {
            event = gate.admit(line).orElse(null);
        } catch (AuthenticationFailedException e) {
            log.warn("Rejecting bridge process pid={}: handshake missing or nonce mismatch", source.pid());
            shutdown();
            report(e);
            return;
        }
        if (event == null) return;

        if (event instanceof ResultEvent || event instanceof ErrorEvent) {
            clearInFlight(source);
        }
        dispatcher.execute(() -> {
            BridgeListener target = listener;
            if (target != null) target.onEvent(event);
        });
    }

    private void handleExit(Process exited) {
        boolean wasInFlight;
        synchronized (lock) {
            if (exited != process) return;
            wasInFlight = inFlight;
            process = null;
            transport = null;
            inFlight = false;
        }
        if (wasInFlight) {
            log.warn("Bridge process pid={} exited during a request", exited.pid());
            report(new ProcessTerminatedException("Bridge process terminated unexpectedly."));
        } else {
            log.info("Bridge process pid={} exited", exited.pid());
        }
    }

    private void clearInFlight(Process source) {
        synchronized (lock) {
            if (source == null || source == process) inFlight = false;
        }
    }

    private void report(BridgeException failure) {
        dispatcher.execute(() -> {
            BridgeListener target = listener;
            if (target != null) {
                target.onFailure(failure);
            } else {
                log.warn("Bridge failure with no listener: {}", failure.getMessage());
            }
        });
    }

    private static boolean startsRequest(BridgeCommand command) {
        return command instanceof QueryCommand || command instanceof CompactCommand;
    }

    private static String newNonce() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
