package max.coach.evaluator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * One UCI engine process (Stockfish or any UCI engine) used as a {@link PositionEvaluator} session.
 * The process starts on first use. Requests are serialised: a session never has two searches in flight.
 */
public class UciProcessEvaluator implements PositionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(UciProcessEvaluator.class);

    public static final String DEFAULT_PATH = "stockfish";

    private final List<String> command;
    private final Map<String, String> options;

    private Process process;
    private BufferedWriter writer;
    private BufferedReader reader;
    private String engineName = "unknown";

    public UciProcessEvaluator(String path) {
        this(path, Map.of());
    }

    /**
     * @param options UCI options sent with {@code setoption} after the handshake, in iteration order
     */
    public UciProcessEvaluator(String path, Map<String, String> options) {
        this(List.of(path == null || path.isBlank() ? DEFAULT_PATH : path), options);
    }

    /**
     * @param command executable followed by its arguments
     */
    public UciProcessEvaluator(List<String> command, Map<String, String> options) {
        if(command.isEmpty()) {
            throw new IllegalArgumentException("Engine command is empty");
        }
        this.command = List.copyOf(command);
        this.options = new LinkedHashMap<>(Objects.requireNonNull(options));
    }

    /**
     * Reads {@code stockfish.path}, {@code engine.threads} and {@code engine.hash} (MB) from the system properties.
     */
    public static UciProcessEvaluator fromSystemProperties() {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("Threads", System.getProperty("engine.threads", "1"));
        options.put("Hash", System.getProperty("engine.hash", "16"));
        return new UciProcessEvaluator(System.getProperty("stockfish.path", DEFAULT_PATH), options);
    }

    public String path() {
        return command.get(0);
    }

    public synchronized String engineName() {
        return engineName;
    }

    @Override
    public synchronized boolean isAvailable() {
        try {
            ensureStarted();
            return process.isAlive();
        } catch (EvaluatorUnavailableException e) {
            log.warn("Engine at '{}' is not available: {}", path(), e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void newGame() {
        ensureStarted();
        try {
            send("ucinewgame");
            send("isready");
            readUntil("readyok");
        } catch (IOException e) {
            throw fail("Engine at '" + path() + "' stopped answering", e);
        }
    }

    @Override
    public synchronized EngineAnalysis analyse(String fen, SearchLimit limit) {
        Objects.requireNonNull(fen);
        Objects.requireNonNull(limit);
        ensureStarted();
        try {
            send("position fen " + fen);
            send(limit.toGoCommand());
            return readSearch(fen);
        } catch (IOException e) {
            throw fail("Engine at '" + path() + "' stopped answering", e);
        }
    }

    private EngineAnalysis readSearch(String fen) throws IOException {
        UciInfoParser.Info lastExact = null;
        UciInfoParser.Info lastBound = null;
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if(line.isEmpty()) {
                continue;
            }
            if(UciInfoParser.isInfo(line)) {
                UciInfoParser.Info info = UciInfoParser.parseInfo(line);
                if(info.multiPv() == 1 && info.hasScore()) {
                    if(info.bound()) {
                        lastBound = info;
                    } else {
                        lastExact = info;
                    }
                }
            } else if(UciInfoParser.isBestMove(line)) {
                log.debug("<< {}", line);
                return toAnalysis(fen, UciInfoParser.parseBestMove(line), lastExact != null ? lastExact : lastBound);
            } else {
                log.debug("<< {}", line);
            }
        }
        throw fail("Engine at '" + path() + "' closed its output before answering bestmove", null);
    }

    private EngineAnalysis toAnalysis(String fen, String bestMove, UciInfoParser.Info info) {
        if(info == null) {
            log.warn("Engine gave no score for {}, reading it as 0.0", fen);
            return new EngineAnalysis(bestMove, Score.EVEN, 0, bestMove == null ? List.of() : List.of(bestMove), 0);
        }
        // UCI scores are from the side to move
        Score score = isBlackToMove(fen) ? info.score().negate() : info.score();
        List<String> pv = info.principalVariation().isEmpty() && bestMove != null ? List.of(bestMove) : info.principalVariation();
        return new EngineAnalysis(bestMove, score, info.depth(), pv, info.nodes());
    }

    private static boolean isBlackToMove(String fen) {
        String[] fields = fen.trim().split("\\s+");
        return fields.length > 1 && fields[1].equals("b");
    }

    private void ensureStarted() {
        if(process != null) {
            if(process.isAlive()) {
                return;
            }
            throw fail("Engine at '" + path() + "' exited with code " + process.exitValue(), null);
        }
        try {
            ProcessBuilder processBuilder = new ProcessBuilder(command);
            processBuilder.redirectErrorStream(true);
            process = processBuilder.start();
            writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.US_ASCII));
            reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.US_ASCII));

            send("uci");
            readUntil("uciok");
            for(Map.Entry<String, String> option : options.entrySet()) {
                send("setoption name " + option.getKey() + " value " + option.getValue());
            }
            send("isready");
            readUntil("readyok");
            log.info("Engine {} started from '{}'", engineName, path());
        } catch (IOException e) {
            throw fail("Failed to start engine at '" + path() + "'", e);
        }
    }

    private void send(String command) throws IOException {
        log.debug(">> {}", command);
        writer.write(command);
        writer.newLine();
        writer.flush();
    }

    private void readUntil(String token) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if(line.equals(token)) {
                return;
            }
            if(line.startsWith("id name ")) {
                engineName = line.substring("id name ".length());
            } else if(line.startsWith("Unknown command") || line.toLowerCase().contains("error")) {
                log.warn("Engine: {}", line);
            } else {
                log.debug("<< {}", line);
            }
        }
        throw new IOException("Engine output closed while waiting for " + token);
    }

    // Tears the session down so a broken pipe is never reused
    private EvaluatorUnavailableException fail(String message, IOException cause) {
        log.error(message, cause);
        destroy();
        return new EvaluatorUnavailableException(message, cause);
    }

    private void destroy() {
        if(process != null) {
            process.destroy();
        }
        process = null;
        writer = null;
        reader = null;
    }

    @Override
    public synchronized void close() {
        if(process == null) {
            return;
        }
        if(process.isAlive() && writer != null) {
            try {
                send("quit");
            } catch (IOException e) {
                log.debug("Could not send quit to engine, destroying it", e);
            }
        }
        try {
            if(!process.waitFor(1, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        log.info("Engine {} stopped", engineName);
        process = null;
        writer = null;
        reader = null;
    }
}
