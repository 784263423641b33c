package max.coach.analysis;

import max.coach.evaluator.PositionEvaluator;
import max.coach.rules.notations.GameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Reviews independent games in parallel. Each game gets its own evaluator session from the factory,
 * closed once the game is done, so no session ever sees two analyses.
 */
public class BatchGameAnalyzer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BatchGameAnalyzer.class);

    private final Supplier<? extends PositionEvaluator> evaluatorFactory;
    private final AnalyzerConfig config;
    private final ExecutorService executor;

    public BatchGameAnalyzer(Supplier<? extends PositionEvaluator> evaluatorFactory, AnalyzerConfig config, int parallelism) {
        if(parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.evaluatorFactory = Objects.requireNonNull(evaluatorFactory);
        this.config = Objects.requireNonNull(config);
        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "game-analyzer-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * One future per game, in input order. A failing game completes its own future exceptionally
     * and does not affect the others.
     */
    public List<CompletableFuture<GameAnalysis>> submit(List<GameRecord> games) {
        List<CompletableFuture<GameAnalysis>> futures = new ArrayList<>(games.size());
        for(GameRecord game : games) {
            futures.add(CompletableFuture.supplyAsync(() -> analyzeWithOwnSession(game), executor));
        }
        return futures;
    }

    /**
     * Waits for every game.
     *
     * @throws CompletionException wrapping the failure of the first game, in input order, that failed
     */
    public List<GameAnalysis> analyzeAll(List<GameRecord> games) {
        List<CompletableFuture<GameAnalysis>> futures = submit(games);
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).exceptionally(throwable -> null).join();
        List<GameAnalysis> results = new ArrayList<>(futures.size());
        for(CompletableFuture<GameAnalysis> future : futures) {
            results.add(future.join());
        }
        return results;
    }

    private GameAnalysis analyzeWithOwnSession(GameRecord game) {
        try (PositionEvaluator evaluator = evaluatorFactory.get()) {
            return new GameAnalyzer(evaluator, config).analyzeGame(game);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if(!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Game analyses still running after 5s, interrupting them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
