package max.coach;

import max.coach.analysis.AnalyzerConfig;
import max.coach.analysis.GameAnalysis;
import max.coach.analysis.GameAnalyzer;
import max.coach.analysis.MoveAnalysis;
import max.coach.common.AnalysisException;
import max.coach.evaluator.UciProcessEvaluator;
import max.coach.rules.Game;
import max.coach.tactics.MaterialBalance;
import max.coach.tactics.Motif;
import max.coach.tactics.TacticalMotifDetector;
import max.coach.tactics.TacticalSummary;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

public class Main {
    private static final String USAGE = """
            Usage:
              analyze <pgn-file>   review a game with a UCI engine (-Dstockfish.path=..., -Danalysis.depth=...)
              tactics <fen>        list the tactical motifs of a position""";

    public static void main(String[] args) {
        if(args.length < 2) {
            System.err.println(USAGE);
            System.exit(2);
        }
        try {
            switch (args[0]) {
                case "analyze" -> analyze(Path.of(args[1]));
                case "tactics" -> tactics(String.join(" ", List.of(args).subList(1, args.length)));
                default -> {
                    System.err.println(USAGE);
                    System.exit(2);
                }
            }
        } catch (AnalysisException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("Cannot read " + args[1] + ": " + e.getMessage());
            System.exit(1);
        }
    }

    private static void analyze(Path pgnFile) throws IOException {
        String pgn = Files.readString(pgnFile, StandardCharsets.UTF_8);
        try (UciProcessEvaluator evaluator = UciProcessEvaluator.fromSystemProperties()) {
            GameAnalysis analysis = new GameAnalyzer(evaluator, AnalyzerConfig.defaults()).analyzeGame(pgn);
            System.out.println(analysis.summary());
            System.out.println();
            for(MoveAnalysis move : analysis.moves()) {
                String prefix = move.color().isWhite() ? move.moveNumber() + "." : move.moveNumber() + "...";
                System.out.printf(Locale.ROOT, "%-5s %-8s %+7.2f  %-10s %s%n", prefix, move.moveSan(), move.evalAfter(),
                        move.classification().label(), move.comment());
            }
        }
    }

    private static void tactics(String fen) {
        Game game = Game.from(fen);
        System.out.println(game);
        System.out.println();
        List<Motif> motifs = TacticalMotifDetector.analyzeTactics(game);
        for(Motif motif : motifs) {
            System.out.println(motif);
        }
        System.out.println();
        System.out.println(TacticalSummary.describe(motifs));
        System.out.println(MaterialBalance.of(game).description());
    }
}
