package com.gateflow.dispatch.cli;

import com.gateflow.core.events.PipelineEvent;
import com.gateflow.core.model.GateStatus;
import com.gateflow.core.model.GateSummary;
import com.gateflow.core.model.HealingReport;
import com.gateflow.core.model.PipelineResult;
import com.gateflow.core.model.PipelineStatus;
import com.gateflow.core.model.QualityMetrics;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;

/**
 * ANSI-colored terminal output for the Gateflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) GATEFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [GATEFLOW]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void status(PipelineStatus status, String message) {
        switch (status) {
            case SUCCESS -> success(message);
            case PARTIAL -> warn(message);
            case FAILED -> error(message);
            default -> info(message);
        }
    }

    public static void gates(List<GateSummary> gates) {
        if (gates.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.printf("  %-6s %-20s %-8s %-6s %s%n", "GATE", "WORKER", "STATUS", "SCORE", "DURATION");
        System.out.println("  " + "-".repeat(56));
        for (GateSummary g : gates) {
            String color = g.status() == GateStatus.SUCCESS ? "fg(green)"
                    : g.status() == GateStatus.PARTIAL ? "fg(yellow)" : "fg(red)";
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %-6d %-20s @|%s %-8s|@ %-6d %s",
                    g.gate(), g.worker(), color, g.status(), g.score(), formatDuration(g.durationMs()))));
        }
    }

    public static void metrics(QualityMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Quality Metrics|@"));
        System.out.println("  Coverage:           " + m.coverage() + "%");
        System.out.println("  Locator confidence: " + m.locatorConfidence() + "%");
        System.out.println("  Compiles:           " + (m.compiles() ? "yes" : "no"));
        System.out.println("  Pass rate:          " + m.passRate() + "%");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Overall:            @|bold " + m.overallScore() + "|@"));
    }

    public static void healing(HealingReport report) {
        if (report.runs().isEmpty()) {
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) [HEALING]|@ " + report.runs().size() + " run(s), "
                        + report.attempts().size() + " attempt(s)"
                        + (report.healingSucceeded() ? ", healed" : "")
                        + (report.exhausted() ? ", exhausted" : "")));
    }

    public static void deliverables(Map<String, List<String>> deliverables) {
        deliverables.forEach((category, paths) -> {
            for (String path : paths) {
                System.out.println(CommandLine.Help.Ansi.AUTO.string(
                        "  @|fg(green) +|@ [" + category + "] " + path));
            }
        });
    }

    public static void result(PipelineResult result) {
        System.out.println();
        System.out.println("PIPELINE " + result.pipelineKey() + " (" + result.requestId() + ")");
        gates(result.gates());
        System.out.println();
        deliverables(result.deliverables());
        healing(result.healing());
        if (result.qualityMetrics() != null) {
            metrics(result.qualityMetrics());
        }
        if (!result.issues().isEmpty()) {
            System.out.println();
            error("Issues (" + result.issues().size() + "):");
            for (String issue : result.issues()) {
                error("  " + issue);
            }
        }
        System.out.println();
        if (result.aborted()) {
            warn("Pipeline aborted; resume with: gateflow resume <domain> <feature>");
        } else if (result.failedGate() != null) {
            status(result.status(), "Pipeline " + result.status() + " at gate " + result.failedGate());
        } else {
            status(result.status(), "Pipeline " + result.status()
                    + (result.executionTimeMs() > 0 ? " in " + formatDuration(result.executionTimeMs()) : ""));
        }
    }

    public static void event(PipelineEvent event) {
        String prefix = switch (event.eventType()) {
            case PipelineEvent.PIPELINE_STARTED, PipelineEvent.PIPELINE_RESUMED -> "@|fg(cyan) [PIPELINE]|@";
            case PipelineEvent.DATA_PREPARATION_DECIDED -> "@|fg(cyan) [GATE 0]|@";
            case PipelineEvent.GATE_STARTED, PipelineEvent.GATE_COMPLETED -> "@|fg(blue) [GATE " + event.gate() + "]|@";
            case PipelineEvent.EXECUTION_RUN -> "@|fg(yellow) [RUN]|@";
            case PipelineEvent.HEALING_ATTEMPTED -> "@|fg(magenta) [HEAL]|@";
            case PipelineEvent.PIPELINE_ABORTED -> "@|fg(red),bold [ABORTED]|@";
            case PipelineEvent.PIPELINE_COMPLETED -> "@|bold [AUDIT]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + describe(event.payload())));
    }

    private static String describe(Map<String, Object> payload) {
        var sb = new StringBuilder();
        payload.forEach((k, v) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(k).append('=').append(v);
        });
        return sb.toString();
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
