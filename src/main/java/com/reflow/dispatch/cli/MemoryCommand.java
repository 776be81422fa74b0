package com.reflow.dispatch.cli;

import com.reflow.core.config.ReflowProperties;
import com.reflow.core.memory.MemoryBank;
import com.reflow.core.memory.MemoryBankStore;
import com.reflow.core.memory.MemoryEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: reflow memory --path memory.json
 * <p>
 * Lists the entries of a persisted memory bank: signature key, stored action and success rate.
 */
@Command(name = "memory", mixinStandardHelpOptions = true, description = "Inspect a persisted memory bank")
@Component
public class MemoryCommand implements Callable<Integer> {

    @Option(names = "--path", description = "Memory bank file (default: reflow.memory.path)")
    private Path path;

    @Option(names = {"--limit", "-n"}, description = "Number of entries to show", defaultValue = "20")
    private int limit;

    private final MemoryBankStore store;
    private final ReflowProperties properties;

    public MemoryCommand(MemoryBankStore store, ReflowProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path file = path;
        if (file == null) {
            String configured = properties.getMemory().getPath();
            if (configured == null || configured.isBlank()) {
                ConsoleOutput.error("No memory bank given; use --path or set reflow.memory.path");
                return 2;
            }
            file = Path.of(configured);
        }
        if (!Files.exists(file)) {
            ConsoleOutput.error("Memory bank not found: " + file);
            return 1;
        }

        MemoryBank bank = new MemoryBank(properties.getMemory().getMinSimilarity(),
                properties.getMemory().getMaxExamples());
        try {
            store.load(file, bank);
        } catch (Exception e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        List<MemoryEntry> entries = bank.entries();
        if (entries.isEmpty()) {
            ConsoleOutput.info("Memory bank is empty.");
            return 0;
        }
        List<MemoryEntry> display = entries.size() > limit ? entries.subList(0, limit) : entries;
        ConsoleOutput.info("Entries (" + display.size() + " of " + entries.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-12s %-16s %-10s %s%n", "STEP", "KIND", "ACTION", "RATE", "TOOL");
        System.out.println("  " + "-".repeat(76));
        for (MemoryEntry entry : display) {
            System.out.printf("  %-24s %-12s %-16s %-10s %s%n",
                    truncate(entry.signature().stepName(), 24),
                    truncate(entry.signature().errorKind(), 12),
                    entry.action(),
                    entry.successes() + "/" + entry.total(),
                    entry.signature().toolName());
        }
        return 0;
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
