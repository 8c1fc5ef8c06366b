package com.mender.dispatch.cli;

import com.mender.core.model.Fix;
import com.mender.core.query.HealingQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: mender fixes [--limit N]
 */
@Command(name = "fixes", mixinStandardHelpOptions = true, description = "List recent fixes, newest first")
@Component
public class FixesCommand implements Runnable {

    @Option(names = {"-n", "--limit"}, defaultValue = "10", description = "Maximum number of fixes to show")
    int limit;

    private final HealingQueryService queryService;

    public FixesCommand(HealingQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        List<Fix> fixes = queryService.listRecentFixes(limit);
        if (fixes.isEmpty()) {
            ConsoleOutput.info("No fixes recorded");
            return;
        }
        fixes.forEach(ConsoleOutput::fix);
    }
}
