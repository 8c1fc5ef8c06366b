package com.mender.dispatch.cli;

import com.mender.core.query.HealingQueryService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: mender stats
 * <p>
 * Prints mission counts and the mean fix confidence from the configured store.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show mission statistics")
@Component
public class StatsCommand implements Runnable {

    private final HealingQueryService queryService;

    public StatsCommand(HealingQueryService queryService) {
        this.queryService = queryService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.stats(queryService.getMissionStats());
    }
}
