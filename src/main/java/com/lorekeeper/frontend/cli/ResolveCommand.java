package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.curator.DisputeResolver;
import com.lorekeeper.core.error.CanonVersionConflictException;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import org.springframework.stereotype.Component;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: lorekeeper resolve &lt;dispute-id&gt; --accept|--keep
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve an open dispute")
@Component
public class ResolveCommand implements Runnable {

    @Parameters(index = "0", description = "Dispute ID")
    private String disputeId;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Choice choice;

    static class Choice {
        @Option(names = "--accept", required = true, description = "Install the incoming claim into Canon")
        boolean accept;

        @Option(names = "--keep", required = true, description = "Keep the current Canon value")
        boolean keep;
    }

    @Option(names = {"--note", "-n"}, description = "Reason for the decision", defaultValue = "")
    private String note;

    @Option(names = "--by", description = "Operator name", defaultValue = "operator")
    private String resolvedBy;

    private final DisputeResolver resolver;

    public ResolveCommand(DisputeResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var outcome = choice.accept ? DisputeResolution.Outcome.ACCEPTED_INCOMING : DisputeResolution.Outcome.KEPT_CANON;
        try {
            DisputeRecord resolved = resolver.resolve(disputeId, outcome, resolvedBy, note);
            if (resolved.resolution().resultingCanonVersion() != null) {
                ConsoleOutput.success("Dispute " + disputeId + " resolved: '" + resolved.canonKey() + "' is now v"
                        + resolved.resolution().resultingCanonVersion());
            } else {
                ConsoleOutput.success("Dispute " + disputeId + " resolved: Canon kept");
            }
        } catch (CanonVersionConflictException e) {
            ConsoleOutput.error(e.getMessage() + ". Canon changed since the dispute was raised; it stays open.");
        } catch (LorekeeperException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
