package dev.poireviews;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "poi-review-scraper",
		version = "1.0.0",
		description = "Retrieves all user reviews of a Ctrip point of interest",
		mixinStandardHelpOptions = true,
		subcommands = {FetchCommand.class, ResolveCommand.class})
public class Main implements Callable<Integer> {

	@Override
	public Integer call() {
		new CommandLine(this).usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
