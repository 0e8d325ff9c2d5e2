package se.bolan.ratedb;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/** Main application class with CLI support */
@Command(
		name = "bolan-ratedb",
		version = "1.0.0",
		description = "Collects Swedish mortgage rates from bank websites",
		mixinStandardHelpOptions = true,
		subcommands = {CrawlCommand.class})
public class Main {

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
