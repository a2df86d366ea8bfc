package dev.commonsdl;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "commons-bulk-downloader",
		version = "1.0.0",
		description = "Downloads the media files of Wikimedia Commons categories, resolved from the database dumps",
		mixinStandardHelpOptions = true,
		subcommands = {
			FetchCommand.class,
			DownloadCommand.class,
			RunCommand.class,
			StatusCommand.class,
			CleanCommand.class
		})
public class Main implements Runnable {

	@Spec
	private CommandSpec spec;

	@Override
	public void run() {
		throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
