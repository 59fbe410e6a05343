package imgpack;

import imgpack.commands.*;
import imgpack.utils.*;
import picocli.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.concurrent.*;

@Command(
    name = "imgpack",
    description = "Batch-transcodes the images of each subdirectory and packs them into one zip per directory.",
    mixinStandardHelpOptions = true,
    versionProvider = ManifestVersionProvider.class,
    subcommands = {
        PackCommand.class,
    }
)
public class MainCli implements Callable<Integer> {

    public static final String DOCS_TXT_RESOURCE_PATH = "/docs.txt";
    @Option(names = "--docs", description = "Show project and command documentation.")
    private boolean docsRequested;

    @Spec
    Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        if (docsRequested) {
            return printDocs(spec.commandLine().getOut());
        }

        spec.commandLine().usage(spec.commandLine().getOut());
        return ExitCode.OK;
    }

    private int printDocs(PrintWriter out) {
        try (InputStream in = getClass().getResourceAsStream(DOCS_TXT_RESOURCE_PATH);
             BufferedReader reader = in == null ? null : new BufferedReader(new InputStreamReader(in))) {
            if (reader == null) {
                spec.commandLine().getErr().println("Documentation not found.");
                return ExitCode.ERROR;
            }
            reader.lines().forEach(out::println);
            out.flush();
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error reading documentation: " + e.getMessage());
            return ExitCode.ERROR;
        }
        return ExitCode.OK;
    }

    public static CommandLine createCommandLine() {
        CommandLine cli = new CommandLine(new MainCli());

        cli.setExecutionExceptionHandler(new ShortErrorHandler());
        cli.setCaseInsensitiveEnumValuesAllowed(true);
        cli.setUsageHelpAutoWidth(true);
        return cli;
    }

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        CommandLine cli = createCommandLine();
        cli.setColorScheme(Help.defaultColorScheme(Help.Ansi.AUTO));

        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }

    static class ShortErrorHandler implements IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
            cmd.getErr().println(cmd.getColorScheme().errorText("ERROR: " + ex.getMessage()));
            if (cmd.isUsageHelpRequested() || cmd.isVersionHelpRequested()) {
                return cmd.getCommandSpec().exitCodeOnUsageHelp();
            }
            return cmd.getCommandSpec().exitCodeOnExecutionException();
        }
    }

}
