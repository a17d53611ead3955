package org.larkfront.cli.commands;

import com.typesafe.config.Config;
import org.larkfront.cli.CommandLineInterface;
import org.larkfront.compiler.Frontend;
import org.larkfront.compiler.api.ParseException;
import picocli.CommandLine;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Base class for subcommands that read one source file and print a dump of it.
 * <p>
 * Output follows the layout {@code Input:}, the echoed file, a blank line, then the section
 * produced by {@link #dump}. Any read, lexical or syntax error prints the diagnostics to
 * stderr and yields exit code 1.
 */
abstract class SourceCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "FILE", description = "The source file to read.")
    private File file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final Config config = parent.getConfig();
        final PrintWriter out = spec.commandLine().getOut();
        final Frontend frontend = new Frontend();

        try {
            final String source = frontend.readSource(file.toPath());
            if (config.getBoolean("cli.echo-input")) {
                out.println("Input:");
                out.println(source);
                out.println();
            }
            dump(frontend, source, file.getPath(), config, out);
            out.flush();
            return 0;
        } catch (ParseException e) {
            final PrintWriter err = spec.commandLine().getErr();
            err.println("Error: " + frontend.getDiagnostics().summary());
            err.flush();
            return 1;
        }
    }

    /**
     * Processes the source and prints the result.
     * @param frontend The frontend to use; failures are recorded in its diagnostics.
     * @param source The complete file content.
     * @param fileName The file name, for diagnostics.
     * @param config The application configuration.
     * @param out The writer for regular output.
     * @throws ParseException if the source is invalid.
     */
    protected abstract void dump(Frontend frontend, String source, String fileName, Config config, PrintWriter out)
            throws ParseException;
}
