package org.larkfront.cli.commands;

import com.typesafe.config.Config;
import org.larkfront.compiler.Frontend;
import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.frontend.parser.ast.Program;
import org.larkfront.compiler.util.DebugDump;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

@Command(name = "parse", description = "Parses a source file and prints the resulting program.")
public class ParseCommand extends SourceCommand {

    /** Output formats of the program dump. */
    public enum Format { TEXT, JSON }

    @Option(names = {"-o", "--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: cli.output-format).")
    private Format format;

    @Override
    protected void dump(Frontend frontend, String source, String fileName, Config config, PrintWriter out)
            throws ParseException {
        Program program = frontend.parse(source, fileName);
        Format effective = format != null
                ? format
                : config.getEnum(Format.class, "cli.output-format");

        out.println("Program:");
        out.println(effective == Format.JSON ? DebugDump.toJson(program) : DebugDump.renderProgram(program));
    }
}
