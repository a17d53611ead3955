package org.larkfront.cli.commands;

import com.typesafe.config.Config;
import org.larkfront.compiler.Frontend;
import org.larkfront.compiler.api.ParseException;
import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.util.DebugDump;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.List;

@Command(name = "tokenize", description = "Tokenizes a source file and prints the token stream.")
public class TokenizeCommand extends SourceCommand {

    @Override
    protected void dump(Frontend frontend, String source, String fileName, Config config, PrintWriter out)
            throws ParseException {
        List<Token> tokens = frontend.tokenize(source, fileName);
        out.println("Tokens:");
        out.println(DebugDump.renderTokens(tokens));
    }
}
