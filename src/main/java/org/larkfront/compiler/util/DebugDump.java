package org.larkfront.compiler.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.larkfront.compiler.frontend.lexer.Token;
import org.larkfront.compiler.frontend.parser.ast.AstNode;
import org.larkfront.compiler.frontend.parser.ast.Program;
import org.larkfront.compiler.frontend.parser.features.load.LoadStatement;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Utility class for rendering tokens and ASTs as debug output.
 */
public final class DebugDump {

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	private DebugDump() {}

	/**
	 * Renders a token sequence, one space between tokens and no trailing space.
	 * @param tokens The tokens to render.
	 * @return The rendered tokens, e.g. {@code load ( "m" , "a" )}.
	 */
	public static String renderTokens(List<Token> tokens) {
		return tokens.stream()
				.map(Token::text)
				.collect(Collectors.joining(" "));
	}

	/**
	 * Renders a program back in source syntax, one statement per line.
	 * @param program The program to render.
	 * @return The rendered program.
	 */
	public static String renderProgram(Program program) {
		return program.getChildren().stream()
				.map(DebugDump::renderNode)
				.collect(Collectors.joining("\n"));
	}

	/**
	 * Converts a program into a pretty-printed JSON document.
	 * @param program The program to convert.
	 * @return The JSON text.
	 */
	public static String toJson(Program program) {
		JsonArray statements = new JsonArray();
		for (AstNode node : program.getChildren()) {
			statements.add(toJsonObject(node));
		}
		JsonObject root = new JsonObject();
		root.add("statements", statements);
		return GSON.toJson(root);
	}

	private static String renderNode(AstNode node) {
		if (node instanceof LoadStatement load) {
			StringBuilder sb = new StringBuilder("load(\"").append(load.moduleName()).append('"');
			for (LoadStatement.LoadedSymbol symbol : load.symbols()) {
				sb.append(", ");
				if (symbol.isAliased()) {
					sb.append(symbol.localName()).append(" = ");
				}
				sb.append('"').append(symbol.exportedName()).append('"');
			}
			return sb.append(')').toString();
		}
		throw new IllegalArgumentException("Unsupported AST node: " + node.getClass().getSimpleName());
	}

	private static JsonObject toJsonObject(AstNode node) {
		if (node instanceof LoadStatement load) {
			JsonArray symbols = new JsonArray();
			for (LoadStatement.LoadedSymbol symbol : load.symbols()) {
				JsonObject entry = new JsonObject();
				entry.addProperty("local", symbol.localName());
				entry.addProperty("exported", symbol.exportedName());
				symbols.add(entry);
			}
			JsonObject json = new JsonObject();
			json.addProperty("kind", "load");
			json.addProperty("module", load.moduleName());
			json.add("symbols", symbols);
			return json;
		}
		throw new IllegalArgumentException("Unsupported AST node: " + node.getClass().getSimpleName());
	}
}
