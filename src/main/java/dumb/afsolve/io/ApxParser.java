package dumb.afsolve.io;

import dumb.afsolve.AfException;
import dumb.afsolve.Framework;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reader for the APX text format: one statement per line, either {@code arg(a).} declaring
 * an argument or {@code att(a,b).} declaring that {@code a} attacks {@code b}. Names are
 * Unicode letters, digits and underscores, read by code point. Blank lines are ignored; attacks may precede the
 * declarations they refer to.
 */
public class ApxParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private final LinkedHashSet<String> arguments = new LinkedHashSet<>();
    private final List<Framework.Attack> attacks = new ArrayList<>();
    private int currentChar = -2;
    private int pendingChar = -2;
    private int line = 1;
    private int col = 0;

    private ApxParser(Reader reader) {
        this.reader = reader;
    }

    public static Framework parse(String apx) throws ParseException, AfException.MalformedFramework {
        try (var reader = new StringReader(apx)) {
            var parser = new ApxParser(reader);
            parser.parseStatements();
            return Framework.build(parser.arguments, parser.attacks);
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    public static Framework parse(Path file) throws IOException, ParseException, AfException.MalformedFramework {
        return parse(Files.readString(file));
    }

    /** Whether {@code name} is a legal argument name (and not one of the keywords). */
    public static boolean isArgumentName(String name) {
        if (name.isEmpty() || name.equals("arg") || name.equals("att")) return false;
        return name.codePoints().allMatch(ApxParser::isNameChar);
    }

    private static boolean isNameChar(int c) {
        return c != -1 && (Character.isLetterOrDigit(c) || c == '_');
    }

    /** Next code point without consuming it, -1 at end of input. */
    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = readCodePoint();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.appendCodePoint(currentChar);
            }
        }
        return currentChar;
    }

    private int readCodePoint() throws IOException {
        int c;
        if (pendingChar != -2) {
            c = pendingChar;
            pendingChar = -2;
        } else {
            c = reader.read();
        }
        if (c == -1 || !Character.isHighSurrogate((char) c)) return c;
        var low = reader.read();
        if (low != -1 && Character.isLowSurrogate((char) low)) return Character.toCodePoint((char) c, (char) low);
        pendingChar = low;
        return c;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected) {
            throw createParseException("Expected '" + expected + "'", describe(actual));
        }
    }

    private void skipBlanks() throws IOException {
        while (peek() == ' ' || peek() == '\t' || peek() == '\r') consumeChar();
    }

    private void parseStatements() throws IOException, ParseException {
        while (true) {
            skipBlanks();
            var c = peek();
            if (c == -1) return;
            if (c == '\n') {
                consumeChar();
                continue;
            }
            parseStatement();
            skipBlanks();
            c = peek();
            if (c != '\n' && c != -1)
                throw createParseException("Expected end of line after statement", describe(c));
        }
    }

    private void parseStatement() throws IOException, ParseException {
        var keyword = parseName();
        switch (keyword) {
            case "arg" -> {
                consumeChar('(');
                arguments.add(parseArgumentName());
                consumeChar(')');
            }
            case "att" -> {
                consumeChar('(');
                var source = parseArgumentName();
                consumeChar(',');
                var target = parseArgumentName();
                consumeChar(')');
                attacks.add(new Framework.Attack(source, target));
            }
            default -> throw createParseException("Unknown statement '" + keyword + "', expected 'arg' or 'att'");
        }
        consumeChar('.');
    }

    private String parseArgumentName() throws IOException, ParseException {
        var name = parseName();
        if (name.equals("arg") || name.equals("att"))
            throw createParseException("'" + name + "' is reserved and cannot name an argument");
        return name;
    }

    private String parseName() throws IOException, ParseException {
        var sb = new StringBuilder();
        while (isNameChar(peek())) sb.appendCodePoint(consumeChar());
        if (sb.length() == 0) throw createParseException("Expected a name", describe(peek()));
        return sb.toString();
    }

    private static String describe(int c) {
        return switch (c) {
            case -1 -> "EOF";
            case '\n' -> "end of line";
            default -> "'" + Character.toString(c) + "'";
        };
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, -1, -1, "");
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context.strip() + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
