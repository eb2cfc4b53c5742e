package luadeob;

import luadeob.ast.Chunk;
import luadeob.config.Settings;
import luadeob.lexer.Lexer;
import luadeob.lexer.Token;
import luadeob.lexer.TokenType;
import luadeob.parser.Parser;
import luadeob.printer.LuaPrinter;
import luadeob.rename.NameGenerator;
import luadeob.rename.Renamer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lexer, parser, renamer and printer wired for one script at a time.
 * Every call builds its own generator, scope stack and tree, so a single
 * instance can serve concurrent callers.
 */
public final class Deobfuscator {
    private static final Logger logger = LoggerFactory.getLogger(Deobfuscator.class);

    public record Result(
            String output,
            int declarations,
            int rewrites
    ) {}

    private final String namePrefix;

    public Deobfuscator() {
        this(Settings.defaults());
    }

    public Deobfuscator(Settings settings) {
        this.namePrefix = settings.namePrefix();
    }

    /**
     * @throws DeobfuscationException if the source does not parse or the
     *         tree cannot be renamed; nothing is returned in that case
     */
    public Result deobfuscate(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        logger.debug("Lexer: {} tokens", tokens.size());

        Chunk chunk = new Parser(tokens).parseChunk();
        logger.debug("Parser: {} top-level statements", chunk.block().statements().size());

        Set<String> existing = tokens.stream()
                .filter(t -> t.type() == TokenType.NAME)
                .map(Token::lexeme)
                .collect(Collectors.toSet());

        Renamer renamer = new Renamer(new NameGenerator(namePrefix, existing));
        renamer.traverse(chunk);

        return new Result(LuaPrinter.print(chunk), renamer.declarations(), renamer.rewrites());
    }
}
