package luadeob.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src).tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    @Test
    void lex_local_declaration() {
        assertEquals(List.of(TokenType.LOCAL, TokenType.NAME, TokenType.ASSIGN, TokenType.NUMBER),
                typesNoEof("local x = 1"));
    }

    @Test
    void lex_keywords_vs_names() {
        var ts = typesNoEof("and break do else elseif end false for function goto if in "
                + "local nil not or repeat return then true until while");
        assertEquals(22, ts.size());
        assertFalse(ts.contains(TokenType.NAME));
        // "continue" is contextual, "end1" is just a name
        assertEquals(List.of(TokenType.NAME, TokenType.NAME), typesNoEof("continue end1"));
    }

    @Test
    void lex_dots_concat_and_field() {
        assertEquals(List.of(TokenType.CONCAT, TokenType.DOTS, TokenType.DOT), typesNoEof(".. ... ."));
        assertEquals(List.of(TokenType.NAME, TokenType.DOT, TokenType.NAME), typesNoEof("a.b"));
        assertEquals(List.of(TokenType.NUMBER, TokenType.CONCAT, TokenType.NUMBER), typesNoEof("1..2"));
    }

    @Test
    void lex_comparison_and_bitwise_operators() {
        assertEquals(List.of(
                TokenType.EQ, TokenType.NE, TokenType.LE, TokenType.GE, TokenType.LT, TokenType.GT,
                TokenType.SHL, TokenType.SHR, TokenType.TILDE, TokenType.AMP, TokenType.PIPE,
                TokenType.DSLASH, TokenType.DCOLON, TokenType.COLON
        ), typesNoEof("== ~= <= >= < > << >> ~ & | // :: :"));
    }

    @Test
    void lex_compound_assignment_operators() {
        assertEquals(List.of(
                TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.STAR_ASSIGN,
                TokenType.SLASH_ASSIGN, TokenType.DSLASH_ASSIGN, TokenType.PERCENT_ASSIGN,
                TokenType.CARET_ASSIGN, TokenType.CONCAT_ASSIGN
        ), typesNoEof("+= -= *= /= //= %= ^= ..="));
    }

    @Test
    void lex_numbers_keep_raw_text() {
        var toks = lex("0x1F 1e10 3.14 .5 0x1p4 2E-3 3.");
        List<String> lexemes = toks.stream().filter(t -> t.type() == TokenType.NUMBER).map(Token::lexeme).toList();
        assertEquals(List.of("0x1F", "1e10", "3.14", ".5", "0x1p4", "2E-3", "3."), lexemes);
    }

    @Test
    void lex_strings_keep_quotes_and_escapes() {
        assertEquals("'a\\'b'", lex("'a\\'b'").get(0).lexeme());
        assertEquals("\"x\\ny\"", lex("\"x\\ny\"").get(0).lexeme());
        assertEquals("[[a]]", lex("[[a]]").get(0).lexeme());
        assertEquals("[==[x]]y]==]", lex("[==[x]]y]==]").get(0).lexeme());
        assertEquals(TokenType.STRING, lex("[[a]]").get(0).type());
    }

    @Test
    void lex_long_string_spanning_lines_tracks_position() {
        var toks = lex("[[a\nb]] x");
        assertEquals("NAME('x')@2:5", toks.get(1).toString());
    }

    @Test
    void lex_bracket_is_not_always_a_long_string() {
        assertEquals(List.of(TokenType.NAME, TokenType.LBRACKET, TokenType.NAME, TokenType.RBRACKET),
                typesNoEof("t[k]"));
        assertEquals(List.of(TokenType.LBRACKET, TokenType.ASSIGN, TokenType.NAME),
                typesNoEof("[=x"));
    }

    @Test
    void lex_comments_skipped() {
        assertEquals(List.of(TokenType.NAME, TokenType.NAME), typesNoEof("x -- cmt\ny"));
        assertEquals(List.of(TokenType.NAME, TokenType.NAME), typesNoEof("a --[[ multi\nline ]] b"));
        assertEquals(List.of(TokenType.NAME, TokenType.NAME), typesNoEof("a --[==[ ]] ]==] b"));
        assertEquals(List.of(TokenType.NAME), typesNoEof("--[ not long\nz"));
    }

    @Test
    void lex_shebang_line_skipped() {
        assertEquals(List.of(TokenType.NAME), typesNoEof("#!/usr/bin/env lua\nx"));
        assertEquals(List.of(TokenType.HASH, TokenType.NAME), typesNoEof("x = 1\n#t").subList(3, 5));
    }

    @Test
    void lex_whitespace_and_positions() {
        var toks = lex("a\n  b");
        assertEquals("NAME('a')@1:1", toks.get(0).toString());
        assertEquals("NAME('b')@2:3", toks.get(1).toString());
    }

    @Test
    void lex_ends_with_eof() {
        var toks = lex("");
        assertEquals(1, toks.size());
        assertEquals(TokenType.EOF, toks.get(0).type());
    }

    @ParameterizedTest
    @ValueSource(strings = {"'abc", "\"ab\nc\"", "[[never closed", "--[[ never closed", "@", "$x", "3x", "1e+"})
    void lex_errors(String input) {
        assertThrows(LexerException.class, () -> lex(input));
    }

    @Test
    void lex_error_reports_position() {
        var e = assertThrows(LexerException.class, () -> lex("x = 1\n  @"));
        assertTrue(e.getMessage().startsWith("[2:"), e.getMessage());
    }
}
