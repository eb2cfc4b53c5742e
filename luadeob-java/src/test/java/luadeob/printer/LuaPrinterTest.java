package luadeob.printer;

import luadeob.ast.Chunk;
import luadeob.lexer.Lexer;
import luadeob.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class LuaPrinterTest {

    private static Chunk parse(String src) {
        return new Parser(new Lexer(src).tokenize()).parseChunk();
    }

    private static String reprint(String src) {
        return LuaPrinter.print(parse(src));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "local t = {1, x = 2, [k] = 3}\n",
            "return - -y\n",
            "return not x\n",
            "return -x ^ 2, #t, ~m\n",
            "return (a + b) * c\n",
            "local s = [[hi]] .. 'x' .. \"y\"\n",
            "local n = 0x1p4 + 1e-3\n",
            "x = t[ [[k]] ]\n",
            "obj:method(1)(2).field[3] = nil\n",
            "goto done\n::done::\n",
            "local c <close> = nil\n",
            "n //= 2\n",
    })
    void print_is_stable(String src) {
        assertEquals(src, reprint(src));
    }

    @Test
    void print_blocks_with_indentation() {
        assertEquals("""
                if a then
                elseif b then
                    while true do
                        break
                    end
                else
                    repeat
                        continue
                    until x
                end
                """, reprint("if a then elseif b then while true do break end else repeat continue until x end end"));
    }

    @Test
    void print_numeric_and_generic_for() {
        assertEquals("""
                for i = 10, 1, -1 do
                end
                for k, v in pairs(t) do
                    print(k, v)
                end
                """, reprint("for i=10,1,-1 do end for k,v in pairs(t) do print(k,v) end"));
    }

    @Test
    void print_functions() {
        assertEquals("""
                local function f(a, ...)
                    return ...
                end
                function M.sub:m()
                end
                local g = function(...)
                end
                """, reprint("local function f(a,...) return ... end function M.sub:m() end local g = function(...) end"));
    }

    @Test
    void print_call_sugar_as_parenthesized_call() {
        assertEquals("require(\"mod\")\nf({1})\n", reprint("require\"mod\" f{1}"));
    }

    @Test
    void print_guards_statement_starting_with_paren() {
        assertEquals("local x = y\n;(f)()\n", reprint("local x = y;(f)()"));
    }

    @Test
    void print_unary_minus_before_negative_operand() {
        assertEquals("return - -x ^ 2\n", reprint("return - -x^2"));
        assertEquals("return -(-x)\n", reprint("return -(-x)"));
    }

    @Test
    void print_return_without_values() {
        assertEquals("do\n    return\nend\n", reprint("do return end"));
    }

    @Test
    void print_twice_is_idempotent() {
        String once = reprint("local a,b=1,2 if a<b then print((a)) end t={f=function(x) return x end}");
        assertEquals(once, reprint(once));
    }
}
