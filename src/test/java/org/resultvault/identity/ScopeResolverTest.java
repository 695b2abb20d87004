package org.resultvault.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class ScopeResolverTest {
    private static final SourceText PARSER = SourceText.of(String.join("\n",
            "#include <cstdio>",
            "namespace app {",
            "class Parser {",
            "public:",
            "    int parse(const char* input) {",
            "        int x = 0;",
            "        return x / 0;",
            "    }",
            "};",
            "}"));

    private final ScopeResolver resolver = new ScopeResolver();

    @Test
    void resolvesNamespaceClassAndFunctionChain() {
        Optional<String> scope = resolver.resolve(PARSER, 7);

        assertEquals(Optional.of("namespace app / class Parser / int parse(const char*input)"), scope);
    }

    @Test
    void lineOutsideAnyBlockHasNoScope() {
        assertTrue(resolver.resolve(PARSER, 1).isEmpty());
        assertTrue(resolver.resolve(PARSER, 0).isEmpty());
        assertTrue(resolver.resolve(PARSER, 99).isEmpty());
    }

    @Test
    void controlBlocksDoNotContributeToChain() {
        SourceText source = SourceText.of(String.join("\n",
                "void run() {",
                "    if (ready) {",
                "        fire();",
                "    }",
                "}"));

        assertEquals(Optional.of("void run()"), resolver.resolve(source, 3));
    }

    @Test
    void bracesInsideCommentsAndLiteralsAreIgnored() {
        SourceText source = SourceText.of(String.join("\n",
                "struct Config {",
                "    // }",
                "    const char* open = \"{\";",
                "    /* } } */",
                "    int size;",
                "};"));

        assertEquals(Optional.of("struct Config"), resolver.resolve(source, 5));
    }

    @Test
    void closedBlocksArePoppedFromChain() {
        SourceText source = SourceText.of(String.join("\n",
                "void first() {",
                "}",
                "void second() {",
                "    call();",
                "}"));

        assertEquals(Optional.of("void second()"), resolver.resolve(source, 4));
    }

    @Test
    void digitSeparatorsDoNotOpenCharacterLiterals() {
        SourceText source = SourceText.of(String.join("\n",
                "namespace limits {",
                "struct Bounds { static const long kMax = 1'000'000 - 0xFF'FF; };",
                "const int kDefault = 4;",
                "}",
                "int clamp(long value) {",
                "    char unit = u8'k';",
                "    return value > limits::kMax;",
                "}"));

        assertEquals(Optional.of("namespace limits"), resolver.resolve(source, 3));
        assertEquals(Optional.of("int clamp(long value)"), resolver.resolve(source, 7));
        assertTrue(ScopeResolver.isDigitSeparator("1'000", 1));
        assertFalse(ScopeResolver.isDigitSeparator("u8'k'", 2));
        assertFalse(ScopeResolver.isDigitSeparator("c = 'x'", 4));
    }

    @Test
    void everyLineOfOneFileResolvesFromSingleScan() {
        SourceText source = SourceText.of(String.join("\n",
                "namespace app {",
                "void first() {",
                "    /* spans",
                "       } lines */",
                "    call();",
                "}",
                "struct Holder {",
                "    int value;",
                "};",
                "}"));

        assertSame(source.lineScopes(), source.lineScopes());
        assertEquals(Optional.empty(), resolver.resolve(source, 1));
        assertEquals(Optional.of("namespace app"), resolver.resolve(source, 2));
        assertEquals(Optional.of("namespace app / void first()"), resolver.resolve(source, 4));
        assertEquals(Optional.of("namespace app / void first()"), resolver.resolve(source, 5));
        assertEquals(Optional.of("namespace app"), resolver.resolve(source, 7));
        assertEquals(Optional.of("namespace app / struct Holder"), resolver.resolve(source, 8));
        assertEquals(Optional.of("namespace app"), resolver.resolve(source, 10));
    }

    @Test
    void classifiesHeaders() {
        assertEquals("namespace (anonymous)", ScopeResolver.classify("namespace"));
        assertEquals("class Widget", ScopeResolver.classify("template <typename T> class Widget : public Base<T>"));
        assertEquals("void Widget::draw()const", ScopeResolver.classify("void Widget::draw() const"));
        assertNull(ScopeResolver.classify("while (running)"));
        assertNull(ScopeResolver.classify("int values[] ="));
    }

    @Test
    void normalizeSignatureKeepsOnlySignificantBlanks() {
        assertEquals("int f(int a,int b)", ScopeResolver.normalizeSignature("  int   f( int  a , int b )  "));
    }
}
