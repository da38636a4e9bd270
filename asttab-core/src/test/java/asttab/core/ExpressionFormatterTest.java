package asttab.core;

import asttab.core.BuilderAst.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionFormatterTest extends AstTabLoggingConfig {

    private static final Logger LOG = Logger.getLogger(ExpressionFormatterTest.class.getName());

    private static final String FOUR = "    ";

    private static String pretty(String builderText) {
        return ExpressionFormatter.format(BuilderExpressionParser.parse(builderText), FOUR);
    }

    @Test
    void testCallIsExplodedWithTrailingCommas() {
        LOG.info(() -> "TEST: testCallIsExplodedWithTrailingCommas");
        assertThat(pretty("ast.Name(id='x', ctx=ast.Load())")).isEqualTo("""
                ast.Name(
                    id='x',
                    ctx=ast.Load(),
                )""");
    }

    @Test
    void testNestingAddsOneUnitPerLevel() {
        LOG.info(() -> "TEST: testNestingAddsOneUnitPerLevel");
        assertThat(pretty("ast.List(elts=[ast.Constant(value=1)])")).isEqualTo("""
                ast.List(
                    elts=[
                        ast.Constant(
                            value=1,
                        ),
                    ],
                )""");
    }

    @Test
    void testEmptyContainersAndBareCallsStayInline() {
        LOG.info(() -> "TEST: testEmptyContainersAndBareCallsStayInline");
        assertThat(pretty("[]")).isEqualTo("[]");
        assertThat(pretty("()")).isEqualTo("()");
        assertThat(pretty("{}")).isEqualTo("{}");
        assertThat(pretty("ast.Load()")).isEqualTo("ast.Load()");
        assertThat(pretty("ast.Module(body=[], type_ignores=[])")).isEqualTo("""
                ast.Module(
                    body=[],
                    type_ignores=[],
                )""");
    }

    @Test
    void testSingleElementTupleStaysATuple() {
        LOG.info(() -> "TEST: testSingleElementTupleStaysATuple");
        final String formatted = pretty("(1,)");

        assertThat(formatted).isEqualTo("(\n    1,\n)");
        assertThat(BuilderExpressionParser.parse(formatted)).isInstanceOf(TupleLiteral.class);
    }

    @Test
    void testPositionalBeforeKeywordArguments() {
        LOG.info(() -> "TEST: testPositionalBeforeKeywordArguments");
        assertThat(pretty("f(1, 'two', three=3, **rest)")).isEqualTo("""
                f(
                    1,
                    'two',
                    three=3,
                    **rest,
                )""");
    }

    @Test
    void testMappingEntries() {
        LOG.info(() -> "TEST: testMappingEntries");
        final var mapping = new MappingLiteral(List.of(
                new MappingEntry(Literal.string("k"), Literal.integer(1)),
                new MappingEntry(null, new Identifier("rest"))));

        assertThat(ExpressionFormatter.format(mapping, "  ")).isEqualTo("""
                {
                  'k': 1,
                  None: rest,
                }""");
    }

    @Test
    void testLiteralsUseCanonicalRepr() {
        LOG.info(() -> "TEST: testLiteralsUseCanonicalRepr");
        assertThat(ExpressionFormatter.format(new Literal(LiteralKind.INTEGER, "+007"), FOUR)).isEqualTo("7");
        assertThat(pretty("\"plain\"")).isEqualTo("'plain'");
        assertThat(pretty("b\"x\"")).isEqualTo("b'x'");
        assertThat(pretty("a.b.c")).isEqualTo("a.b.c");
    }

    @Test
    void testUnaryOperationIsUnsupported() {
        LOG.info(() -> "TEST: testUnaryOperationIsUnsupported");
        assertThatThrownBy(() -> pretty("ast.Constant(value=-1)"))
                .isInstanceOf(UnsupportedExpressionException.class)
                .hasMessage("Unsupported expression node: UnaryOperation")
                .extracting(e -> ((UnsupportedExpressionException) e).variant())
                .isEqualTo("UnaryOperation");
    }

    @Test
    void testFormattingIsIdempotent() {
        LOG.info(() -> "TEST: testFormattingIsIdempotent");
        final String once = pretty(DumpParser.parse("""
                Module(
                    body=[
                        FunctionDef(
                            name='f',
                            args=arguments(posonlyargs=[], args=[arg(arg='a')], kwonlyargs=[], kw_defaults=[], defaults=[]),
                            body=[Return(value=Name(id='a', ctx=Load()))],
                            decorator_list=[],
                            type_params=[])],
                    type_ignores=[])"""));
        final String twice = pretty(once);

        assertThat(twice).isEqualTo(once);
    }
}
