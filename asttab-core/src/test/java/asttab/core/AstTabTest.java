package asttab.core;

import org.junit.jupiter.api.Test;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AstTabTest extends AstTabLoggingConfig {

    private static final Logger LOG = Logger.getLogger(AstTabTest.class.getName());

    @Test
    void testCompactParse() {
        LOG.info(() -> "TEST: testCompactParse");
        assertThat(AstTab.parse("Expr(value=Constant(value=None))", false))
                .isEqualTo("ast.Expr(value=ast.Constant(value=None))");
    }

    @Test
    void testPrettyParse() {
        LOG.info(() -> "TEST: testPrettyParse");
        assertThat(AstTab.parse("Expr(value=Constant(value=None))", true)).isEqualTo("""
                ast.Expr(
                    value=ast.Constant(
                        value=None,
                    ),
                )""");
    }

    @Test
    void testPrettyFallsBackToCompactWithWarning() {
        LOG.info(() -> "TEST: testPrettyFallsBackToCompactWithWarning");
        final var records = new CopyOnWriteArrayList<LogRecord>();
        final Handler capture = new Handler() {
            @Override
            public void publish(LogRecord record) {
                records.add(record);
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        final Logger astTabLogger = Logger.getLogger(AstTab.class.getName());
        astTabLogger.addHandler(capture);
        try {
            final String result = AstTab.parse("Constant(value=-1)", true);

            assertThat(result).isEqualTo("ast.Constant(value=-1)");
            assertThat(records)
                    .anySatisfy(r -> {
                        assertThat(r.getLevel()).isEqualTo(Level.WARNING);
                        assertThat(r.getMessage()).contains("UnaryOperation");
                    });
        } finally {
            astTabLogger.removeHandler(capture);
        }
    }

    @Test
    void testPrettyPrintKeepsUnparseableText() {
        LOG.info(() -> "TEST: testPrettyPrintKeepsUnparseableText");
        assertThat(AstTab.prettyPrint("ast.Name(id=")).isEqualTo("ast.Name(id=");
    }

    @Test
    void testPrettyPrintKeepsTextWithOutOfRangeEscape() {
        LOG.info(() -> "TEST: testPrettyPrintKeepsTextWithOutOfRangeEscape");
        final String text = "ast.Constant(value='\\U00110000')";

        assertThat(AstTab.prettyPrint(text)).isEqualTo(text);
    }

    @Test
    void testParseErrorsAreNotSwallowedByPrettyMode() {
        LOG.info(() -> "TEST: testParseErrorsAreNotSwallowedByPrettyMode");
        assertThatThrownBy(() -> AstTab.parse("Constant(value=Maybe)", true))
                .isInstanceOf(DumpParseException.class);
    }

    @Test
    void testCustomFormatterIndent() {
        LOG.info(() -> "TEST: testCustomFormatterIndent");
        final String result = AstTab.parse("Pass()", true,
                new BuilderExpressionGenerator("ast"), new ExpressionFormatter("\t"));

        assertThat(result).isEqualTo("ast.Pass()");
        assertThat(AstTab.parse("Name(id='n')", true, new BuilderExpressionGenerator("ast"), new ExpressionFormatter("\t")))
                .isEqualTo("ast.Name(\n\tid='n',\n)");
    }
}
