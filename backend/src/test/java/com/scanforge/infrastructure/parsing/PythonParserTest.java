package com.scanforge.infrastructure.parsing;

import com.scanforge.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonParserTest {

    private final PythonParser parser = new PythonParser();

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Function, class and entry guard with line ranges")
        void module_inventory() {
            String source = """
                    import pandas as pd


                    class Scanner:
                        \"""Doc.\"""

                        def run(self, df, limit=3):
                            return df.head(limit)


                    def helper(x):
                        return x + 1


                    if __name__ == "__main__":
                        print(helper(1))
                    """;

            PyModule module = parser.parse(source);

            assertThat(module.functions()).extracting(PyStmt.FunctionDef::name).containsExactly("helper");
            assertThat(module.classes()).extracting(PyStmt.ClassDef::name).containsExactly("Scanner");
            PyStmt.ClassDef scanner = module.classes().get(0);
            assertThat(scanner.docstring()).isEqualTo("Doc.");
            assertThat(scanner.methods()).extracting(PyStmt.FunctionDef::name).containsExactly("run");
            assertThat(scanner.methods().get(0).params()).extracting(PyStmt.Param::name)
                    .containsExactly("self", "df", "limit");
            assertThat(scanner.line()).isEqualTo(4);
            assertThat(scanner.endLine()).isEqualTo(8);
            PyStmt last = module.body().get(module.body().size() - 1);
            assertThat(last).isInstanceOf(PyStmt.If.class);
            assertThat(last.line()).isEqualTo(15);
        }

        @Test
        @DisplayName("Compound statements: for/else, while, try/except/finally, with")
        void compound_statements() {
            String source = """
                    for i in range(3):
                        if i == 1:
                            continue
                    else:
                        pass
                    while False:
                        break
                    try:
                        x = 1 / 0
                    except (ZeroDivisionError, ValueError) as exc:
                        x = None
                    finally:
                        done = True
                    with open("f") as fh, open("g"):
                        data = fh.read()
                    """;

            List<PyStmt> body = parser.parse(source).body();

            assertThat(body).hasSize(4);
            assertThat(body.get(0)).isInstanceOf(PyStmt.For.class);
            assertThat(((PyStmt.For) body.get(0)).orElse()).hasSize(1);
            assertThat(body.get(1)).isInstanceOf(PyStmt.While.class);
            PyStmt.Try attempt = (PyStmt.Try) body.get(2);
            assertThat(attempt.handlers()).singleElement().extracting(PyStmt.ExceptHandler::name).isEqualTo("exc");
            assertThat(attempt.finalBody()).hasSize(1);
            assertThat(((PyStmt.With) body.get(3)).items()).hasSize(2);
        }

        @Test
        @DisplayName("Semicolon-separated simple statements become separate nodes")
        void simple_statement_list() {
            assertThat(parser.parse("a = 1; b = 2; del a\n").body())
                    .hasSize(3)
                    .last().isInstanceOf(PyStmt.Delete.class);
        }
    }

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        private PyExpr valueOf(String source) {
            PyStmt.Assign assign = (PyStmt.Assign) parser.parse(source).body().get(0);
            return assign.value();
        }

        @Test
        @DisplayName("Subscript assignment of an astype call")
        void pattern_rule_shape() {
            PyStmt.Assign assign = (PyStmt.Assign) parser.parse(
                    "df['d2_pattern'] = (df['Close'] > df['Open']).astype(int)\n").body().get(0);

            assertThat(assign.targets()).singleElement().isInstanceOf(PyExpr.Subscript.class);
            PyExpr.Call call = (PyExpr.Call) assign.value();
            assertThat(((PyExpr.Attribute) call.func()).attr()).isEqualTo("astype");
        }

        @Test
        @DisplayName("Operator precedence: bitwise & binds tighter than comparison")
        void precedence() {
            PyExpr expr = valueOf("x = a + b * c > d & e\n");

            assertThat(expr).isInstanceOfSatisfying(PyExpr.Compare.class, compare -> {
                assertThat(compare.left()).isInstanceOfSatisfying(PyExpr.BinOp.class,
                        sum -> assertThat(sum.op()).isEqualTo("+"));
                assertThat(compare.comparators()).singleElement().isInstanceOfSatisfying(PyExpr.BinOp.class,
                        and -> assertThat(and.op()).isEqualTo("&"));
            });
        }

        @Test
        @DisplayName("Chained comparison, lambda, comprehension and conditional expression")
        void assorted_expressions() {
            assertThat(valueOf("x = 1 < y <= 3\n")).isInstanceOfSatisfying(PyExpr.Compare.class,
                    c -> assertThat(c.ops()).containsExactly("<", "<="));
            assertThat(valueOf("x = lambda a, *rest, **kw: a\n")).isInstanceOf(PyExpr.Lambda.class);
            assertThat(valueOf("x = {k: v for k, v in items if v}\n"))
                    .isInstanceOfSatisfying(PyExpr.Comprehension.class,
                            c -> assertThat(c.kind()).isEqualTo(PyExpr.ComprehensionKind.DICT));
            assertThat(valueOf("x = a if b else c\n")).isInstanceOf(PyExpr.IfExp.class);
            assertThat(valueOf("x = not a\n")).isInstanceOfSatisfying(PyExpr.UnaryOp.class,
                    u -> assertThat(u.op()).isEqualTo("not"));
            assertThat(valueOf("x = df[~mask]\n")).isInstanceOf(PyExpr.Subscript.class);
        }

        @Test
        @DisplayName("Printer round-trips expressions into parseable source")
        void printer_output_parses() {
            PyExpr expr = valueOf("x = (df['Close'] > P['min']) & (df['Volume'] >= 2_000)\n");

            String printed = ExpressionPrinter.print(expr);

            assertThat(printed).contains("df['Close']").contains("P['min']").contains(" & ");
            assertThat(valueOf("y = " + printed + "\n")).isEqualTo(expr);
        }
    }

    @Nested
    @DisplayName("Newer syntax")
    class NewerSyntax {

        @Test
        @DisplayName("Parenthesized with items, trailing comma allowed")
        void parenthesized_with_items() {
            String source = """
                    with (open('a') as f, open('b') as g):
                        pass
                    with (
                        open('a') as f,
                        open('b'),
                    ):
                        pass
                    with (yield_value) as v:
                        pass
                    """;

            List<PyStmt> body = parser.parse(source).body();

            PyStmt.With first = (PyStmt.With) body.get(0);
            assertThat(first.items()).extracting(item -> ((PyExpr.Name) item.target()).id())
                    .containsExactly("f", "g");
            assertThat(((PyStmt.With) body.get(1)).items()).hasSize(2);
            PyStmt.With grouped = (PyStmt.With) body.get(2);
            assertThat(grouped.items()).singleElement()
                    .satisfies(item -> assertThat(item.context()).isEqualTo(new PyExpr.Name("yield_value")));
        }

        @Test
        @DisplayName("match statement with literal, class, sequence, mapping and guarded cases")
        void match_statement() {
            String source = """
                    def route(cmd):
                        match cmd:
                            case "go" | "run":
                                return 1
                            case Point(x=0, y=yy) as p if yy > 0:
                                return 2
                            case [first, *rest]:
                                return 3
                            case {"kind": -1, **extra}:
                                return 4
                            case _:
                                return 5
                    """;

            PyStmt.FunctionDef route = parser.parse(source).functions().get(0);

            PyStmt.Match match = (PyStmt.Match) route.body().get(0);
            assertThat(match.subject()).isEqualTo(new PyExpr.Name("cmd"));
            assertThat(match.cases()).hasSize(5);
            assertThat(match.cases().get(0).pattern()).isInstanceOfSatisfying(PyExpr.BinOp.class,
                    or -> assertThat(or.op()).isEqualTo("|"));
            PyStmt.MatchCase classCase = match.cases().get(1);
            assertThat(classCase.guard()).isInstanceOf(PyExpr.Compare.class);
            assertThat(classCase.pattern()).isInstanceOfSatisfying(PyExpr.MatchAs.class, as -> {
                assertThat(as.name()).isEqualTo("p");
                assertThat(as.pattern()).isInstanceOfSatisfying(PyExpr.Call.class,
                        call -> assertThat(call.keywords()).extracting(PyExpr.Keyword::name).containsExactly("x", "y"));
            });
            assertThat(match.cases().get(2).pattern()).isInstanceOf(PyExpr.ListExpr.class);
            assertThat(match.cases().get(3).pattern()).isInstanceOfSatisfying(PyExpr.DictExpr.class,
                    dict -> assertThat(dict.keys()).hasSize(2).last().isNull());
            assertThat(match.endLine()).isEqualTo(12);
            assertThat(PyWalker.statements(route.body()))
                    .filteredOn(PyStmt.Return.class::isInstance)
                    .hasSize(5);
        }

        @Test
        @DisplayName("match and type remain usable as ordinary names")
        void soft_keywords_as_names() {
            String source = """
                    match = re.match(pattern, text)
                    type = "daily"
                    print(match, type)
                    match.group(0)
                    """;

            List<PyStmt> body = parser.parse(source).body();

            assertThat(body).hasSize(4);
            assertThat(body.get(0)).isInstanceOf(PyStmt.Assign.class);
            assertThat(body.get(1)).isInstanceOf(PyStmt.Assign.class);
            assertThat(body.get(3)).isInstanceOf(PyStmt.ExprStmt.class);
        }

        @Test
        @DisplayName("type alias and PEP 695 type parameters on def and class")
        void type_alias_and_parameters() {
            String source = """
                    type X = int
                    type Pair[T] = tuple[T, T]
                    def first[T: (int, str), *Ts](items: list[T]) -> T:
                        return items[0]
                    class Box[T]:
                        pass
                    """;

            PyModule module = parser.parse(source);

            assertThat(module.body().get(0)).isInstanceOfSatisfying(PyStmt.TypeAlias.class, alias -> {
                assertThat(alias.name()).isEqualTo("X");
                assertThat(alias.value()).isEqualTo(new PyExpr.Name("int"));
            });
            assertThat(module.body().get(1)).isInstanceOfSatisfying(PyStmt.TypeAlias.class,
                    alias -> assertThat(alias.value()).isInstanceOf(PyExpr.Subscript.class));
            assertThat(module.functions()).singleElement()
                    .satisfies(f -> assertThat(f.hasParam("items")).isTrue());
            assertThat(module.classes()).extracting(PyStmt.ClassDef::name).containsExactly("Box");
        }

        @Test
        @DisplayName("f-string with a same-quote literal inside a replacement field")
        void nested_quote_f_string() {
            PyStmt.Assign assign = (PyStmt.Assign) parser.parse("s = f\"{d[\"k\"]}\"\n").body().get(0);

            assertThat(assign.value()).isInstanceOfSatisfying(PyExpr.Constant.class,
                    constant -> assertThat(constant.text()).isEqualTo("f\"{d[\"k\"]}\""));
        }
    }

    @Test
    @DisplayName("Broken source raises SourceParseException with a line number")
    void broken_source() {
        assertThatThrownBy(() -> parser.parse(Fixtures.load(Fixtures.BROKEN)))
                .isInstanceOf(SourceParseException.class)
                .satisfies(e -> assertThat(((SourceParseException) e).getLine()).isPositive());
    }

    @Test
    @DisplayName("Unexpected indentation at module level is rejected")
    void unexpected_indent() {
        assertThatThrownBy(() -> parser.parse("x = 1\n    y = 2\n"))
                .isInstanceOf(SourceParseException.class)
                .hasMessageContaining("indent");
    }
}
