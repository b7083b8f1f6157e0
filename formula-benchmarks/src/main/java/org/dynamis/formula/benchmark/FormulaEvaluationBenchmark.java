package org.dynamis.formula.benchmark;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.dynamis.formula.desc.ModelDesc;
import org.dynamis.formula.eval.EvalEnvironment;
import org.dynamis.formula.parser.ParseNode;
import org.dynamis.formula.parser.antlr4.Antlr4FormulaParser;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the cost of turning formula text into a model description, split into the parse and
 * the term-algebra evaluation of an already parsed tree.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Ddynamis.formula.trace=false"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class FormulaEvaluationBenchmark {

    @State(Scope.Thread)
    public static class FormulaState {

        @Param({
                "y ~ a + b",
                "y ~ a * b * c + log(x)",
                "y ~ (a + b + c + d + e) ** 3",
                "y ~ (a + b)/c + d:e - 1"
        })
        String formula;

        EvalEnvironment environment;
        ParseNode tree;

        @Setup(Level.Trial)
        public void parse() {
            environment = EvalEnvironment.capture(Map.of());
            tree = Antlr4FormulaParser.parseFormula(formula);
        }
    }

    @Benchmark
    public ParseNode parseOnly(FormulaState state) {
        return Antlr4FormulaParser.parseFormula(state.formula);
    }

    @Benchmark
    public ModelDesc evaluateParsed(FormulaState state) {
        return ModelDesc.fromFormula(state.tree, state.environment);
    }

    @Benchmark
    public String parseEvaluateDescribe(FormulaState state) {
        return ModelDesc.fromFormula(state.formula, state.environment).describe();
    }
}
