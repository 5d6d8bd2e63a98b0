package com.ftsquery;

import com.ftsquery.query.FtsQuery;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.concurrent.TimeUnit;

/**
 * 转换性能基准测试
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TransformBenchmark {

    private FtsQuery ftsQuery;
    private String nestedQuery;

    @Setup
    public void setup() {
        ftsQuery = new FtsQuery(true);
        StringBuilder builder = new StringBuilder();
        // 32 层嵌套括号
        for (int i = 0; i < 32; i++) {
            builder.append("(term").append(i).append(" or ");
        }
        builder.append("leaf");
        builder.append(")".repeat(32));
        nestedQuery = builder.toString();
    }

    @Benchmark
    public String transformSimple() {
        return ftsQuery.transform("java programming");
    }

    @Benchmark
    public String transformComplex() {
        return ftsQuery.transform("the search -draft or ~engine and (index or \"full text\") <+quick +fox> config*");
    }

    @Benchmark
    public String transformNested() {
        return ftsQuery.transform(nestedQuery);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(TransformBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
