package com.ngramdict;

import com.ngramdict.dictionary.Dictionary;
import com.ngramdict.dictionary.DictionaryStrategy;
import com.ngramdict.match.NgramMatcher;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * 词典构建与 n-gram 匹配基准测试，对比两种词典表示
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class MatchBenchmark {

    @State(Scope.Benchmark)
    public static class CorpusState {
        @Param({"POOLED", "COPYING"})
        String strategy;

        byte[] corpus;
        byte[] query;
        Dictionary dictionary;
        NgramMatcher matcher;

        @Setup
        public void setup() {
            // 10万个词条，其中每10个有一个双词短语
            StringBuilder corpusBuilder = new StringBuilder();
            for (int i = 0; i < 100_000; i++) {
                corpusBuilder.append(i % 10 == 0 ? "phrase " + i : "word" + i).append('\n');
            }
            corpus = corpusBuilder.toString().getBytes(StandardCharsets.UTF_8);

            StringBuilder queryBuilder = new StringBuilder();
            for (int i = 0; i < 2_000; i++) {
                queryBuilder.append(i % 3 == 0 ? "phrase " + (i * 10) : "word" + (i * 7)).append(' ');
            }
            queryBuilder.append("tail");
            query = queryBuilder.toString().getBytes(StandardCharsets.UTF_8);

            dictionary = DictionaryStrategy.valueOf(strategy).build(corpus);
            matcher = new NgramMatcher(dictionary);
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public Dictionary buildDictionary(CorpusState state) {
        return DictionaryStrategy.valueOf(state.strategy).build(state.corpus);
    }

    @Benchmark
    public int findAllMatchesTrigram(CorpusState state) {
        return state.matcher.findAllMatches(state.query, 3).size();
    }

    @Benchmark
    public int findAllMatchesUnigram(CorpusState state) {
        return state.matcher.findAllMatches(state.query, 1).size();
    }

    @Benchmark
    public boolean containsWholeQuery(CorpusState state) {
        return state.matcher.contains(state.query);
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(MatchBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
