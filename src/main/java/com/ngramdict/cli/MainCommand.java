package com.ngramdict.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ngramdict.BufferSet;
import com.ngramdict.config.Constants;
import com.ngramdict.config.EngineConfig;
import com.ngramdict.dictionary.Dictionary;
import com.ngramdict.dictionary.DictionaryStrategy;
import com.ngramdict.match.NgramMatcher;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.Callable;

@Command(
    name = "ngd",
    description = "📖 词典成员查询与 n-gram 精确匹配",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ContainsSubcommand.class,
        MainCommand.MatchSubcommand.class,
        MainCommand.ScanSubcommand.class,
        MainCommand.StatsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--dict"}, description = "词典语料文件（每行一个词条），默认 " + Constants.DEFAULT_DICTIONARY_FILE)
    private Path dictPath;

    @Option(names = {"--strategy"}, description = "词典表示 (pooled|copying)")
    private String strategy;

    @Option(names = {"--config"}, description = "properties 配置文件，命令行参数优先")
    private Path configPath;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📖 词典成员查询与 n-gram 精确匹配");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行参数。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config;
        if (configPath != null) {
            Properties properties = new Properties();
            try (InputStream input = Files.newInputStream(configPath)) {
                properties.load(input);
            }
            config = EngineConfig.fromProperties(properties);
        } else {
            config = EngineConfig.defaults();
        }
        if (dictPath != null) {
            config.setDictionaryPath(dictPath);
        }
        if (strategy != null) {
            config.setStrategy(DictionaryStrategy.fromName(strategy));
        }
        return config;
    }

    private int sanitizeNgramSize(Integer rawSize, EngineConfig config) {
        int size = rawSize != null ? rawSize : config.getMaxNgramSize();
        if (size < 0) {
            System.err.printf("⚠️ n=%d 非法，已使用 1%n", size);
            return 1;
        }
        if (size > Constants.MAX_NGRAM_SIZE) {
            System.err.printf("⚠️ n=%d 超过上限 %d，已自动限制%n", size, Constants.MAX_NGRAM_SIZE);
            return Constants.MAX_NGRAM_SIZE;
        }
        return size;
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        if (rawQuery.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return rawQuery;
    }

    @Command(name = "contains", description = "🔎 判断整段文本是否为词典词条")
    static class ContainsSubcommand implements Callable<Integer> {

        @Parameters(description = "待查询文本", arity = "1")
        private String needle;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                BufferSet bufferSet = BufferSet.load(config.getDictionaryPath(), config);
                System.out.println(bufferSet.contains(main.sanitizeQuery(needle)));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "match", description = "🧩 查找文本中所有命中词典的 n-gram")
    static class MatchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询文本（按空格分词）", arity = "1")
        private String query;

        @Option(names = {"-n", "--max-ngram"}, description = "n-gram 最大词数，0 视为 1")
        private Integer maxNgram;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                BufferSet bufferSet = BufferSet.load(config.getDictionaryPath(), config);
                String safeQuery = main.sanitizeQuery(query);
                int safeSize = main.sanitizeNgramSize(maxNgram, config);

                long startNanos = System.nanoTime();
                List<String> matches = bufferSet.findAllMatches(safeQuery, safeSize);
                long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
                int effectiveSize = (int) NgramMatcher.effectiveWindow(safeSize);
                MatchReport report = new MatchReport(safeQuery, effectiveSize, matches, elapsedMs);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(report);
                } else {
                    printTextResult(report);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 匹配失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResult(MatchReport report) {
            if (report.matches().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }
            for (String match : report.matches()) {
                System.out.println(match);
            }
            System.out.println();
            System.out.println("📊 共 " + report.matches().size() + " 条匹配，用时 " + report.elapsedMs() + "ms");
        }

        private void printJsonResult(MatchReport report) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
        }
    }

    @Command(name = "scan", description = "📄 逐行匹配文件中的每一行")
    static class ScanSubcommand implements Callable<Integer> {

        @Parameters(description = "查询文件（UTF-8，每行一条查询）", arity = "1")
        private Path inputFile;

        @Option(names = {"-n", "--max-ngram"}, description = "n-gram 最大词数，0 视为 1")
        private Integer maxNgram;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                BufferSet bufferSet = BufferSet.load(config.getDictionaryPath(), config);
                int safeSize = main.sanitizeNgramSize(maxNgram, config);

                int lineNumber = 0;
                int matchedLines = 0;
                try (BufferedReader reader = Files.newBufferedReader(inputFile, StandardCharsets.UTF_8)) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        lineNumber++;
                        List<String> matches = bufferSet.findAllMatches(line, safeSize);
                        if (!matches.isEmpty()) {
                            matchedLines++;
                            System.out.println(lineNumber + ": " + String.join(" | ", matches));
                        }
                    }
                }
                System.out.println("📊 共 " + lineNumber + " 行，" + matchedLines + " 行有匹配");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 扫描失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "stats", description = "📊 查看词典统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                Dictionary dictionary = BufferSet.load(config.getDictionaryPath(), config).dictionary();

                System.out.println("📊 词典状态");
                System.out.println("═══════════");
                System.out.println("📁 语料文件: " + config.getDictionaryPath());
                System.out.println("🔤 词条总数: " + dictionary.size());
                System.out.println("💾 语料大小: " + formatBytes(dictionary.corpusLength()));
                System.out.println("🧱 表示方式: " + dictionary.strategy().name().toLowerCase(Locale.ROOT));
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format(Locale.ROOT, "%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format(Locale.ROOT, "%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format(Locale.ROOT, "%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
