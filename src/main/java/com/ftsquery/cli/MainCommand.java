package com.ftsquery.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ftsquery.config.Constants;
import com.ftsquery.config.ConverterConfig;
import com.ftsquery.query.Conjunction;
import com.ftsquery.query.FtsQuery;
import com.ftsquery.query.TransformResult;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "ftsq",
    description = "🔍 将 Google 风格检索表达式转换为全文检索条件",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.TransformSubcommand.class,
        MainCommand.StopWordSubcommand.class,
        MainCommand.StopWordsSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--stop-words"}, negatable = true, defaultValue = "true", fallbackValue = "true",
        description = "是否加载标准停用词表（默认加载）")
    private boolean standardStopWords = true;

    @Option(names = {"--stop-word"}, description = "附加停用词（可指定多个）")
    private List<String> extraStopWords;

    @Option(names = {"--max-length"}, description = "查询最大长度", defaultValue = "" + Constants.MAX_QUERY_LENGTH)
    private int maxQueryLength = Constants.MAX_QUERY_LENGTH;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 全文检索条件转换器");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    ConverterConfig buildConfig(Conjunction defaultConjunction) {
        ConverterConfig config = ConverterConfig.defaults();
        config.setStandardStopWords(standardStopWords);
        config.setAdditionalStopWords(extraStopWords);
        config.setMaxQueryLength(maxQueryLength);
        if (defaultConjunction != null) {
            config.setDefaultConjunction(defaultConjunction);
        }
        return config;
    }

    private String sanitizeQuery(String rawQuery, int maxLength) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > maxLength) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + maxLength + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "transform", description = "🔎 转换检索表达式")
    static class TransformSubcommand implements Callable<Integer> {

        @Parameters(description = "检索表达式", arity = "1")
        private String query;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format = "text";

        @Option(names = {"-c", "--default-conjunction"}, description = "默认连接词 (${COMPLETION-CANDIDATES})",
            defaultValue = "AND")
        private Conjunction defaultConjunction = Conjunction.AND;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                ConverterConfig config = main.buildConfig(defaultConjunction);
                String safeQuery = main.sanitizeQuery(query, config.getMaxQueryLength());
                TransformResult result = new FtsQuery(config).explain(safeQuery);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                } else {
                    printTextResult(result);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 转换失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(TransformResult result) {
            if (result.empty()) {
                System.out.println("⚠️ 没有可用的检索条件");
                return;
            }
            System.out.println(result.condition());
        }

        private void printJsonResult(TransformResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }
    }

    @Command(name = "stopword", description = "🔤 判断词项是否为停用词")
    static class StopWordSubcommand implements Callable<Integer> {

        @Parameters(description = "待判断的词项", arity = "1")
        private String word;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            FtsQuery ftsQuery = new FtsQuery(main.buildConfig(null));
            if (ftsQuery.isStopWord(word)) {
                System.out.println("✅ \"" + word + "\" 是停用词");
            } else {
                System.out.println("➖ \"" + word + "\" 不是停用词");
            }
            return 0;
        }
    }

    @Command(name = "stopwords", description = "📋 列出当前停用词表")
    static class StopWordsSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            FtsQuery ftsQuery = new FtsQuery(main.buildConfig(null));
            for (String word : ftsQuery.getStopWords()) {
                System.out.println(word);
            }
            System.out.println("📊 共 " + ftsQuery.getStopWords().size() + " 个停用词");
            return 0;
        }
    }
}
