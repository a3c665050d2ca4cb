package com.invertedindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invertedindex.config.Constants;
import com.invertedindex.config.IndexConfig;
import com.invertedindex.document.DocumentLoader;
import com.invertedindex.index.InvertedIndex;
import com.invertedindex.index.InvertedIndexBuilder;
import com.invertedindex.query.QueryAnswer;
import com.invertedindex.query.QueryEngine;
import com.invertedindex.storage.StorageFormat;
import com.invertedindex.text.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "inverted-index",
    description = "🔍 倒排索引构建、持久化与查询工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.BuildSubcommand.class,
        MainCommand.QuerySubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--storage"}, description = "存储格式 (binary|json)", defaultValue = "BINARY")
    private StorageFormat storageFormat = StorageFormat.BINARY;

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * 创建命令行解析器，枚举值大小写不敏感。
     */
    static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    @Override
    public Integer call() {
        System.out.println("🔍 倒排索引构建、持久化与查询工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 以全局选项覆盖默认配置。
     */
    IndexConfig newConfig() {
        IndexConfig config = IndexConfig.defaults();
        if (storageFormat != null) {
            config.setStorageFormat(storageFormat);
        }
        return config;
    }

    @Command(name = "build", description = "📂 构建倒排索引并写入磁盘")
    static class BuildSubcommand implements Callable<Integer> {

        @Option(names = {"-d", "--dataset"}, description = "文档集路径", defaultValue = Constants.DEFAULT_DATASET_PATH)
        private Path datasetPath;

        @Option(names = {"-o", "--output"}, description = "倒排索引存储路径", defaultValue = Constants.DEFAULT_INDEX_PATH)
        private Path outputPath;

        @Option(names = {"--dataset-charset"}, description = "文档集字符集，默认 UTF-8", defaultValue = "UTF-8")
        private Charset datasetCharset;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            IndexConfig config = main.newConfig();
            config.setDatasetPath(datasetPath);
            config.setIndexPath(outputPath);
            config.setDocumentCharset(datasetCharset);
            logger.debug("build: dataset={}, charset={}, output={}, storage={}",
                config.getDatasetPath(), config.getDocumentCharset(), config.getIndexPath(), config.getStorageFormat());

            try {
                long start = System.currentTimeMillis();
                Map<String, String> documents = new DocumentLoader(config.getDocumentCharset())
                    .loadDocuments(config.getDatasetPath());
                InvertedIndex index = new InvertedIndexBuilder().build(documents);
                index.dump(config.getIndexPath(), config.getStorageFormat().createPolicy());
                long elapsed = System.currentTimeMillis() - start;

                System.out.println("✅ 索引完成！");
                System.out.println("📊 统计:");
                System.out.println("   文档数: " + documents.size());
                System.out.println("   词条数: " + index.getTermCount());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 构建失败: " + exception.getMessage());
                logger.debug("构建失败详情", exception);
                return 1;
            }
        }
    }

    @Command(name = "query", description = "🔎 对倒排索引执行 AND 查询")
    static class QuerySubcommand implements Callable<Integer> {

        @Option(names = {"-i", "--index"}, description = "倒排索引路径", defaultValue = Constants.DEFAULT_INDEX_PATH)
        private Path indexPath;

        @ArgGroup(exclusive = false, multiplicity = "0..*")
        private List<WordQuery> wordQueries;

        @ArgGroup(exclusive = true, multiplicity = "0..1")
        private QueryFile queryFile;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        static class WordQuery {
            @Option(names = {"-q", "--query"}, arity = "1..*", required = true,
                description = "一条查询的词项，可重复指定多条查询")
            private List<String> words;
        }

        static class QueryFile {
            @Option(names = {"--query-file-utf8"}, description = "UTF-8 查询文件，每行一条查询")
            private Path utf8Path;

            @Option(names = {"--query-file-cp1251"}, description = "CP1251 查询文件，每行一条查询")
            private Path cp1251Path;

            Path path() {
                return utf8Path != null ? utf8Path : cp1251Path;
            }

            Charset charset() {
                return utf8Path != null ? Constants.DEFAULT_QUERY_CHARSET : Constants.CP1251_CHARSET;
            }
        }

        @Override
        public Integer call() {
            IndexConfig config = main.newConfig();
            config.setIndexPath(indexPath);
            if (queryFile != null) {
                config.setQueryCharset(queryFile.charset());
            }
            logger.debug("query: index={}, storage={}, format={}, queryFile={}, queryCharset={}",
                config.getIndexPath(), config.getStorageFormat(), format,
                queryFile == null ? null : queryFile.path(), config.getQueryCharset());

            try {
                List<List<String>> queries = collectQueries(config.getQueryCharset());
                InvertedIndex index = InvertedIndex.load(config.getIndexPath(), config.getStorageFormat().createPolicy());
                QueryEngine queryEngine = new QueryEngine(index);

                List<QueryAnswer> answers = new ArrayList<>(queries.size());
                for (List<String> query : queries) {
                    answers.add(new QueryAnswer(query, queryEngine.query(query)));
                }

                if ("json".equalsIgnoreCase(format)) {
                    printJsonAnswers(answers);
                } else {
                    printTextAnswers(answers);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                logger.debug("查询失败详情", exception);
                return 1;
            }
        }

        /**
         * 命令行词项优先；其次读取查询文件；都未指定时从标准输入读取。
         */
        private List<List<String>> collectQueries(Charset charset) throws IOException {
            if (wordQueries != null && !wordQueries.isEmpty()) {
                List<List<String>> queries = new ArrayList<>(wordQueries.size());
                for (WordQuery wordQuery : wordQueries) {
                    queries.add(List.copyOf(wordQuery.words));
                }
                logger.info("读取命令行查询 {}", queries);
                return queries;
            }
            if (queryFile != null) {
                logger.info("从 {} 读取查询", queryFile.path());
                try (BufferedReader reader = Files.newBufferedReader(queryFile.path(), charset)) {
                    return readQueries(reader);
                }
            }
            logger.info("从标准输入读取查询");
            return readQueries(new BufferedReader(new InputStreamReader(System.in, charset)));
        }

        private List<List<String>> readQueries(BufferedReader reader) throws IOException {
            WhitespaceTokenizer tokenizer = new WhitespaceTokenizer();
            List<List<String>> queries = new ArrayList<>();
            String line;
            while ((line = reader.readLine()) != null) {
                queries.add(tokenizer.tokenize(line));
            }
            return queries;
        }

        private void printTextAnswers(List<QueryAnswer> answers) {
            for (QueryAnswer answer : answers) {
                System.out.println(String.join(Constants.ANSWER_SEPARATOR, answer.documents()));
            }
        }

        private void printJsonAnswers(List<QueryAnswer> answers) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(answers));
        }
    }
}
