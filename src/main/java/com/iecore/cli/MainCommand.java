package com.iecore.cli;

import com.iecore.chunk.ChunkBuilder;
import com.iecore.chunk.ChunkTextExtractor;
import com.iecore.chunk.EntityInChunk;
import com.iecore.chunk.SentenceChunker;
import com.iecore.chunk.TextChunk;
import com.iecore.config.ChunkerConfig;
import com.iecore.config.Constants;
import com.iecore.document.IeDocument;
import com.iecore.preprocess.PreprocessStage;
import com.iecore.preprocess.PreprocessState;
import com.iecore.store.DocumentTable;
import com.iecore.store.EntityTable;
import com.iecore.store.JsonCodec;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "iecore",
    description = "📄 文档分块与预处理状态工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ImportSubcommand.class,
        MainCommand.ChunkSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--data-dir"}, description = "数据目录路径", defaultValue = Constants.DEFAULT_DATA_DIR)
    private Path dataDir;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📄 文档分块与预处理状态工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    ChunkerConfig buildConfig() {
        ChunkerConfig config = ChunkerConfig.defaults();
        if (dataDir != null) {
            config.setDataDir(dataDir);
        }
        return config;
    }

    @Command(name = "import", description = "📥 导入预处理后的文档 JSON")
    static class ImportSubcommand implements Callable<Integer> {

        @Parameters(description = "文档 JSON 文件", arity = "1")
        private Path sourceFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            ChunkerConfig config = main.buildConfig();
            try {
                Files.createDirectories(config.getDataDir());
                DocumentImport source = JsonCodec.mapper().readValue(sourceFile.toFile(), DocumentImport.class);
                try (DocumentTable documentTable = new DocumentTable(config.getDatabasePath());
                     EntityTable entityTable = new EntityTable(config.getDatabasePath())) {
                    DocumentImporter importer = new DocumentImporter(new PreprocessState(), documentTable, entityTable);
                    IeDocument document = importer.importDocument(source);
                    System.out.println("✅ 导入完成: " + document.getHumanIdentifier());
                    System.out.println("   token数: " + document.getTokenCount());
                    System.out.println("   实体出现数: " + document.getEntities().size());
                    return 0;
                }
            } catch (IOException | RuntimeException exception) {
                System.err.println("❌ 导入失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "chunk", description = "✂️ 按 token 区间或句子窗口生成分块")
    static class ChunkSubcommand implements Callable<Integer> {

        @Parameters(description = "文档标识", arity = "1")
        private String identifier;

        @Option(names = {"--from"}, description = "起始 token 偏移（含）")
        private Integer from;

        @Option(names = {"--to"}, description = "结束 token 偏移（不含）")
        private Integer to;

        @Option(names = {"-w", "--window"}, description = "窗口句子数", defaultValue = "" + Constants.DEFAULT_WINDOW_SENTENCES)
        private int window;

        @Option(names = {"-s", "--stride"}, description = "窗口步长（句子数）", defaultValue = "" + Constants.DEFAULT_STRIDE_SENTENCES)
        private int stride;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            ChunkerConfig config = main.buildConfig();
            config.setWindowSentences(window);
            config.setStrideSentences(stride);
            try (DocumentTable documentTable = new DocumentTable(config.getDatabasePath());
                 EntityTable entityTable = new EntityTable(config.getDatabasePath())) {
                IeDocument document = documentTable.findByIdentifier(identifier)
                    .orElseThrow(() -> new IllegalStateException("文档不存在: " + identifier));
                List<TextChunk> chunks = buildChunks(document, new ChunkBuilder(entityTable), config);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(chunks);
                } else {
                    printTextResult(chunks);
                }
                return 0;
            } catch (IOException | RuntimeException exception) {
                System.err.println("❌ 分块失败: " + exception.getMessage());
                return 1;
            }
        }

        private List<TextChunk> buildChunks(IeDocument document, ChunkBuilder chunkBuilder, ChunkerConfig config) {
            if (from != null || to != null) {
                int start = from == null ? 0 : from;
                int end = to == null ? document.getTokenCount() : to;
                boolean validRange = start >= 0 && start <= end && end <= document.getTokenCount();
                // 区间非法时交给 ChunkBuilder 抛出 InvalidRangeException
                String text = validRange ? new ChunkTextExtractor().extract(document, start, end) : "";
                return List.of(chunkBuilder.build(document, start, end, text));
            }
            return new SentenceChunker(chunkBuilder)
                .slidingWindow(document, config.getWindowSentences(), config.getStrideSentences());
        }

        private void printTextResult(List<TextChunk> chunks) {
            if (chunks.isEmpty()) {
                System.out.println("⚠️ 没有生成任何分块");
                return;
            }
            int rank = 1;
            for (TextChunk chunk : chunks) {
                System.out.println("─────────────────────────────────");
                System.out.printf("%d. [%d, %d) %s%n", rank++, chunk.offset(), chunk.offsetEnd(), chunk.text().replace("\n", " "));
                for (EntityInChunk entity : chunk.entities()) {
                    String surface = entity.alias() == null ? entity.canonicalForm() : entity.alias();
                    System.out.printf("   @%d %s -> %s (%s)%n", entity.offset(), surface, entity.key(), entity.kind().label());
                }
            }
            System.out.println();
            System.out.println("📊 共 " + chunks.size() + " 个分块");
        }

        private void printJsonResult(List<TextChunk> chunks) throws IOException {
            System.out.println(JsonCodec.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(chunks));
        }
    }

    @Command(name = "status", description = "📊 查看文档预处理状态")
    static class StatusSubcommand implements Callable<Integer> {

        @Parameters(description = "文档标识", arity = "1")
        private String identifier;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            ChunkerConfig config = main.buildConfig();
            try (DocumentTable documentTable = new DocumentTable(config.getDatabasePath())) {
                IeDocument document = documentTable.findByIdentifier(identifier)
                    .orElseThrow(() -> new IllegalStateException("文档不存在: " + identifier));
                PreprocessState preprocessState = new PreprocessState();

                System.out.println("📊 预处理状态: " + document.getHumanIdentifier());
                System.out.println("═══════════");
                for (PreprocessStage stage : PreprocessStage.values()) {
                    String doneAt = preprocessState.doneAt(document, stage).map(Instant::toString).orElse("未完成");
                    int size = preprocessState.getResult(document, stage).map(result -> result.size()).orElse(0);
                    System.out.printf("%-13s %-32s %d%n", stage.stageName(), doneAt, size);
                }
                return 0;
            } catch (RuntimeException exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
