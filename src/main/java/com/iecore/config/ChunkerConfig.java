package com.iecore.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class ChunkerConfig {
    private Path dataDir = Paths.get(Constants.DEFAULT_DATA_DIR);
    private int windowSentences = Constants.DEFAULT_WINDOW_SENTENCES;
    private int strideSentences = Constants.DEFAULT_STRIDE_SENTENCES;

    public Path getDataDir() {
        return dataDir;
    }

    public void setDataDir(Path dataDir) {
        this.dataDir = dataDir;
    }

    /**
     * 数据库文件路径，位于数据目录下。
     */
    public Path getDatabasePath() {
        return dataDir.resolve(Constants.DATABASE_FILE_NAME);
    }

    public int getWindowSentences() {
        return windowSentences;
    }

    public void setWindowSentences(int windowSentences) {
        this.windowSentences = windowSentences;
    }

    public int getStrideSentences() {
        return strideSentences;
    }

    public void setStrideSentences(int strideSentences) {
        this.strideSentences = strideSentences;
    }

    /**
     * 使用默认配置创建实例
     */
    public static ChunkerConfig defaults() {
        return new ChunkerConfig();
    }
}
