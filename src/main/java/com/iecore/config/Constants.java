package com.iecore.config;

/**
 * 全局常量定义
 *
 * 包含分块参数与存储参数的默认值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 分块参数 ====================
    /** 滑动窗口默认包含的句子数 */
    public static final int DEFAULT_WINDOW_SENTENCES = 3;
    /** 滑动窗口默认步长（句子数） */
    public static final int DEFAULT_STRIDE_SENTENCES = 1;
    /** 无字符偏移时拼接 token 的分隔符 */
    public static final String TOKEN_JOIN_SEPARATOR = " ";

    // ==================== 存储参数 ====================
    /** SQLite 数据库文件名 */
    public static final String DATABASE_FILE_NAME = "iecore.db";
    /** 默认数据目录 */
    public static final String DEFAULT_DATA_DIR = "./data";
}
