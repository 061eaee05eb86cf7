package com.iecore.chunk;

import com.iecore.config.Constants;
import com.iecore.document.IeDocument;

import java.util.List;

/**
 * 根据 token 字符偏移从原文截取分块文本。
 *
 * 字符偏移缺失或与原文不一致时退化为以空格拼接 token。
 */
public class ChunkTextExtractor {

    public String extract(IeDocument document, int tokenOffset, int tokenOffsetEnd) {
        List<String> tokens = document.getTokens();
        if (tokenOffset >= tokenOffsetEnd) {
            return "";
        }
        String text = document.getText();
        List<Integer> offsets = document.getOffsets();
        if (text == null || offsets.size() != tokens.size()) {
            return joinTokens(tokens, tokenOffset, tokenOffsetEnd);
        }

        int charStart = offsets.get(tokenOffset);
        int charEnd;
        if (tokenOffsetEnd < tokens.size()) {
            // 截到下一个 token 起点，再去掉尾部空白
            charEnd = offsets.get(tokenOffsetEnd);
        } else {
            int lastIndex = tokenOffsetEnd - 1;
            charEnd = offsets.get(lastIndex) + tokens.get(lastIndex).length();
        }
        if (charStart > charEnd || charEnd > text.length()) {
            return joinTokens(tokens, tokenOffset, tokenOffsetEnd);
        }
        return text.substring(charStart, charEnd).stripTrailing();
    }

    private String joinTokens(List<String> tokens, int tokenOffset, int tokenOffsetEnd) {
        return String.join(Constants.TOKEN_JOIN_SEPARATOR, tokens.subList(tokenOffset, tokenOffsetEnd));
    }
}
