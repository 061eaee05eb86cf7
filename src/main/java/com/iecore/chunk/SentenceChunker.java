package com.iecore.chunk;

import com.iecore.document.IeDocument;
import com.iecore.preprocess.PreprocessStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 以句子为单位切分文档：逐句切分，或按句子滑动窗口生成重叠分块。
 */
public class SentenceChunker {
    private static final Logger logger = LoggerFactory.getLogger(SentenceChunker.class);

    private final ChunkBuilder chunkBuilder;
    private final ChunkTextExtractor textExtractor;

    public SentenceChunker(ChunkBuilder chunkBuilder) {
        this(chunkBuilder, new ChunkTextExtractor());
    }

    public SentenceChunker(ChunkBuilder chunkBuilder, ChunkTextExtractor textExtractor) {
        this.chunkBuilder = chunkBuilder;
        this.textExtractor = textExtractor;
    }

    /**
     * 每个句子生成一个分块，分块之间不重叠。
     */
    public List<TextChunk> bySentence(IeDocument document) {
        return slidingWindow(document, 1, 1);
    }

    /**
     * 按句子滑动窗口生成分块，最后一个窗口截断到文档末尾。
     *
     * @param windowSentences 每个窗口包含的句子数
     * @param strideSentences 窗口每次前进的句子数，不超过窗口大小
     * @throws IllegalStateException 文档尚未分句，或分句后重新分词导致边界过期
     */
    public List<TextChunk> slidingWindow(IeDocument document, int windowSentences, int strideSentences) {
        if (windowSentences < 1) {
            throw new IllegalArgumentException("windowSentences必须>=1: " + windowSentences);
        }
        if (strideSentences < 1 || strideSentences > windowSentences) {
            throw new IllegalArgumentException("strideSentences必须在[1, " + windowSentences + "]内: " + strideSentences);
        }
        if (!document.getPreprocessMetadata().containsKey(PreprocessStage.SEGMENTATION.stageName())) {
            throw new IllegalStateException("文档尚未分句: " + document.getHumanIdentifier());
        }

        List<Integer> sentences = document.getSentences();
        int tokenCount = document.getTokenCount();
        if (sentences.isEmpty() || sentences.get(sentences.size() - 1) != tokenCount) {
            throw new IllegalStateException("分句结果已过期，末尾边界与token数不一致: doc="
                + document.getHumanIdentifier() + ", tokens=" + tokenCount + ", sentences=" + sentences);
        }
        int sentenceCount = sentences.size() - 1;
        List<TextChunk> chunks = new ArrayList<>();
        for (int first = 0; first < sentenceCount; first += strideSentences) {
            int last = Math.min(first + windowSentences, sentenceCount);
            int tokenOffset = sentences.get(first);
            int tokenOffsetEnd = sentences.get(last);
            String text = textExtractor.extract(document, tokenOffset, tokenOffsetEnd);
            chunks.add(chunkBuilder.build(document, tokenOffset, tokenOffsetEnd, text));
            if (last == sentenceCount) {
                break;
            }
        }
        logger.debug("句子分块完成: doc={}, window={}, stride={}, chunks={}",
            document.getHumanIdentifier(), windowSentences, strideSentences, chunks.size());
        return chunks;
    }
}
