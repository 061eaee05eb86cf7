package com.iecore.cli;

import com.iecore.document.Entity;
import com.iecore.document.EntityKind;
import com.iecore.document.EntityOccurrence;
import com.iecore.document.IeDocument;
import com.iecore.preprocess.PreprocessStage;
import com.iecore.preprocess.PreprocessState;
import com.iecore.store.DocumentTable;
import com.iecore.store.EntityTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 把导入结构写入文档表与实体表，各阶段结果经 PreprocessState 校验。
 */
public class DocumentImporter {
    private static final Logger logger = LoggerFactory.getLogger(DocumentImporter.class);

    private final PreprocessState preprocessState;
    private final DocumentTable documentTable;
    private final EntityTable entityTable;

    public DocumentImporter(PreprocessState preprocessState, DocumentTable documentTable, EntityTable entityTable) {
        this.preprocessState = preprocessState;
        this.documentTable = documentTable;
        this.entityTable = entityTable;
    }

    public IeDocument importDocument(DocumentImport source) {
        IeDocument document = new IeDocument(source.humanIdentifier(), source.text());
        document.setTitle(source.title());
        document.setUrl(source.url());
        if (source.metadata() != null) {
            source.metadata().forEach(document::putMetadata);
        }

        if (source.tokens() != null) {
            preprocessState.setResult(document, PreprocessStage.TOKENIZATION, source.tokens());
        }
        if (source.offsets() != null) {
            document.setOffsets(source.offsets());
        }
        if (source.sentences() != null) {
            preprocessState.setResult(document, PreprocessStage.SEGMENTATION, source.sentences());
        }
        if (source.postags() != null) {
            preprocessState.setResult(document, PreprocessStage.TAGGING, source.postags());
        }
        if (source.entities() != null) {
            // 全部实体与出现构造成功后才写库
            List<Entity> entities = new ArrayList<>(source.entities().size());
            List<EntityOccurrence> occurrences = new ArrayList<>(source.entities().size());
            for (DocumentImport.Mention mention : source.entities()) {
                entities.add(new Entity(mention.key(), mention.canonicalForm(), EntityKind.fromCode(mention.kind())));
                occurrences.add(new EntityOccurrence(mention.key(), mention.offset(), mention.alias()));
            }
            entityTable.upsertAll(entities);
            occurrences.forEach(document::addOccurrence);
            preprocessState.setResult(document, PreprocessStage.NERC, List.of());
        }

        documentTable.save(document);
        logger.info("文档已导入: id={}, tokens={}, entities={}",
            document.getHumanIdentifier(), document.getTokenCount(), document.getEntities().size());
        return document;
    }
}
