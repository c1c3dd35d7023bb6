package org.learningjava.reorderfields.application.port;

import org.learningjava.reorderfields.domain.model.record.AggregateInitModel;
import org.learningjava.reorderfields.domain.model.record.ConstructorModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.SourceCorpus;

import java.util.List;

/**
 * Structural view of a source corpus.
 */
public interface SourceModelPort {

    /**
     * @throws org.learningjava.reorderfields.domain.model.diagnostic.ReorderException
     *         {@code DEFINITION_NOT_FOUND} or {@code AMBIGUOUS_DEFINITION}
     */
    RecordModel findDefinition(String recordName, SourceCorpus corpus);

    List<ConstructorModel> constructorsOf(RecordModel record, SourceCorpus corpus);

    List<AggregateInitModel> aggregateInitializersOf(RecordModel record, SourceCorpus corpus);
}
